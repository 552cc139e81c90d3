package com.suraksha.safetymonitor.model;

/**
 * What a single evaluation did to a user's {@link SafetyState}.
 */
public enum SafetyTransition {

    /** First report for the user, establishes state without alerting */
    BASELINE,

    /** OUTSIDE_GRACE to INSIDE */
    ENTERED,

    /** INSIDE to OUTSIDE_GRACE, grace timer started */
    LEFT,

    /** OUTSIDE_GRACE to OUTSIDE_ALERTED */
    ALERTED,

    /** OUTSIDE_ALERTED to INSIDE, alert cleared */
    REENTERED,

    UNCHANGED
}
