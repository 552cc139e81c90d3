package com.suraksha.safetymonitor.model;

/**
 * Safe-zone membership state of a single user.
 */
public enum SafetyState {

    /** Inside at least one active safe zone */
    INSIDE,

    /** Outside all zones, grace timer running, no alert yet */
    OUTSIDE_GRACE,

    /** Outside all zones past the grace period; the single alert for this excursion went out */
    OUTSIDE_ALERTED
}
