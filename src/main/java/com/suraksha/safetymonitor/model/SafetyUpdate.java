package com.suraksha.safetymonitor.model;

import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Result of advancing a user's safe-zone state machine by one step.
 */
@Value
@Builder(toBuilder = true)
public class SafetyUpdate {

    /** State before the step; null for a user's first report */
    UserSafetyStatus previous;

    UserSafetyStatus current;

    SafetyTransition transition;

    /** True when the step was skipped (duplicate event or out-of-order report) */
    boolean ignored;

    /** True when the event id was already applied; downstream consumers must treat the event as a no-op */
    boolean duplicate;

    /** True when the monitor decided to broadcast {@link #current} */
    boolean emitted;

    public boolean isStateChanged() {
        return transition != SafetyTransition.UNCHANGED;
    }

    /** Zone membership changed without changing state, e.g. moving from one zone into an adjacent one. */
    public boolean isZoneSetChanged() {
        return previous != null
                && !Objects.equals(previous.getCurrentSafeZoneIds(), current.getCurrentSafeZoneIds());
    }

    public static SafetyUpdate duplicate(UserSafetyStatus status) {
        return ignored(status).toBuilder().duplicate(true).build();
    }

    public static SafetyUpdate ignored(UserSafetyStatus status) {
        return SafetyUpdate.builder()
                .previous(status)
                .current(status)
                .transition(SafetyTransition.UNCHANGED)
                .ignored(true)
                .build();
    }
}
