package com.suraksha.safetymonitor.service;

import com.suraksha.safetymonitor.entity.SafeZone;
import com.suraksha.safetymonitor.model.SafetyState;
import com.suraksha.safetymonitor.model.SafetyTransition;
import com.suraksha.safetymonitor.model.SafetyUpdate;
import com.suraksha.safetymonitor.model.UserSafetyStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pure transition function of the per-user safe-zone state machine.
 * Both the report path and the background sweep go through {@link #advance}.
 *
 * <pre>
 *  (none) ──first report──▶ INSIDE | OUTSIDE_GRACE          BASELINE, never alerts
 *  INSIDE ──no zone hit──▶ OUTSIDE_GRACE                    LEFT, timer starts
 *  OUTSIDE_GRACE ──zone hit──▶ INSIDE                       ENTERED
 *  OUTSIDE_GRACE ──elapsed ≥ grace──▶ OUTSIDE_ALERTED        ALERTED, once per excursion
 *  OUTSIDE_ALERTED ──zone hit──▶ INSIDE                     REENTERED, alert cleared
 *  OUTSIDE_ALERTED ──no zone hit──▶ OUTSIDE_ALERTED         UNCHANGED
 * </pre>
 *
 * The grace period of an excursion is the smallest alertThresholdSeconds among
 * the zones the user was last inside. With no such history (first report
 * already outside) the configured default applies.
 */
public final class SafeZoneStateMachine {

    private SafeZoneStateMachine() {
    }

    /**
     * @param previous                current status, null if the user has none yet
     * @param userId                  the user being evaluated
     * @param zoneHits                active zones containing the user's position
     * @param latitude                position the hits were computed for
     * @param longitude               position the hits were computed for
     * @param now                     evaluation time
     * @param defaultThresholdSeconds grace period when there is no zone history
     */
    public static SafetyUpdate advance(UserSafetyStatus previous, String userId, List<SafeZone> zoneHits,
                                       double latitude, double longitude, Instant now,
                                       long defaultThresholdSeconds) {
        boolean inside = !zoneHits.isEmpty();

        UserSafetyStatus.UserSafetyStatusBuilder next = previous == null
                ? UserSafetyStatus.builder().userId(userId)
                : previous.toBuilder();
        next.lastUpdate(now)
            .lastLatitude(latitude)
            .lastLongitude(longitude);

        if (inside) {
            SafetyTransition transition;
            if (previous == null) {
                transition = SafetyTransition.BASELINE;
            } else if (previous.getState() == SafetyState.INSIDE) {
                transition = SafetyTransition.UNCHANGED;
            } else if (previous.getState() == SafetyState.OUTSIDE_ALERTED) {
                transition = SafetyTransition.REENTERED;
            } else {
                transition = SafetyTransition.ENTERED;
            }
            next.state(SafetyState.INSIDE)
                .inSafeZone(true)
                .currentSafeZoneIds(zoneIds(zoneHits))
                .outsideSinceTimestamp(null)
                .alertSent(false)
                .graceThresholdSeconds(minThreshold(zoneHits));
            return result(previous, next.build(), transition);
        }

        next.inSafeZone(false).currentSafeZoneIds(Set.of());

        if (previous == null) {
            next.state(SafetyState.OUTSIDE_GRACE)
                .outsideSinceTimestamp(now)
                .alertSent(false)
                .graceThresholdSeconds(defaultThresholdSeconds);
            return result(null, next.build(), SafetyTransition.BASELINE);
        }

        switch (previous.getState()) {
            case INSIDE:
                // grace threshold carries over from the zones just left
                next.state(SafetyState.OUTSIDE_GRACE)
                    .outsideSinceTimestamp(now)
                    .alertSent(false);
                return result(previous, next.build(), SafetyTransition.LEFT);

            case OUTSIDE_GRACE:
                Duration elapsed = Duration.between(previous.getOutsideSinceTimestamp(), now);
                if (elapsed.compareTo(Duration.ofSeconds(previous.getGraceThresholdSeconds())) >= 0) {
                    next.state(SafetyState.OUTSIDE_ALERTED).alertSent(true);
                    return result(previous, next.build(), SafetyTransition.ALERTED);
                }
                return result(previous, next.build(), SafetyTransition.UNCHANGED);

            default:
                return result(previous, next.build(), SafetyTransition.UNCHANGED);
        }
    }

    private static SafetyUpdate result(UserSafetyStatus previous, UserSafetyStatus current,
                                       SafetyTransition transition) {
        return SafetyUpdate.builder()
                .previous(previous)
                .current(current)
                .transition(transition)
                .build();
    }

    private static Set<Long> zoneIds(List<SafeZone> zones) {
        Set<Long> ids = new LinkedHashSet<>();
        for (SafeZone zone : zones) {
            ids.add(zone.getId());
        }
        return Set.copyOf(ids);
    }

    private static long minThreshold(List<SafeZone> zones) {
        long min = Long.MAX_VALUE;
        for (SafeZone zone : zones) {
            min = Math.min(min, zone.getAlertThresholdSeconds());
        }
        return min;
    }
}
