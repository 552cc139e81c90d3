package com.suraksha.safetymonitor.service;

import com.suraksha.safetymonitor.entity.SafeZone;
import com.suraksha.safetymonitor.model.SafetyState;
import com.suraksha.safetymonitor.model.SafetyTransition;
import com.suraksha.safetymonitor.model.SafetyUpdate;
import com.suraksha.safetymonitor.model.UserSafetyStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Transition table of the safe-zone state machine, one step at a time.
 */
class SafeZoneStateMachineTest {

    private static final String USER = "user-1";
    private static final long DEFAULT_THRESHOLD = 300;
    private static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");

    private static final SafeZone HOME = zone(1L, 60L);
    private static final SafeZone MARKET = zone(2L, 30L);

    private static SafeZone zone(long id, long threshold) {
        return SafeZone.builder()
                .id(id)
                .name("Zone " + id)
                .latitude(28.6)
                .longitude(77.2)
                .radiusMeters(500.0)
                .alertThresholdSeconds(threshold)
                .active(true)
                .build();
    }

    private static SafetyUpdate step(UserSafetyStatus previous, List<SafeZone> hits, long secondsAfterT0) {
        return SafeZoneStateMachine.advance(previous, USER, hits, 28.6, 77.2,
                T0.plusSeconds(secondsAfterT0), DEFAULT_THRESHOLD);
    }

    @Test
    @DisplayName("First report inside a zone is a baseline INSIDE")
    void firstReportInside_baselineInside() {
        SafetyUpdate update = step(null, List.of(HOME, MARKET), 0);

        UserSafetyStatus status = update.getCurrent();
        assertThat(update.getTransition()).isEqualTo(SafetyTransition.BASELINE);
        assertThat(status.getState()).isEqualTo(SafetyState.INSIDE);
        assertThat(status.isInSafeZone()).isTrue();
        assertThat(status.getCurrentSafeZoneIds()).containsExactlyInAnyOrder(1L, 2L);
        assertThat(status.getGraceThresholdSeconds()).isEqualTo(30L);
        assertThat(status.isAlertSent()).isFalse();
    }

    @Test
    @DisplayName("First report outside starts a grace period on the default threshold, never an alert")
    void firstReportOutside_graceWithDefaultThreshold() {
        SafetyUpdate update = step(null, List.of(), 0);

        assertThat(update.getTransition()).isEqualTo(SafetyTransition.BASELINE);
        assertThat(update.getCurrent().getState()).isEqualTo(SafetyState.OUTSIDE_GRACE);
        assertThat(update.getCurrent().getOutsideSinceTimestamp()).isEqualTo(T0);
        assertThat(update.getCurrent().getGraceThresholdSeconds()).isEqualTo(DEFAULT_THRESHOLD);
        assertThat(update.getCurrent().isAlertSent()).isFalse();
    }

    @Test
    @DisplayName("Leaving uses the minimum threshold of the zones last inside")
    void leaving_usesMinimumThreshold() {
        UserSafetyStatus inside = step(null, List.of(HOME, MARKET), 0).getCurrent();

        SafetyUpdate left = step(inside, List.of(), 10);
        assertThat(left.getTransition()).isEqualTo(SafetyTransition.LEFT);
        assertThat(left.getCurrent().getOutsideSinceTimestamp()).isEqualTo(T0.plusSeconds(10));

        SafetyUpdate beforeThreshold = step(left.getCurrent(), List.of(), 39);
        assertThat(beforeThreshold.getTransition()).isEqualTo(SafetyTransition.UNCHANGED);
        assertThat(beforeThreshold.getCurrent().getState()).isEqualTo(SafetyState.OUTSIDE_GRACE);

        SafetyUpdate atThreshold = step(beforeThreshold.getCurrent(), List.of(), 40);
        assertThat(atThreshold.getTransition()).isEqualTo(SafetyTransition.ALERTED);
        assertThat(atThreshold.getCurrent().isAlertSent()).isTrue();
        assertThat(atThreshold.getCurrent().isInSafeZone()).isFalse();
    }

    @Test
    @DisplayName("Once alerted, staying outside changes nothing")
    void alerted_staysAlertedWithoutNewTransition() {
        UserSafetyStatus status = step(null, List.of(MARKET), 0).getCurrent();
        status = step(status, List.of(), 1).getCurrent();
        status = step(status, List.of(), 31).getCurrent();
        assertThat(status.getState()).isEqualTo(SafetyState.OUTSIDE_ALERTED);

        SafetyUpdate later = step(status, List.of(), 600);
        assertThat(later.getTransition()).isEqualTo(SafetyTransition.UNCHANGED);
        assertThat(later.getCurrent().isAlertSent()).isTrue();
        assertThat(later.getCurrent().getOutsideSinceTimestamp()).isEqualTo(T0.plusSeconds(1));
    }

    @Test
    @DisplayName("Re-entering after an alert clears alertSent and outsideSince")
    void reentry_clearsAlert() {
        UserSafetyStatus status = step(null, List.of(MARKET), 0).getCurrent();
        status = step(status, List.of(), 1).getCurrent();
        status = step(status, List.of(), 31).getCurrent();

        SafetyUpdate back = step(status, List.of(HOME), 40);

        assertThat(back.getTransition()).isEqualTo(SafetyTransition.REENTERED);
        assertThat(back.getCurrent().getState()).isEqualTo(SafetyState.INSIDE);
        assertThat(back.getCurrent().isAlertSent()).isFalse();
        assertThat(back.getCurrent().getOutsideSinceTimestamp()).isNull();
        assertThat(back.getCurrent().getGraceThresholdSeconds()).isEqualTo(60L);
    }

    @Test
    @DisplayName("Returning during the grace period is a plain ENTERED")
    void returnDuringGrace_entered() {
        UserSafetyStatus status = step(null, List.of(MARKET), 0).getCurrent();
        status = step(status, List.of(), 1).getCurrent();

        SafetyUpdate back = step(status, List.of(MARKET), 20);

        assertThat(back.getTransition()).isEqualTo(SafetyTransition.ENTERED);
        assertThat(back.getCurrent().isAlertSent()).isFalse();
    }

    @Test
    @DisplayName("Moving between zones while inside keeps INSIDE and updates the zone set")
    void zoneToZone_unchangedState() {
        UserSafetyStatus status = step(null, List.of(HOME), 0).getCurrent();

        SafetyUpdate moved = step(status, List.of(MARKET), 5);

        assertThat(moved.getTransition()).isEqualTo(SafetyTransition.UNCHANGED);
        assertThat(moved.isZoneSetChanged()).isTrue();
        assertThat(moved.getCurrent().getCurrentSafeZoneIds()).containsExactly(2L);
    }
}
