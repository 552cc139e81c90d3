package com.suraksha.safetymonitor.service;

import com.suraksha.safetymonitor.config.SafetyProperties;
import com.suraksha.safetymonitor.entity.SafeZone;
import com.suraksha.safetymonitor.model.SafetyState;
import com.suraksha.safetymonitor.model.SafetyTransition;
import com.suraksha.safetymonitor.model.SafetyUpdate;
import com.suraksha.safetymonitor.model.TelemetryEvent;
import com.suraksha.safetymonitor.model.Topic;
import com.suraksha.safetymonitor.model.UserSafetyStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SafeZoneMonitor.
 *
 * Test cases:
 *  1. Leaving Z (threshold 30s) and staying out 40s alerts exactly once, with one alertSent=true broadcast
 *  2. Returning before the threshold never alerts
 *  3. Staying outside after the alert never alerts again
 *  4. Unchanged status is re-broadcast at most every status-refresh-seconds
 *  5. Out-of-order and duplicate reports leave the status untouched, replays of older events included
 *  6. The sweep alerts users who stopped reporting mid-grace, and evicts stale users
 *  7. The sweep measures grace in the client's clock when the client clock runs slow
 */
@ExtendWith(MockitoExtension.class)
class SafeZoneMonitorTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private SafeZoneService     safeZoneService;
    @Mock private RuleEvaluator       ruleEvaluator;
    @Mock private AlertBroadcaster    broadcaster;
    @Mock private NotificationService notificationService;
    @Mock private Clock               clock;

    private SafeZoneMonitor monitor;

    // ── Test fixtures ─────────────────────────────────────────────────────────

    private static final String USER = "user-1";
    private static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");

    /** Zone Z: center 28.6/77.2, radius 500 m, threshold 30 s */
    private static final SafeZone Z = SafeZone.builder()
            .id(1L)
            .name("Z")
            .latitude(28.6)
            .longitude(77.2)
            .radiusMeters(500.0)
            .alertThresholdSeconds(30L)
            .active(true)
            .build();

    @BeforeEach
    void setUp() {
        SafetyProperties properties = new SafetyProperties();
        properties.getSafeZone().setStatusRefreshSeconds(30);
        monitor = new SafeZoneMonitor(safeZoneService, ruleEvaluator, broadcaster,
                notificationService, properties, clock);
    }

    // ── Helper builders ───────────────────────────────────────────────────────

    private SafetyUpdate report(long secondsAfterT0, List<SafeZone> hits) {
        return report(UUID.randomUUID().toString(), secondsAfterT0, hits);
    }

    private SafetyUpdate report(String eventId, long secondsAfterT0, List<SafeZone> hits) {
        return report(eventId, secondsAfterT0, 0, hits);
    }

    /** Report whose client clock lags server time by {@code clientLagSeconds} */
    private SafetyUpdate report(String eventId, long secondsAfterT0, long clientLagSeconds, List<SafeZone> hits) {
        Instant receivedAt = T0.plusSeconds(secondsAfterT0);
        TelemetryEvent event = TelemetryEvent.builder()
                .eventId(eventId)
                .userId(USER)
                .latitude(hits.isEmpty() ? 28.7 : 28.6)
                .longitude(77.2)
                .timestamp(receivedAt.minusSeconds(clientLagSeconds))
                .receivedAt(receivedAt)
                .build();
        return monitor.onReport(event, hits);
    }

    private List<UserSafetyStatus> publishedStatuses() {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(broadcaster, atLeast(0)).publish(eq(Topic.USER_SAFETY_STATUS), captor.capture());
        return captor.getAllValues().stream().map(UserSafetyStatus.class::cast).toList();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Grace period and alerting
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Leaving Z and staying out 40s: OutsideGrace at t=0, OutsideAlerted at t=40, one alert broadcast")
    void leaveAndStayOut_alertsOnce() {
        report(-10, List.of(Z));

        SafetyUpdate left = report(0, List.of());
        assertThat(left.getTransition()).isEqualTo(SafetyTransition.LEFT);
        assertThat(left.getCurrent().getState()).isEqualTo(SafetyState.OUTSIDE_GRACE);

        SafetyUpdate alerted = report(40, List.of());
        assertThat(alerted.getTransition()).isEqualTo(SafetyTransition.ALERTED);
        assertThat(alerted.getCurrent().getState()).isEqualTo(SafetyState.OUTSIDE_ALERTED);
        assertThat(alerted.isEmitted()).isTrue();

        List<UserSafetyStatus> statuses = publishedStatuses();
        assertThat(statuses).hasSize(3);
        assertThat(statuses).filteredOn(UserSafetyStatus::isAlertSent).hasSize(1);
        verify(notificationService, times(1)).sendOutsideSafeZoneAlert(alerted.getCurrent());
    }

    @Test
    @DisplayName("Returning before the threshold never reaches OutsideAlerted")
    void returnBeforeThreshold_noAlert() {
        report(0, List.of(Z));
        report(5, List.of());
        report(20, List.of());
        SafetyUpdate back = report(34, List.of(Z));

        assertThat(back.getTransition()).isEqualTo(SafetyTransition.ENTERED);
        assertThat(back.getCurrent().isInSafeZone()).isTrue();
        assertThat(publishedStatuses()).noneMatch(UserSafetyStatus::isAlertSent);
        verifyNoInteractions(notificationService);
    }

    @Test
    @DisplayName("Continuously outside after the alert: no second alert, re-entry notifies once")
    void continuouslyOutside_atMostOneAlertPerExcursion() {
        report(0, List.of(Z));
        report(1, List.of());
        for (long t = 31; t <= 300; t += 15) {
            report(t, List.of());
        }

        verify(notificationService, times(1)).sendOutsideSafeZoneAlert(any());

        SafetyUpdate back = report(310, List.of(Z));
        assertThat(back.getTransition()).isEqualTo(SafetyTransition.REENTERED);
        assertThat(back.getCurrent().isAlertSent()).isFalse();
        verify(notificationService).sendSafeReturnNotification(back.getCurrent());

        // second excursion alerts again
        report(320, List.of());
        report(360, List.of());
        verify(notificationService, times(2)).sendOutsideSafeZoneAlert(any());
    }

    // ════════════════════════════════════════════════════════════════════════
    // Emission throttling
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Stable INSIDE reports every 5s are re-broadcast only every 30s")
    void stableStatus_throttled() {
        for (long t = 0; t <= 60; t += 5) {
            report(t, List.of(Z));
        }

        List<UserSafetyStatus> statuses = publishedStatuses();
        assertThat(statuses).extracting(UserSafetyStatus::getLastUpdate)
                .containsExactly(T0, T0.plusSeconds(30), T0.plusSeconds(60));
    }

    // ════════════════════════════════════════════════════════════════════════
    // Ordering and idempotency
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("A report older than the last accepted one is ignored")
    void outOfOrderReport_ignored() {
        report(10, List.of(Z));
        SafetyUpdate stale = report(5, List.of());

        assertThat(stale.isIgnored()).isTrue();
        UserSafetyStatus status = monitor.getStatus(USER).orElseThrow();
        assertThat(status.getState()).isEqualTo(SafetyState.INSIDE);
        assertThat(status.getLastReportAt()).isEqualTo(T0.plusSeconds(10));
        verify(broadcaster, times(1)).publish(eq(Topic.USER_SAFETY_STATUS), any());
    }

    @Test
    @DisplayName("A repeated event id is applied once")
    void duplicateEvent_appliedOnce() {
        report("evt-1", 0, List.of(Z));
        SafetyUpdate again = report("evt-1", 0, List.of(Z));

        assertThat(again.isDuplicate()).isTrue();
        assertThat(again.isEmitted()).isFalse();
        verify(broadcaster, times(1)).publish(eq(Topic.USER_SAFETY_STATUS), any());
    }

    @Test
    @DisplayName("Replaying an event id that is no longer the latest is a duplicate, not a stale report")
    void replayedOlderEvent_isDuplicate() {
        report("evt-1", 0, List.of(Z));
        report("evt-2", 10, List.of(Z));

        SafetyUpdate replay = report("evt-1", 0, List.of(Z));

        assertThat(replay.isDuplicate()).isTrue();
        assertThat(monitor.getStatus(USER).orElseThrow().getLastReportAt()).isEqualTo(T0.plusSeconds(10));
    }

    @Test
    @DisplayName("A stale report is ignored once and its replay is a duplicate")
    void staleReportReplay_isDuplicate() {
        report("evt-2", 10, List.of(Z));

        SafetyUpdate stale = report("evt-1", 5, List.of());
        SafetyUpdate replay = report("evt-1", 5, List.of());

        assertThat(stale.isIgnored()).isTrue();
        assertThat(stale.isDuplicate()).isFalse();
        assertThat(replay.isDuplicate()).isTrue();
        assertThat(monitor.getStatus(USER).orElseThrow().getState()).isEqualTo(SafetyState.INSIDE);
    }

    @Test
    @DisplayName("Only the most recent event ids are remembered")
    void recentEventIds_bounded() {
        for (int i = 0; i <= SafeZoneMonitor.RECENT_EVENT_IDS; i++) {
            report("evt-" + i, i, List.of(Z));
        }

        List<String> remembered = monitor.getStatus(USER).orElseThrow().getRecentEventIds();
        assertThat(remembered).hasSize(SafeZoneMonitor.RECENT_EVENT_IDS)
                .doesNotContain("evt-0")
                .endsWith("evt-" + SafeZoneMonitor.RECENT_EVENT_IDS);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Background sweep
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Sweep alerts a user who stopped reporting mid-grace")
    void sweep_alertsSilentUser() {
        report(0, List.of(Z));
        report(1, List.of());

        when(clock.instant()).thenReturn(T0.plusSeconds(45));
        when(safeZoneService.getActiveSafeZones()).thenReturn(List.of(Z));
        when(ruleEvaluator.matchSafeZones(anyDouble(), anyDouble(), anyCollection())).thenReturn(List.of());

        monitor.sweep();

        UserSafetyStatus status = monitor.getStatus(USER).orElseThrow();
        assertThat(status.getState()).isEqualTo(SafetyState.OUTSIDE_ALERTED);
        assertThat(status.getLastReportAt()).isEqualTo(T0.plusSeconds(1));
        verify(notificationService).sendOutsideSafeZoneAlert(status);

        // a later report does not alert again
        report(60, List.of());
        verify(notificationService, times(1)).sendOutsideSafeZoneAlert(any());
    }

    @Test
    @DisplayName("Sweep evicts users with no report for stale-after-minutes")
    void sweep_evictsStaleUsers() {
        report(0, List.of(Z));

        when(clock.instant()).thenReturn(T0.plus(Duration.ofMinutes(361)));
        when(safeZoneService.getActiveSafeZones()).thenReturn(List.of(Z));

        monitor.sweep();

        assertThat(monitor.getStatus(USER)).isEmpty();
        assertThat(monitor.trackedUsers()).isZero();
        verifyNoInteractions(ruleEvaluator);
    }

    @Test
    @DisplayName("Client clock 600s slow: sweep 5s after leaving keeps OutsideGrace, alerts after the threshold")
    void sweep_slowClientClock_measuresGraceInClientTime() {
        report("evt-1", 0, 600, List.of(Z));
        report("evt-2", 1, 600, List.of());

        when(safeZoneService.getActiveSafeZones()).thenReturn(List.of(Z));
        when(ruleEvaluator.matchSafeZones(anyDouble(), anyDouble(), anyCollection())).thenReturn(List.of());

        when(clock.instant()).thenReturn(T0.plusSeconds(6));
        monitor.sweep();

        UserSafetyStatus status = monitor.getStatus(USER).orElseThrow();
        assertThat(status.getState()).isEqualTo(SafetyState.OUTSIDE_GRACE);
        assertThat(status.isAlertSent()).isFalse();
        verifyNoInteractions(notificationService);

        when(clock.instant()).thenReturn(T0.plusSeconds(31));
        monitor.sweep();

        status = monitor.getStatus(USER).orElseThrow();
        assertThat(status.getState()).isEqualTo(SafetyState.OUTSIDE_ALERTED);
        assertThat(status.getLastUpdate()).isEqualTo(T0.plusSeconds(31 - 600));
        verify(notificationService).sendOutsideSafeZoneAlert(status);
    }
}
