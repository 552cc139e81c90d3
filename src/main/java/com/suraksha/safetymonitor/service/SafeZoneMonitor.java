package com.suraksha.safetymonitor.service;

import com.suraksha.safetymonitor.config.SafetyProperties;
import com.suraksha.safetymonitor.entity.SafeZone;
import com.suraksha.safetymonitor.model.SafetyState;
import com.suraksha.safetymonitor.model.SafetyTransition;
import com.suraksha.safetymonitor.model.SafetyUpdate;
import com.suraksha.safetymonitor.model.TelemetryEvent;
import com.suraksha.safetymonitor.model.Topic;
import com.suraksha.safetymonitor.model.UserSafetyStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Owns the live {@link UserSafetyStatus} of every reporting user.
 *
 * Concurrency: statuses live in a ConcurrentHashMap and every step runs inside
 * {@code compute(userId, ...)}, which serializes updates per user without a
 * global lock. Broadcasts and notifications go out after the step, outside
 * the map's bin lock.
 *
 * Timers: the grace period is re-checked lazily on the next report. The
 * background sweep catches users who stop reporting mid-grace, using the same
 * {@link SafeZoneStateMachine#advance} as the report path. Grace timestamps are
 * in the client's clock, so the sweep shifts wall time by the offset observed
 * when the last report arrived.
 *
 * Emission: every state change is broadcast on user-safety-status; an
 * unchanged status is re-broadcast at most once per status-refresh-seconds.
 */
@Service
@Slf4j
public class SafeZoneMonitor {

    private final SafeZoneService safeZoneService;
    private final RuleEvaluator ruleEvaluator;
    private final AlertBroadcaster broadcaster;
    private final NotificationService notificationService;
    private final SafetyProperties.SafeZone settings;
    private final Clock clock;

    /** Event ids remembered per user for replay detection */
    static final int RECENT_EVENT_IDS = 64;

    private final ConcurrentMap<String, UserSafetyStatus> statuses = new ConcurrentHashMap<>();

    public SafeZoneMonitor(SafeZoneService safeZoneService,
                           RuleEvaluator ruleEvaluator,
                           AlertBroadcaster broadcaster,
                           NotificationService notificationService,
                           SafetyProperties properties,
                           Clock clock) {
        this.safeZoneService = safeZoneService;
        this.ruleEvaluator = ruleEvaluator;
        this.broadcaster = broadcaster;
        this.notificationService = notificationService;
        this.settings = properties.getSafeZone();
        this.clock = clock;
    }

    /**
     * Applies one location report.
     *
     * An event id seen among the user's recent events is a duplicate. A report
     * older than the last accepted one is ignored (last write wins on client
     * timestamp) but its id is remembered. Either way the state is untouched.
     *
     * @param event    the normalized report
     * @param zoneHits active zones containing the reported point
     */
    public SafetyUpdate onReport(TelemetryEvent event, List<SafeZone> zoneHits) {
        Instant receivedAt = event.getReceivedAt() != null ? event.getReceivedAt() : event.getTimestamp();
        return apply(event.getUserId(), previous -> {
            if (previous != null) {
                if (event.getEventId() != null && previous.getRecentEventIds().contains(event.getEventId())) {
                    log.debug("Duplicate event {} for user {} — skipped", event.getEventId(), event.getUserId());
                    return SafetyUpdate.duplicate(previous);
                }
                if (event.getTimestamp().isBefore(previous.getLastReportAt())) {
                    log.debug("Out-of-order report for user {} ({} < {}) — skipped",
                            event.getUserId(), event.getTimestamp(), previous.getLastReportAt());
                    return SafetyUpdate.ignored(previous.toBuilder()
                            .recentEventIds(remember(previous.getRecentEventIds(), event.getEventId()))
                            .build());
                }
            }
            SafetyUpdate update = SafeZoneStateMachine.advance(previous, event.getUserId(), zoneHits,
                    event.getLatitude(), event.getLongitude(), event.getTimestamp(),
                    settings.getDefaultAlertThresholdSeconds());
            List<String> seen = previous == null ? List.of() : previous.getRecentEventIds();
            return update.toBuilder()
                    .current(update.getCurrent().toBuilder()
                            .lastReportAt(event.getTimestamp())
                            .lastReceivedAt(receivedAt)
                            .recentEventIds(remember(seen, event.getEventId()))
                            .build())
                    .build();
        });
    }

    /**
     * Re-evaluates users still inside their grace period against the wall clock,
     * then evicts statuses with no report for stale-after-minutes.
     *
     * Each user is evaluated at lastReportAt plus the wall time elapsed since that
     * report arrived, so a skewed client clock shifts both ends of the grace period.
     */
    @Scheduled(fixedDelayString = "${safety.safe-zone.sweep-interval-ms:30000}")
    public void sweep() {
        Instant now = clock.instant();
        List<SafeZone> zones = safeZoneService.getActiveSafeZones();
        int alerted = 0;

        for (String userId : new ArrayList<>(statuses.keySet())) {
            SafetyUpdate update = apply(userId, previous -> {
                if (previous == null) {
                    return null;
                }
                if (previous.getState() != SafetyState.OUTSIDE_GRACE || now.isBefore(previous.getLastReceivedAt())) {
                    return SafetyUpdate.ignored(previous);
                }
                Instant clientNow = previous.getLastReportAt()
                        .plus(Duration.between(previous.getLastReceivedAt(), now));
                if (clientNow.isBefore(previous.getLastUpdate())) {
                    return SafetyUpdate.ignored(previous);
                }
                List<SafeZone> hits = ruleEvaluator.matchSafeZones(
                        previous.getLastLatitude(), previous.getLastLongitude(), zones);
                return SafeZoneStateMachine.advance(previous, userId, hits,
                        previous.getLastLatitude(), previous.getLastLongitude(), clientNow,
                        settings.getDefaultAlertThresholdSeconds());
            });
            if (update != null && update.getTransition() == SafetyTransition.ALERTED) {
                alerted++;
            }
        }

        Instant staleBefore = now.minus(Duration.ofMinutes(settings.getStaleAfterMinutes()));
        int before = statuses.size();
        statuses.values().removeIf(status -> status.getLastReceivedAt().isBefore(staleBefore));
        int evicted = before - statuses.size();

        if (alerted > 0 || evicted > 0) {
            log.info("Safe-zone sweep — {} alert(s) raised, {} stale status(es) evicted, {} tracked",
                    alerted, evicted, statuses.size());
        }
    }

    public Optional<UserSafetyStatus> getStatus(String userId) {
        return Optional.ofNullable(statuses.get(userId));
    }

    public Collection<UserSafetyStatus> getAllStatuses() {
        return List.copyOf(statuses.values());
    }

    public int trackedUsers() {
        return statuses.size();
    }

    /**
     * Runs {@code step} atomically for one user, then performs side effects.
     * A step returning null leaves no status behind for the user.
     */
    private SafetyUpdate apply(String userId, Function<UserSafetyStatus, SafetyUpdate> step) {
        AtomicReference<SafetyUpdate> outcome = new AtomicReference<>();
        statuses.compute(userId, (id, previous) -> {
            SafetyUpdate update = step.apply(previous);
            if (update == null) {
                return previous;
            }
            if (!update.isIgnored() && shouldEmit(update)) {
                update = update.toBuilder()
                        .current(update.getCurrent().toBuilder().lastEmittedAt(update.getCurrent().getLastUpdate()).build())
                        .emitted(true)
                        .build();
            }
            outcome.set(update);
            return update.getCurrent();
        });

        SafetyUpdate update = outcome.get();
        if (update != null && !update.isIgnored()) {
            afterStep(update);
        }
        return update;
    }

    private static List<String> remember(List<String> recent, String eventId) {
        if (eventId == null) {
            return recent;
        }
        List<String> ids = new ArrayList<>(recent);
        ids.add(eventId);
        if (ids.size() > RECENT_EVENT_IDS) {
            ids.subList(0, ids.size() - RECENT_EVENT_IDS).clear();
        }
        return List.copyOf(ids);
    }

    private boolean shouldEmit(SafetyUpdate update) {
        if (update.isStateChanged() || update.isZoneSetChanged()) {
            return true;
        }
        Instant lastEmitted = update.getPrevious() == null ? null : update.getPrevious().getLastEmittedAt();
        if (lastEmitted == null) {
            return true;
        }
        Duration sinceLast = Duration.between(lastEmitted, update.getCurrent().getLastUpdate());
        return sinceLast.compareTo(Duration.ofSeconds(settings.getStatusRefreshSeconds())) >= 0;
    }

    private void afterStep(SafetyUpdate update) {
        UserSafetyStatus status = update.getCurrent();

        if (update.isStateChanged()) {
            log.info("Safety status — user {}: {} → {} ({}), zones {}",
                    status.getUserId(),
                    update.getPrevious() == null ? "none" : update.getPrevious().getState(),
                    status.getState(), update.getTransition(), status.getCurrentSafeZoneIds());
        }

        if (update.isEmitted()) {
            broadcaster.publish(Topic.USER_SAFETY_STATUS, status);
        }

        if (update.getTransition() == SafetyTransition.ALERTED) {
            log.warn("==> User {} outside all safe zones since {} (grace {}s) — alerting emergency contacts",
                    status.getUserId(), status.getOutsideSinceTimestamp(), status.getGraceThresholdSeconds());
            notificationService.sendOutsideSafeZoneAlert(status);
        } else if (update.getTransition() == SafetyTransition.REENTERED) {
            notificationService.sendSafeReturnNotification(status);
        }
    }
}
