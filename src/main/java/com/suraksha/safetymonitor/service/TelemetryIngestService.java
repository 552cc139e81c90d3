package com.suraksha.safetymonitor.service;

import com.suraksha.safetymonitor.config.SafetyProperties;
import com.suraksha.safetymonitor.dto.LocationReportResponse;
import com.suraksha.safetymonitor.dto.LocationUpdateRequest;
import com.suraksha.safetymonitor.dto.PanicRequest;
import com.suraksha.safetymonitor.entity.Incident;
import com.suraksha.safetymonitor.entity.PanicAlert;
import com.suraksha.safetymonitor.entity.SafeZone;
import com.suraksha.safetymonitor.exception.ValidationException;
import com.suraksha.safetymonitor.model.EvaluationResult;
import com.suraksha.safetymonitor.model.IncidentDecision;
import com.suraksha.safetymonitor.model.RequestActor;
import com.suraksha.safetymonitor.model.RiskAssessment;
import com.suraksha.safetymonitor.model.RiskLevel;
import com.suraksha.safetymonitor.model.SafetyUpdate;
import com.suraksha.safetymonitor.model.TelemetryEvent;
import com.suraksha.safetymonitor.util.GeofenceUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for everything a mobile client reports.
 *
 * Location report, synchronously and in this order:
 *  1. Validate and normalize into a {@link TelemetryEvent}
 *  2. Rule evaluation against the active safe zones and configured risk areas
 *  3. Safe-zone monitor step for the user
 *  4. External area risk, only when no local rule fired
 *  5. Incident policy → maybe an incident (stored, broadcast, sent to the ledger)
 *
 * Steps 2-5 only consume the event, so the call boundary after step 1 can be
 * replaced by a queue. A repeated event id is applied once.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TelemetryIngestService {

    private final SafeZoneService safeZoneService;
    private final RuleEvaluator ruleEvaluator;
    private final SafeZoneMonitor safeZoneMonitor;
    private final IncidentPolicy incidentPolicy;
    private final IncidentService incidentService;
    private final PanicAlertService panicAlertService;
    private final RiskScoringClient riskScoringClient;
    private final SafetyProperties properties;
    private final Clock clock;

    public LocationReportResponse ingestLocation(RequestActor actor, LocationUpdateRequest request) {
        TelemetryEvent event = normalize(actor, request);
        log.debug("Location report {} — user {} at ({}, {}), speed {}, accuracy {}",
                event.getEventId(), event.getUserId(), event.getLatitude(), event.getLongitude(),
                event.getSpeed(), event.getAccuracy());

        List<SafeZone> activeZones = safeZoneService.getActiveSafeZones();
        EvaluationResult evaluation = ruleEvaluator.evaluate(event.getLatitude(), event.getLongitude(),
                event.getSpeed(), event.getAccuracy(), activeZones);

        SafetyUpdate update = safeZoneMonitor.onReport(event, evaluation.getZoneHits());

        Incident incident = null;
        if (!update.isDuplicate()) {
            incident = raiseIncident(event, evaluation).orElse(null);
        } else {
            log.info("Event {} for user {} already applied — no incident raised", event.getEventId(), event.getUserId());
        }

        return LocationReportResponse.builder()
                .saved(true)
                .anomaly(evaluation.getAnomaly())
                .geofences(evaluation.getRiskHits())
                .safeZones(evaluation.getZoneHits())
                .safetyStatus(update.getCurrent())
                .incident(incident)
                .build();
    }

    public PanicAlert ingestPanic(RequestActor actor, PanicRequest request) {
        if (request.getLat() == null || request.getLng() == null) {
            throw new ValidationException("lat and lng are required");
        }
        requireCoordinates(request.getLat(), request.getLng(), "lat", "lng");
        Instant timestamp = normalizeTimestamp(request.getTimestamp());
        return panicAlertService.trigger(actor.getUserId(), request.getLat(), request.getLng(), timestamp);
    }

    private Optional<Incident> raiseIncident(TelemetryEvent event, EvaluationResult evaluation) {
        RiskAssessment externalRisk = null;
        boolean localRuleFired = evaluation.getAnomaly() != null
                || evaluation.getRiskHits().stream().anyMatch(hit -> hit.getRisk() == RiskLevel.HIGH);
        if (!localRuleFired && riskScoringClient.isEnabled()) {
            externalRisk = riskScoringClient.assessArea(event.getLatitude(), event.getLongitude()).orElse(null);
        }

        Optional<IncidentDecision> decision = incidentPolicy.decide(
                evaluation.getAnomaly(), evaluation.getRiskHits(), externalRisk);
        return decision.map(d -> incidentService.create(d.getType(), d.getSeverity(), d.getDescription(),
                event.getLatitude(), event.getLongitude(), event.getUserId()));
    }

    private TelemetryEvent normalize(RequestActor actor, LocationUpdateRequest request) {
        if (request.getLatitude() == null || request.getLongitude() == null) {
            throw new ValidationException("latitude and longitude are required");
        }
        requireCoordinates(request.getLatitude(), request.getLongitude(), "latitude", "longitude");
        requireNonNegative(request.getSpeed(), "speed");
        requireNonNegative(request.getAccuracy(), "accuracy");

        String eventId = request.getEventId() == null || request.getEventId().isBlank()
                ? UUID.randomUUID().toString()
                : request.getEventId().trim();

        return TelemetryEvent.builder()
                .eventId(eventId)
                .userId(actor.getUserId())
                .latitude(request.getLatitude())
                .longitude(request.getLongitude())
                .speed(request.getSpeed())
                .accuracy(request.getAccuracy())
                .timestamp(normalizeTimestamp(request.getTimestamp()))
                .receivedAt(clock.instant())
                .build();
    }

    /**
     * Server time when absent. A timestamp too far in the future would freeze
     * the user's status under last-write-wins, so it is rejected.
     */
    private Instant normalizeTimestamp(Instant clientTimestamp) {
        Instant now = clock.instant();
        if (clientTimestamp == null) {
            return now;
        }
        Duration maxSkew = Duration.ofSeconds(properties.getAnomaly().getMaxClockSkewSeconds());
        if (clientTimestamp.isAfter(now.plus(maxSkew))) {
            throw new ValidationException("timestamp is more than " + maxSkew.getSeconds() + "s in the future");
        }
        return clientTimestamp;
    }

    private static void requireCoordinates(double latitude, double longitude, String latName, String lngName) {
        if (!GeofenceUtil.isValidLatitude(latitude)) {
            throw new ValidationException(latName + " must be between -90 and 90, got " + latitude);
        }
        if (!GeofenceUtil.isValidLongitude(longitude)) {
            throw new ValidationException(lngName + " must be between -180 and 180, got " + longitude);
        }
    }

    private static void requireNonNegative(Double value, String name) {
        if (value != null && (value.isNaN() || value.isInfinite() || value < 0)) {
            throw new ValidationException(name + " must be a non-negative number");
        }
    }
}
