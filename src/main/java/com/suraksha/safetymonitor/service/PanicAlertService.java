package com.suraksha.safetymonitor.service;

import com.suraksha.safetymonitor.config.SafetyProperties;
import com.suraksha.safetymonitor.entity.IncidentSeverity;
import com.suraksha.safetymonitor.entity.IncidentType;
import com.suraksha.safetymonitor.entity.PanicAlert;
import com.suraksha.safetymonitor.exception.InvalidTransitionException;
import com.suraksha.safetymonitor.exception.NotFoundException;
import com.suraksha.safetymonitor.exception.StorageException;
import com.suraksha.safetymonitor.exception.ValidationException;
import com.suraksha.safetymonitor.model.RequestActor;
import com.suraksha.safetymonitor.model.Role;
import com.suraksha.safetymonitor.model.Topic;
import com.suraksha.safetymonitor.repository.PanicAlertRepository;
import com.suraksha.safetymonitor.util.GeofenceUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Panic alerts: pending ──acknowledge──▶ acknowledged (terminal).
 *
 * A trigger is stored, broadcast on panic_alert and, unless disabled, mirrored
 * as a critical PANIC incident so it shows up in the incident queue too.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PanicAlertService {

    /** Meters per degree of latitude */
    private static final double METERS_PER_DEGREE = 111_320.0;

    /** Upper bound on bounding-box candidates read for one proximity query */
    private static final int NEAR_CANDIDATE_LIMIT = 1000;

    private final PanicAlertRepository panicAlertRepository;
    private final IncidentService incidentService;
    private final AlertBroadcaster broadcaster;
    private final SafetyProperties properties;
    private final Clock clock;

    /**
     * @param timestamp client trigger time, already normalized by ingest
     */
    public PanicAlert trigger(String userId, double latitude, double longitude, Instant timestamp) {
        PanicAlert alert = PanicAlert.builder()
                .userId(userId)
                .latitude(latitude)
                .longitude(longitude)
                .timestamp(timestamp)
                .acknowledged(false)
                .createdAt(clock.instant())
                .build();

        PanicAlert saved = persist(alert);
        log.warn("==> PANIC alert #{} from user {} at ({}, {})", saved.getId(), userId, latitude, longitude);
        broadcaster.publish(Topic.PANIC_ALERT, saved);

        if (properties.getPanic().isCreateIncident()) {
            try {
                incidentService.create(IncidentType.PANIC, IncidentSeverity.CRITICAL,
                        "Panic alert #" + saved.getId() + " triggered", latitude, longitude, userId);
            } catch (StorageException e) {
                // the alert itself is stored and broadcast; responders still see it
                log.error("Panic alert #{} stored but its incident could not be created", saved.getId(), e);
            }
        }
        return saved;
    }

    public List<PanicAlert> list(Integer limit) {
        int cap = properties.getPanicAlerts().getListLimit();
        int size = limit == null ? cap : Math.max(1, Math.min(limit, cap));
        try {
            return panicAlertRepository.findAllByOrderByCreatedAtDescIdDesc(PageRequest.of(0, size));
        } catch (DataAccessException e) {
            throw new StorageException("Could not list panic alerts", e);
        }
    }

    /**
     * Alerts within {@code radiusMeters} of a point, newest first.
     * A bounding box narrows the candidates in the DB; haversine distance decides.
     */
    public List<PanicAlert> near(double latitude, double longitude, Double radiusMeters) {
        if (!GeofenceUtil.isValidLatitude(latitude) || !GeofenceUtil.isValidLongitude(longitude)) {
            throw new ValidationException("lat must be within [-90, 90] and lng within [-180, 180]");
        }
        double radius = radiusMeters == null ? properties.getPanicAlerts().getDefaultNearRadiusMeters() : radiusMeters;
        if (!(radius > 0) || Double.isInfinite(radius)) {
            throw new ValidationException("radiusMeters must be a positive number");
        }

        double latDelta = radius / METERS_PER_DEGREE;
        double lngDelta = radius / (METERS_PER_DEGREE * Math.max(Math.cos(Math.toRadians(latitude)), 1e-6));

        List<PanicAlert> candidates;
        try {
            candidates = panicAlertRepository.findByLatitudeBetweenAndLongitudeBetweenOrderByCreatedAtDesc(
                    Math.max(-90, latitude - latDelta), Math.min(90, latitude + latDelta),
                    Math.max(-180, longitude - lngDelta), Math.min(180, longitude + lngDelta),
                    PageRequest.of(0, NEAR_CANDIDATE_LIMIT));
        } catch (DataAccessException e) {
            throw new StorageException("Could not query panic alerts", e);
        }

        return candidates.stream()
                .filter(a -> GeofenceUtil.isWithinRadius(latitude, longitude, a.getLatitude(), a.getLongitude(), radius))
                .limit(properties.getPanicAlerts().getNearLimit())
                .collect(Collectors.toList());
    }

    /**
     * @throws InvalidTransitionException if the alert was already acknowledged
     */
    public PanicAlert acknowledge(Long id, RequestActor actor) {
        actor.requireAnyRole(Role.OFFICER, Role.ADMIN);
        PanicAlert current = findById(id);
        if (current.isAcknowledged()) {
            throw new InvalidTransitionException("Panic alert #" + id + " was already acknowledged by "
                    + current.getAcknowledgedBy());
        }

        PanicAlert saved = persist(current.acknowledge(actor.getUserId(), clock.instant()));
        log.info("Panic alert #{} acknowledged by {} ({})", id, actor.getUserId(), actor.getRole().getCode());
        broadcaster.publish(Topic.PANIC_ALERT, saved);
        return saved;
    }

    public PanicAlert findById(Long id) {
        try {
            return panicAlertRepository.findById(id)
                    .orElseThrow(() -> new NotFoundException("Panic alert not found with ID: " + id));
        } catch (DataAccessException e) {
            throw new StorageException("Could not load panic alert " + id, e);
        }
    }

    private PanicAlert persist(PanicAlert alert) {
        try {
            return panicAlertRepository.saveAndFlush(alert);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new InvalidTransitionException("Panic alert #" + alert.getId() + " was modified concurrently", e);
        } catch (DataAccessException | TransactionException e) {
            throw new StorageException("Could not save panic alert", e);
        }
    }
}
