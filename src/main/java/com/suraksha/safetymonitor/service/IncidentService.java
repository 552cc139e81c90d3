package com.suraksha.safetymonitor.service;

import com.suraksha.safetymonitor.config.SafetyProperties;
import com.suraksha.safetymonitor.entity.Incident;
import com.suraksha.safetymonitor.entity.IncidentSeverity;
import com.suraksha.safetymonitor.entity.IncidentStatus;
import com.suraksha.safetymonitor.entity.IncidentType;
import com.suraksha.safetymonitor.exception.InvalidTransitionException;
import com.suraksha.safetymonitor.exception.NotFoundException;
import com.suraksha.safetymonitor.exception.StorageException;
import com.suraksha.safetymonitor.model.RequestActor;
import com.suraksha.safetymonitor.model.Role;
import com.suraksha.safetymonitor.model.Topic;
import com.suraksha.safetymonitor.repository.IncidentRepository;
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

/**
 * Incident store and lifecycle manager.
 *
 * Every write is a compare-and-swap on the incident's version: read the
 * current snapshot, check the transition, save the next snapshot. A concurrent
 * writer that got there first turns the save into INVALID_TRANSITION instead
 * of a silent overwrite.
 *
 * After a successful write the full record is published on the incident topic
 * and new incidents are handed to the ledger. Neither can undo the write.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IncidentService {

    private final IncidentRepository incidentRepository;
    private final AlertBroadcaster broadcaster;
    private final LedgerNotifier ledgerNotifier;
    private final SafetyProperties properties;
    private final Clock clock;

    public Incident create(IncidentType type, IncidentSeverity severity, String description,
                           double latitude, double longitude, String userId) {
        Instant now = clock.instant();
        Incident incident = Incident.builder()
                .type(type)
                .severity(severity)
                .status(IncidentStatus.OPEN)
                .description(description)
                .latitude(latitude)
                .longitude(longitude)
                .userId(userId)
                .createdAt(now)
                .updatedAt(now)
                .build();

        Incident saved = persist(incident);
        log.info("==> Incident #{} created — {} / {} for user {}: {}",
                saved.getId(), type.getCode(), severity.getCode(), userId, description);

        broadcaster.publish(Topic.INCIDENT, saved);
        ledgerNotifier.register(saved);
        return saved;
    }

    /**
     * Acknowledging an already acknowledged incident returns it unchanged.
     *
     * @throws InvalidTransitionException if the incident is resolved
     */
    public Incident acknowledge(Long id, RequestActor actor) {
        actor.requireAnyRole(Role.OFFICER, Role.ADMIN);
        Incident current = findById(id);

        if (current.getStatus() == IncidentStatus.ACKNOWLEDGED) {
            log.debug("Incident #{} already acknowledged by {}", id, current.getAcknowledgedBy());
            return current;
        }
        requireTransition(current, IncidentStatus.ACKNOWLEDGED);

        Incident next = current.toBuilder()
                .status(IncidentStatus.ACKNOWLEDGED)
                .acknowledgedBy(actor.getUserId())
                .updatedAt(nextUpdatedAt(current))
                .build();
        return applyTransition(current, next, actor);
    }

    /**
     * @throws InvalidTransitionException if the incident is already resolved
     */
    public Incident resolve(Long id, RequestActor actor) {
        actor.requireAnyRole(Role.OFFICER, Role.ADMIN);
        Incident current = findById(id);
        requireTransition(current, IncidentStatus.RESOLVED);

        Incident next = current.toBuilder()
                .status(IncidentStatus.RESOLVED)
                .resolvedBy(actor.getUserId())
                .updatedAt(nextUpdatedAt(current))
                .build();
        return applyTransition(current, next, actor);
    }

    /**
     * Newest first, optionally filtered. {@code limit} is clamped to the configured cap.
     */
    public List<Incident> list(IncidentStatus status, IncidentSeverity severity, Integer limit) {
        int cap = properties.getIncidents().getListLimit();
        int size = limit == null ? cap : Math.max(1, Math.min(limit, cap));
        try {
            return incidentRepository.findFiltered(status, severity, PageRequest.of(0, size));
        } catch (DataAccessException e) {
            throw new StorageException("Could not list incidents", e);
        }
    }

    public Incident findById(Long id) {
        try {
            return incidentRepository.findById(id)
                    .orElseThrow(() -> new NotFoundException("Incident not found with ID: " + id));
        } catch (DataAccessException e) {
            throw new StorageException("Could not load incident " + id, e);
        }
    }

    private void requireTransition(Incident current, IncidentStatus target) {
        if (!current.getStatus().canTransitionTo(target)) {
            throw new InvalidTransitionException("Incident #" + current.getId() + " is "
                    + current.getStatus().getCode() + " and cannot become " + target.getCode());
        }
    }

    private Incident applyTransition(Incident current, Incident next, RequestActor actor) {
        Incident saved = persist(next);
        log.info("Incident #{}: {} → {} by {} ({})", saved.getId(), current.getStatus().getCode(),
                saved.getStatus().getCode(), actor.getUserId(), actor.getRole().getCode());
        broadcaster.publish(Topic.INCIDENT, saved);
        return saved;
    }

    /** updatedAt strictly increases on every transition, even within one clock tick */
    private Instant nextUpdatedAt(Incident current) {
        Instant now = clock.instant();
        return now.isAfter(current.getUpdatedAt()) ? now : current.getUpdatedAt().plusMillis(1);
    }

    private Incident persist(Incident incident) {
        try {
            return incidentRepository.saveAndFlush(incident);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new InvalidTransitionException("Incident #" + incident.getId() + " was modified concurrently", e);
        } catch (DataAccessException | TransactionException e) {
            throw new StorageException("Could not save incident", e);
        }
    }
}
