package com.suraksha.safetymonitor.service;

import com.suraksha.safetymonitor.config.CacheConfig;
import com.suraksha.safetymonitor.config.SafetyProperties;
import com.suraksha.safetymonitor.dto.SafeZoneRequest;
import com.suraksha.safetymonitor.entity.SafeZone;
import com.suraksha.safetymonitor.exception.NotFoundException;
import com.suraksha.safetymonitor.exception.StorageException;
import com.suraksha.safetymonitor.model.RequestActor;
import com.suraksha.safetymonitor.model.Role;
import com.suraksha.safetymonitor.repository.SafeZoneRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Safe-zone definitions and the cached active-zone list every report is
 * evaluated against.
 *
 * Why a separate service?
 *   @Cacheable is implemented via Spring AOP proxies and self-calls bypass the
 *   proxy. Callers (ingest, monitor sweep, controllers) always come through
 *   the proxy, so the cache is consulted first.
 *
 * Caching strategy:
 *   READ  → @Cacheable  : active zones, loaded from DB on miss
 *   EVICT → @CacheEvict : every create/update/delete clears the list once the write returned
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SafeZoneService {

    private final SafeZoneRepository safeZoneRepository;
    private final SafetyProperties properties;
    private final Clock clock;

    // ────────────────────────────────────────────────────────────────────────
    // READ
    // ────────────────────────────────────────────────────────────────────────

    @Cacheable(CacheConfig.CACHE_ACTIVE_SAFE_ZONES)
    public List<SafeZone> getActiveSafeZones() {
        log.debug("[CACHE MISS] activeSafeZones — loading from DB");
        try {
            return List.copyOf(safeZoneRepository.findByActiveTrue());
        } catch (DataAccessException e) {
            throw new StorageException("Could not load safe zones", e);
        }
    }

    public List<SafeZone> findAll() {
        try {
            return safeZoneRepository.findAll();
        } catch (DataAccessException e) {
            throw new StorageException("Could not load safe zones", e);
        }
    }

    public SafeZone findById(Long id) {
        try {
            return safeZoneRepository.findById(id)
                    .orElseThrow(() -> new NotFoundException("Safe zone not found with ID: " + id));
        } catch (DataAccessException e) {
            throw new StorageException("Could not load safe zone " + id, e);
        }
    }

    // ────────────────────────────────────────────────────────────────────────
    // WRITE (admin only)
    // ────────────────────────────────────────────────────────────────────────

    @CacheEvict(value = CacheConfig.CACHE_ACTIVE_SAFE_ZONES, allEntries = true)
    public SafeZone create(RequestActor actor, SafeZoneRequest request) {
        actor.requireAnyRole(Role.ADMIN);
        Instant now = clock.instant();
        SafeZone zone = SafeZone.builder()
                .createdAt(now)
                .updatedAt(now)
                .build();
        apply(zone, request);

        SafeZone saved = save(zone);
        log.info("Safe zone created by {}: id={}, name='{}', radius={}m, threshold={}s",
                actor.getUserId(), saved.getId(), saved.getName(), saved.getRadiusMeters(),
                saved.getAlertThresholdSeconds());
        return saved;
    }

    @CacheEvict(value = CacheConfig.CACHE_ACTIVE_SAFE_ZONES, allEntries = true)
    public SafeZone update(RequestActor actor, Long id, SafeZoneRequest request) {
        actor.requireAnyRole(Role.ADMIN);
        SafeZone existing = findById(id);
        apply(existing, request);
        existing.setUpdatedAt(clock.instant());

        SafeZone updated = save(existing);
        log.info("Safe zone updated by {}: id={}, name='{}', active={}",
                actor.getUserId(), updated.getId(), updated.getName(), updated.isActive());
        return updated;
    }

    /**
     * @return the zone as it was before deletion
     */
    @CacheEvict(value = CacheConfig.CACHE_ACTIVE_SAFE_ZONES, allEntries = true)
    public SafeZone delete(RequestActor actor, Long id) {
        actor.requireAnyRole(Role.ADMIN);
        SafeZone existing = findById(id);
        try {
            safeZoneRepository.delete(existing);
        } catch (DataAccessException e) {
            throw new StorageException("Could not delete safe zone " + id, e);
        }
        log.info("Safe zone deleted by {}: id={}, name='{}'", actor.getUserId(), id, existing.getName());
        return existing;
    }

    private void apply(SafeZone zone, SafeZoneRequest request) {
        zone.setName(request.getName().trim());
        zone.setDescription(request.getDescription());
        zone.setLatitude(request.getLatitude());
        zone.setLongitude(request.getLongitude());
        zone.setRadiusMeters(request.getRadiusMeters());
        zone.setAlertThresholdSeconds(request.getAlertThresholdSeconds() != null
                ? request.getAlertThresholdSeconds()
                : properties.getSafeZone().getDefaultAlertThresholdSeconds());
        zone.setActive(request.getActive() == null || request.getActive());
    }

    private SafeZone save(SafeZone zone) {
        try {
            return safeZoneRepository.save(zone);
        } catch (DataAccessException e) {
            throw new StorageException("Could not save safe zone", e);
        }
    }
}
