package com.suraksha.safetymonitor.controller;

import com.suraksha.safetymonitor.config.AuthInterceptor;
import com.suraksha.safetymonitor.dto.ApiResponse;
import com.suraksha.safetymonitor.dto.SafeZoneCheckRequest;
import com.suraksha.safetymonitor.dto.SafeZoneCheckResponse;
import com.suraksha.safetymonitor.dto.SafeZoneRequest;
import com.suraksha.safetymonitor.entity.SafeZone;
import com.suraksha.safetymonitor.model.RequestActor;
import com.suraksha.safetymonitor.model.Topic;
import com.suraksha.safetymonitor.service.AlertBroadcaster;
import com.suraksha.safetymonitor.service.RuleEvaluator;
import com.suraksha.safetymonitor.service.SafeZoneService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for managing safe zones.
 *
 * Lets the operations team maintain safe zones without redeploying. Writes
 * are admin-only and are broadcast only after the active-zone cache was
 * evicted, so a client reacting to the event reads fresh data.
 *
 * Endpoints:
 *   GET    /api/safe-zones           - list all zones (active and inactive)
 *   GET    /api/safe-zones/{id}      - get a zone by ID
 *   POST   /api/safe-zones           - create a zone           (admin)
 *   PUT    /api/safe-zones/{id}      - update a zone           (admin)
 *   DELETE /api/safe-zones/{id}      - remove a zone           (admin)
 *   POST   /api/safe-zones/check     - which active zones contain a point
 */
@RestController
@RequestMapping("/api/safe-zones")
@RequiredArgsConstructor
@Slf4j
public class SafeZoneController {

    private final SafeZoneService safeZoneService;
    private final RuleEvaluator ruleEvaluator;
    private final AlertBroadcaster broadcaster;

    @GetMapping
    public ResponseEntity<ApiResponse> getAll() {
        List<SafeZone> zones = safeZoneService.findAll();
        log.debug("Returning {} safe zones", zones.size());
        return ResponseEntity.ok(ApiResponse.success(zones, zones.size() + " safe zone(s) found"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse> getById(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(safeZoneService.findById(id), "Safe zone found"));
    }

    /**
     * Example: POST /api/safe-zones
     * {
     *   "name": "India Gate Police Booth",
     *   "latitude": 28.6129,
     *   "longitude": 77.2295,
     *   "radiusMeters": 300,
     *   "alertThresholdSeconds": 120
     * }
     */
    @PostMapping
    public ResponseEntity<ApiResponse> create(
            @RequestAttribute(AuthInterceptor.ACTOR_ATTRIBUTE) RequestActor actor,
            @Valid @RequestBody SafeZoneRequest request) {
        SafeZone saved = safeZoneService.create(actor, request);
        broadcaster.publish(Topic.SAFE_ZONE_CREATED, saved);
        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(ApiResponse.success(saved, "Safe zone created successfully"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse> update(
            @RequestAttribute(AuthInterceptor.ACTOR_ATTRIBUTE) RequestActor actor,
            @PathVariable Long id,
            @Valid @RequestBody SafeZoneRequest request) {
        SafeZone updated = safeZoneService.update(actor, id, request);
        broadcaster.publish(Topic.SAFE_ZONE_UPDATED, updated);
        return ResponseEntity.ok(ApiResponse.success(updated, "Safe zone updated successfully"));
    }

    /**
     * Users currently inside only this zone are re-evaluated on their next report.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse> delete(
            @RequestAttribute(AuthInterceptor.ACTOR_ATTRIBUTE) RequestActor actor,
            @PathVariable Long id) {
        SafeZone deleted = safeZoneService.delete(actor, id);
        broadcaster.publish(Topic.SAFE_ZONE_DELETED, deleted);
        return ResponseEntity.ok(ApiResponse.success(null, "Safe zone deleted successfully"));
    }

    @PostMapping("/check")
    public ResponseEntity<SafeZoneCheckResponse> check(@Valid @RequestBody SafeZoneCheckRequest request) {
        List<SafeZone> hits = ruleEvaluator.matchSafeZones(request.getLatitude(), request.getLongitude(),
                safeZoneService.getActiveSafeZones());

        Map<String, Double> location = new LinkedHashMap<>();
        location.put("latitude", request.getLatitude());
        location.put("longitude", request.getLongitude());
        return ResponseEntity.ok(new SafeZoneCheckResponse(!hits.isEmpty(), hits, location));
    }
}
