package com.suraksha.safetymonitor.controller;

import com.suraksha.safetymonitor.config.AuthInterceptor;
import com.suraksha.safetymonitor.dto.LocationReportResponse;
import com.suraksha.safetymonitor.dto.LocationUpdateRequest;
import com.suraksha.safetymonitor.model.RequestActor;
import com.suraksha.safetymonitor.service.TelemetryIngestService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST Controller for location reports from the mobile app
 */
@RestController
@RequestMapping("/api/location")
@RequiredArgsConstructor
@Slf4j
public class LocationController {

    private final TelemetryIngestService telemetryIngestService;

    /**
     * POST /api/location
     *
     * Always answers {saved, geofences, safeZones, safetyStatus}; anomaly and
     * incident are added when a rule fired.
     */
    @PostMapping
    public ResponseEntity<LocationReportResponse> report(
            @RequestAttribute(AuthInterceptor.ACTOR_ATTRIBUTE) RequestActor actor,
            @Valid @RequestBody LocationUpdateRequest request) {
        log.debug("Location report from user {}", actor.getUserId());
        return ResponseEntity.ok(telemetryIngestService.ingestLocation(actor, request));
    }
}
