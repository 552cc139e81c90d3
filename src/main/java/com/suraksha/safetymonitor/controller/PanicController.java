package com.suraksha.safetymonitor.controller;

import com.suraksha.safetymonitor.config.AuthInterceptor;
import com.suraksha.safetymonitor.dto.PanicRequest;
import com.suraksha.safetymonitor.dto.PanicResponse;
import com.suraksha.safetymonitor.entity.PanicAlert;
import com.suraksha.safetymonitor.model.RequestActor;
import com.suraksha.safetymonitor.service.TelemetryIngestService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Panic button. POST /api/panic → 201 {status: "ok", alert}
 */
@RestController
@RequestMapping("/api/panic")
@RequiredArgsConstructor
public class PanicController {

    private final TelemetryIngestService telemetryIngestService;

    @PostMapping
    public ResponseEntity<PanicResponse> trigger(
            @RequestAttribute(AuthInterceptor.ACTOR_ATTRIBUTE) RequestActor actor,
            @Valid @RequestBody PanicRequest request) {
        PanicAlert alert = telemetryIngestService.ingestPanic(actor, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(PanicResponse.ok(alert));
    }
}
