package com.suraksha.safetymonitor.controller;

import com.suraksha.safetymonitor.config.AuthInterceptor;
import com.suraksha.safetymonitor.entity.PanicAlert;
import com.suraksha.safetymonitor.model.RequestActor;
import com.suraksha.safetymonitor.service.PanicAlertService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Endpoints:
 *   GET  /api/panic-alerts                         - 50 most recent
 *   GET  /api/panic-alerts/near?lat=&lng=&radiusMeters=  - within radius (default 1000 m), max 100
 *   POST /api/panic-alerts/{id}/ack                - officer | admin
 */
@RestController
@RequestMapping("/api/panic-alerts")
@RequiredArgsConstructor
public class PanicAlertController {

    private final PanicAlertService panicAlertService;

    @GetMapping
    public ResponseEntity<List<PanicAlert>> list(@RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(panicAlertService.list(limit));
    }

    @GetMapping("/near")
    public ResponseEntity<List<PanicAlert>> near(
            @RequestParam double lat,
            @RequestParam double lng,
            @RequestParam(required = false) Double radiusMeters) {
        return ResponseEntity.ok(panicAlertService.near(lat, lng, radiusMeters));
    }

    @PostMapping("/{id}/ack")
    public ResponseEntity<PanicAlert> acknowledge(
            @PathVariable Long id,
            @RequestAttribute(AuthInterceptor.ACTOR_ATTRIBUTE) RequestActor actor) {
        return ResponseEntity.ok(panicAlertService.acknowledge(id, actor));
    }
}
