package com.suraksha.safetymonitor.controller;

import com.suraksha.safetymonitor.config.AuthInterceptor;
import com.suraksha.safetymonitor.entity.Incident;
import com.suraksha.safetymonitor.entity.IncidentSeverity;
import com.suraksha.safetymonitor.entity.IncidentStatus;
import com.suraksha.safetymonitor.exception.ValidationException;
import com.suraksha.safetymonitor.model.RequestActor;
import com.suraksha.safetymonitor.service.IncidentService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.function.Function;

/**
 * Incident queue for the dashboard.
 *
 * Endpoints:
 *   GET  /api/incidents?status=&severity=&limit=  - newest first, capped at 200
 *   GET  /api/incidents/{id}
 *   POST /api/incidents/{id}/ack                  - officer | admin
 *   POST /api/incidents/{id}/resolve              - officer | admin
 */
@RestController
@RequestMapping("/api/incidents")
@RequiredArgsConstructor
public class IncidentController {

    private final IncidentService incidentService;

    @GetMapping
    public ResponseEntity<List<Incident>> list(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(incidentService.list(
                parse(status, "status", IncidentStatus::fromCode),
                parse(severity, "severity", IncidentSeverity::fromCode),
                limit));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Incident> get(@PathVariable Long id) {
        return ResponseEntity.ok(incidentService.findById(id));
    }

    @PostMapping("/{id}/ack")
    public ResponseEntity<Incident> acknowledge(
            @PathVariable Long id,
            @RequestAttribute(AuthInterceptor.ACTOR_ATTRIBUTE) RequestActor actor) {
        return ResponseEntity.ok(incidentService.acknowledge(id, actor));
    }

    @PostMapping("/{id}/resolve")
    public ResponseEntity<Incident> resolve(
            @PathVariable Long id,
            @RequestAttribute(AuthInterceptor.ACTOR_ATTRIBUTE) RequestActor actor) {
        return ResponseEntity.ok(incidentService.resolve(id, actor));
    }

    private static <T> T parse(String value, String name, Function<String, T> parser) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return parser.apply(value.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown " + name + " '" + value + "'");
        }
    }
}
