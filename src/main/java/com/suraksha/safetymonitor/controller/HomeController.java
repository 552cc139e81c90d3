package com.suraksha.safetymonitor.controller;

import com.suraksha.safetymonitor.service.AlertBroadcaster;
import com.suraksha.safetymonitor.service.SafeZoneMonitor;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * API info at the root URL and an unauthenticated liveness probe.
 */
@RestController
@RequiredArgsConstructor
public class HomeController {

    private final SafeZoneMonitor safeZoneMonitor;
    private final AlertBroadcaster broadcaster;

    @GetMapping("/")
    public Map<String, Object> home() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("application", "Suraksha Safety Monitor");
        info.put("status", "Running");
        info.put("endpoints", Map.of(
                "POST /api/location", "Report the caller's location",
                "POST /api/panic", "Trigger a panic alert",
                "GET /api/incidents", "Incident queue, newest first",
                "GET /api/panic-alerts", "Recent panic alerts",
                "GET /api/events", "Server-Sent Events stream",
                "WS /ws", "STOMP endpoint, subscribe to /topic/{topic}",
                "GET /swagger-ui.html", "API documentation"
        ));
        info.put("sampleRequest", Map.of(
                "url", "POST /api/location",
                "headers", Map.of("X-User-Id", "user-1", "X-User-Role", "user"),
                "body", Map.of(
                        "latitude", 28.6139,
                        "longitude", 77.2090,
                        "speed", 1.4,
                        "accuracy", 12.0
                )
        ));
        return info;
    }

    @GetMapping("/api/health")
    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "UP");
        health.put("trackedUsers", safeZoneMonitor.trackedUsers());
        health.put("eventSubscribers", broadcaster.subscriberCount());
        return health;
    }
}
