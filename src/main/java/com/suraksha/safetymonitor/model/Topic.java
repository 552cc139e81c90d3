package com.suraksha.safetymonitor.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Real-time event kinds pushed to monitoring clients.
 * Each topic maps to the STOMP destination {@code /topic/{code}} and to the
 * SSE event name {@code code}.
 */
public enum Topic {

    INCIDENT("incident"),
    PANIC_ALERT("panic_alert"),
    USER_SAFETY_STATUS("user-safety-status"),
    SAFE_ZONE_CREATED("safe-zone-created"),
    SAFE_ZONE_UPDATED("safe-zone-updated"),
    SAFE_ZONE_DELETED("safe-zone-deleted");

    private final String code;

    Topic(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String destination() {
        return "/topic/" + code;
    }

    public static Optional<Topic> fromCode(String code) {
        for (Topic topic : values()) {
            if (topic.code.equalsIgnoreCase(code)) {
                return Optional.of(topic);
            }
        }
        return Optional.empty();
    }
}
