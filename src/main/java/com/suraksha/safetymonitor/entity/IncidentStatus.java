package com.suraksha.safetymonitor.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Incident lifecycle.
 *
 * <pre>
 *   OPEN ──ack──▶ ACKNOWLEDGED ──resolve──▶ RESOLVED
 *     └─────────────resolve───────────────────▲
 * </pre>
 *
 * Transitions are monotonic; RESOLVED is terminal.
 */
public enum IncidentStatus {

    OPEN("open"),
    ACKNOWLEDGED("acknowledged"),
    RESOLVED("resolved");

    private final String code;

    IncidentStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * @param target the requested next status
     * @return true if moving from this status to {@code target} is a legal lifecycle step
     */
    public boolean canTransitionTo(IncidentStatus target) {
        switch (this) {
            case OPEN:
                return target == ACKNOWLEDGED || target == RESOLVED;
            case ACKNOWLEDGED:
                return target == RESOLVED;
            default:
                return false;
        }
    }

    @JsonCreator
    public static IncidentStatus fromCode(String code) {
        for (IncidentStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown incident status: " + code);
    }
}
