package com.suraksha.safetymonitor.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What produced an incident.
 *
 * Stored as a String in the DB via @Enumerated(EnumType.STRING);
 * serialized to clients as the lowercase code.
 */
public enum IncidentType {

    /** Speed or GPS accuracy rule fired on a location report */
    ANOMALY("anomaly"),

    /** Report landed inside a high-risk area */
    GEOFENCE("geofence"),

    /** User pressed the panic button */
    PANIC("panic"),

    /** Anything else, e.g. an elevated score from the external risk service */
    OTHER("other");

    private final String code;

    IncidentType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static IncidentType fromCode(String code) {
        for (IncidentType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown incident type: " + code);
    }
}
