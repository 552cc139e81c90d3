package com.suraksha.safetymonitor.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Roles issued by the upstream authentication service.
 */
public enum Role {

    /** Mobile app user reporting their own location */
    USER("user"),

    /** Responder working incidents from the dashboard */
    OFFICER("officer"),

    ADMIN("admin");

    private final String code;

    Role(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * @return the matching role, or null when {@code code} names no known role
     */
    public static Role fromCode(String code) {
        for (Role role : values()) {
            if (role.code.equalsIgnoreCase(code)) {
                return role;
            }
        }
        return null;
    }
}
