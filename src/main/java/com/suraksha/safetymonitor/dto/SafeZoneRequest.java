package com.suraksha.safetymonitor.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.*;

/**
 * DTO for creating or updating a safe zone.
 *
 * Example request body:
 * {
 *   "name": "Connaught Place Police Post",
 *   "latitude": 28.6315,
 *   "longitude": 77.2167,
 *   "radiusMeters": 500,
 *   "alertThresholdSeconds": 300
 * }
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SafeZoneRequest {

    @NotBlank(message = "name is required")
    private String name;

    private String description;

    @NotNull(message = "latitude is required")
    @DecimalMin(value = "-90.0", message = "latitude must be between -90 and 90")
    @DecimalMax(value = "90.0", message = "latitude must be between -90 and 90")
    private Double latitude;

    @NotNull(message = "longitude is required")
    @DecimalMin(value = "-180.0", message = "longitude must be between -180 and 180")
    @DecimalMax(value = "180.0", message = "longitude must be between -180 and 180")
    private Double longitude;

    @NotNull(message = "radiusMeters is required")
    @Positive(message = "radiusMeters must be positive")
    private Double radiusMeters;

    /** Defaults to safety.safe-zone.default-alert-threshold-seconds when omitted */
    @Positive(message = "alertThresholdSeconds must be positive")
    private Long alertThresholdSeconds;

    /** Defaults to true when omitted */
    private Boolean active;
}
