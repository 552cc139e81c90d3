package com.suraksha.safetymonitor.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.*;

import java.time.Instant;

/**
 * Periodic location report from the mobile app.
 * The user is taken from the authenticated request, never from the body.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LocationUpdateRequest {

    @NotNull(message = "latitude is required")
    @DecimalMin(value = "-90.0", message = "latitude must be between -90 and 90")
    @DecimalMax(value = "90.0", message = "latitude must be between -90 and 90")
    private Double latitude;

    @NotNull(message = "longitude is required")
    @DecimalMin(value = "-180.0", message = "longitude must be between -180 and 180")
    @DecimalMax(value = "180.0", message = "longitude must be between -180 and 180")
    private Double longitude;

    @PositiveOrZero(message = "speed must not be negative")
    private Double speed; // m/s

    @PositiveOrZero(message = "accuracy must not be negative")
    private Double accuracy; // meters

    /** Optional client timestamp; server time is used when absent */
    private Instant timestamp;

    /** Optional client-generated id; a retried report with the same id is applied once */
    private String eventId;
}
