package com.suraksha.safetymonitor.dto;

import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.Instant;

/**
 * One-shot panic trigger. Range checks happen in the ingest service so the
 * error message matches the location path.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PanicRequest {

    @NotNull(message = "lat is required")
    private Double lat;

    @NotNull(message = "lng is required")
    private Double lng;

    private Instant timestamp;
}
