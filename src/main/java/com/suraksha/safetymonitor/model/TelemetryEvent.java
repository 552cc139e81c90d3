package com.suraksha.safetymonitor.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Normalized location report, the single event ingest hands downstream.
 * Consumers must treat a repeated {@code eventId} as a no-op.
 */
@Value
@Builder
public class TelemetryEvent {

    String eventId;

    String userId;

    double latitude;

    double longitude;

    /** m/s, null when the client did not report it */
    Double speed;

    /** meters, null when the client did not report it */
    Double accuracy;

    /** Client timestamp, or server receive time when absent */
    Instant timestamp;

    /** Server time the report arrived */
    Instant receivedAt;
}
