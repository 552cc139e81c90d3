package com.suraksha.safetymonitor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Live safe-zone status of one user. Held in memory only, one immutable
 * snapshot per user, replaced atomically on every evaluation.
 *
 * alertSent is only ever true while the user is outside every zone.
 */
@Value
@Builder(toBuilder = true)
public class UserSafetyStatus {

    String userId;

    SafetyState state;

    @JsonProperty("isInSafeZone")
    boolean inSafeZone;

    Set<Long> currentSafeZoneIds;

    /** When the current excursion started; null while inside */
    Instant outsideSinceTimestamp;

    boolean alertSent;

    /** Time of the last evaluation, from a report or the background sweep */
    Instant lastUpdate;

    /** Timestamp of the last accepted location report */
    Instant lastReportAt;

    /** Server time the last accepted report arrived, pairs with lastReportAt to map wall time onto the client clock */
    @JsonIgnore
    Instant lastReceivedAt;

    double lastLatitude;

    double lastLongitude;

    /** Grace period for the current or next excursion: min threshold of the zones last inside */
    long graceThresholdSeconds;

    /** Last time this status was broadcast */
    @JsonIgnore
    Instant lastEmittedAt;

    /** Ids of the most recent telemetry events seen, oldest first */
    @JsonIgnore
    @Builder.Default
    List<String> recentEventIds = List.of();
}
