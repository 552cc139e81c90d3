package com.suraksha.safetymonitor.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One-shot panic trigger raised from a mobile client.
 *
 * Two-state lifecycle: pending ──acknowledge──▶ acknowledged (terminal).
 * {@code acknowledgedBy} is set iff {@code acknowledged} is true; the only
 * way to flip the flag is {@link #acknowledge(String, Instant)}.
 */
@Entity
@Table(
    name = "panic_alerts",
    indexes = {
        @Index(name = "idx_panic_alert_created_at", columnList = "created_at"),
        @Index(name = "idx_panic_alert_user_id",    columnList = "user_id"),
        @Index(name = "idx_panic_alert_lat_lng",    columnList = "latitude, longitude")
    }
)
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class PanicAlert {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Long version;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    /** Client-reported trigger time, or server time when the client sent none */
    @Column(name = "alert_timestamp", nullable = false)
    private Instant timestamp;

    private boolean acknowledged;

    private String acknowledgedBy;

    private Instant acknowledgedAt;

    /** Server time the record was written */
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Returns the acknowledged snapshot of this alert. The receiver is left untouched.
     */
    public PanicAlert acknowledge(String actorId, Instant at) {
        return toBuilder()
                .acknowledged(true)
                .acknowledgedBy(actorId)
                .acknowledgedAt(at)
                .build();
    }
}
