package com.suraksha.safetymonitor.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Circular safe zone maintained by the operations team.
 *
 * A user inside any active zone is considered safe; once outside all of them
 * for longer than {@code alertThresholdSeconds} an alert fires.
 */
@Entity
@Table(name = "safe_zones")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SafeZone {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Human-readable label, e.g. "Connaught Place Police Post" */
    @Column(nullable = false)
    private String name;

    private String description;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    @Column(nullable = false)
    private Double radiusMeters;

    /** Grace period outside all zones before the user is alerted on */
    @Column(nullable = false)
    private Long alertThresholdSeconds;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
