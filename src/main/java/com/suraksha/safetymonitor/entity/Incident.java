package com.suraksha.safetymonitor.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A detected safety-relevant event that needs human attention.
 *
 * Instances are treated as value snapshots: a lifecycle step builds a new
 * snapshot with {@code toBuilder()} and saves it. The {@code version} column
 * turns every save into a compare-and-swap, so two officers racing on the
 * same incident cannot silently overwrite each other.
 *
 * DB Indexes:
 *  - idx_incident_created_at      : newest-first listing
 *  - idx_incident_status_severity : filtered listing
 *  - idx_incident_user_id         : per-user lookups
 */
@Entity
@Table(
    name = "incidents",
    indexes = {
        @Index(name = "idx_incident_created_at",      columnList = "created_at"),
        @Index(name = "idx_incident_status_severity", columnList = "status, severity"),
        @Index(name = "idx_incident_user_id",         columnList = "user_id")
    }
)
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Incident {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Long version;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private IncidentType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private IncidentSeverity severity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private IncidentStatus status;

    @Column(length = 500)
    private String description;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    @Column(name = "user_id", nullable = false)
    private String userId;

    /** Officer/admin who acknowledged the incident, null while OPEN */
    private String acknowledgedBy;

    /** Officer/admin who resolved the incident, null until RESOLVED */
    private String resolvedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

}
