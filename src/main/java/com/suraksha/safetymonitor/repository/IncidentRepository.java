package com.suraksha.safetymonitor.repository;

import com.suraksha.safetymonitor.entity.Incident;
import com.suraksha.safetymonitor.entity.IncidentSeverity;
import com.suraksha.safetymonitor.entity.IncidentStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface IncidentRepository extends JpaRepository<Incident, Long> {

    /**
     * Newest-first listing with optional filters; a null filter matches everything.
     * The id tie-break keeps the order stable for incidents created in the same instant.
     */
    @Query("SELECT i FROM Incident i " +
           "WHERE (:status IS NULL OR i.status = :status) " +
           "AND (:severity IS NULL OR i.severity = :severity) " +
           "ORDER BY i.createdAt DESC, i.id DESC")
    List<Incident> findFiltered(@Param("status") IncidentStatus status,
                                @Param("severity") IncidentSeverity severity,
                                Pageable pageable);
}
