package com.suraksha.safetymonitor.repository;

import com.suraksha.safetymonitor.entity.PanicAlert;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PanicAlertRepository extends JpaRepository<PanicAlert, Long> {

    List<PanicAlert> findAllByOrderByCreatedAtDescIdDesc(Pageable pageable);

    /** Bounding-box prefilter for proximity queries; callers refine by true distance. */
    List<PanicAlert> findByLatitudeBetweenAndLongitudeBetweenOrderByCreatedAtDesc(
            double minLatitude, double maxLatitude,
            double minLongitude, double maxLongitude,
            Pageable pageable);
}
