package com.suraksha.safetymonitor.repository;

import com.suraksha.safetymonitor.entity.SafeZone;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SafeZoneRepository extends JpaRepository<SafeZone, Long> {

    List<SafeZone> findByActiveTrue();
}
