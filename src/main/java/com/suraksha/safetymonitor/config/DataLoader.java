package com.suraksha.safetymonitor.config;

import com.suraksha.safetymonitor.entity.SafeZone;
import com.suraksha.safetymonitor.repository.SafeZoneRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Seeds demo safe zones around central New Delhi on startup.
 * Enabled with safety.seed.enabled=true; skipped when any zone exists.
 */
@Component
@ConditionalOnProperty(prefix = "safety.seed", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DataLoader implements CommandLineRunner {

    private final SafeZoneRepository safeZoneRepository;
    private final Clock clock;

    @Override
    public void run(String... args) {
        log.info("Starting safe-zone seeding...");

        if (safeZoneRepository.count() > 0) {
            log.info("Safe zones already exist, skipping seeding");
            return;
        }

        Instant now = clock.instant();
        List<SafeZone> zones = List.of(
                zone("Connaught Place Police Post", "Central Delhi police post", 28.6315, 77.2167, 500.0, 300L, now),
                zone("India Gate Police Booth", "Tourist police booth", 28.6129, 77.2295, 300.0, 120L, now),
                zone("AIIMS Emergency", "Hospital emergency wing", 28.5672, 77.2100, 400.0, 600L, now)
        );
        safeZoneRepository.saveAll(zones);

        zones.forEach(z -> log.info("Safe zone created: '{}' at ({}, {}), radius {}m, threshold {}s",
                z.getName(), z.getLatitude(), z.getLongitude(), z.getRadiusMeters(), z.getAlertThresholdSeconds()));
        log.info("Seeding completed — {} safe zones", zones.size());
    }

    private static SafeZone zone(String name, String description, double latitude, double longitude,
                                 double radiusMeters, long thresholdSeconds, Instant now) {
        return SafeZone.builder()
                .name(name)
                .description(description)
                .latitude(latitude)
                .longitude(longitude)
                .radiusMeters(radiusMeters)
                .alertThresholdSeconds(thresholdSeconds)
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
