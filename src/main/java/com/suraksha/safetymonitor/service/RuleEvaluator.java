package com.suraksha.safetymonitor.service;

import com.suraksha.safetymonitor.config.SafetyProperties;
import com.suraksha.safetymonitor.entity.SafeZone;
import com.suraksha.safetymonitor.model.EvaluationResult;
import com.suraksha.safetymonitor.model.RiskHit;
import com.suraksha.safetymonitor.model.RiskLevel;
import com.suraksha.safetymonitor.util.GeofenceUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Stateless rules applied to every location report.
 *
 *  - Speed anomaly    : speed > max-speed-mps            → "unrealistic_speed"
 *  - Accuracy anomaly : else accuracy > max-accuracy-m   → "low_gps_accuracy"
 *  - Safe zones       : active zones whose circle contains the point (boundary inclusive)
 *  - Risk areas       : configured named regions containing the point, with their risk level
 *
 * No I/O, no state; the same input always yields the same result. Raising
 * incidents or alerts from this output is the caller's job.
 */
@Component
@Slf4j
public class RuleEvaluator {

    public static final String UNREALISTIC_SPEED = "unrealistic_speed";
    public static final String LOW_GPS_ACCURACY = "low_gps_accuracy";

    private final double maxSpeedMps;
    private final double maxAccuracyMeters;
    private final List<CompiledRiskArea> riskAreas;

    public RuleEvaluator(SafetyProperties properties) {
        this.maxSpeedMps = properties.getAnomaly().getMaxSpeedMps();
        this.maxAccuracyMeters = properties.getAnomaly().getMaxAccuracyMeters();
        this.riskAreas = compile(properties.getRiskAreas());
        log.info("Rule evaluator ready — max speed {} m/s, max accuracy {} m, {} risk area(s)",
                maxSpeedMps, maxAccuracyMeters, riskAreas.size());
    }

    public EvaluationResult evaluate(double latitude, double longitude, Double speed, Double accuracy,
                                     Collection<SafeZone> activeZones) {
        return new EvaluationResult(
                detectAnomaly(speed, accuracy).orElse(null),
                matchSafeZones(latitude, longitude, activeZones),
                matchRiskAreas(latitude, longitude));
    }

    /**
     * At most one anomaly per report; the speed rule wins when both would fire.
     * A missing field skips its rule.
     */
    public Optional<String> detectAnomaly(Double speed, Double accuracy) {
        if (speed != null && speed > maxSpeedMps) {
            return Optional.of(UNREALISTIC_SPEED);
        }
        if (accuracy != null && accuracy > maxAccuracyMeters) {
            return Optional.of(LOW_GPS_ACCURACY);
        }
        return Optional.empty();
    }

    /**
     * Active zones containing the point. Inactive zones never match.
     */
    public List<SafeZone> matchSafeZones(double latitude, double longitude, Collection<SafeZone> zones) {
        List<SafeZone> hits = new ArrayList<>();
        for (SafeZone zone : zones) {
            if (zone.isActive() && GeofenceUtil.isWithinRadius(latitude, longitude,
                    zone.getLatitude(), zone.getLongitude(), zone.getRadiusMeters())) {
                hits.add(zone);
            }
        }
        return hits;
    }

    public List<RiskHit> matchRiskAreas(double latitude, double longitude) {
        List<RiskHit> hits = new ArrayList<>();
        for (CompiledRiskArea area : riskAreas) {
            if (area.contains(latitude, longitude)) {
                hits.add(new RiskHit(area.name, area.risk));
            }
        }
        return hits;
    }

    private static List<CompiledRiskArea> compile(List<SafetyProperties.RiskArea> configured) {
        List<CompiledRiskArea> compiled = new ArrayList<>();
        for (SafetyProperties.RiskArea area : configured) {
            if (area.getShape() == SafetyProperties.Shape.POLYGON) {
                double[][] polygon;
                try {
                    polygon = GeofenceUtil.parsePolygon(area.getPolygon());
                } catch (IllegalArgumentException e) {
                    throw new IllegalStateException("Risk area '" + area.getName() + "' has an invalid polygon", e);
                }
                compiled.add(new CompiledRiskArea(area.getName(), area.getRisk(), polygon, 0, 0, 0));
            } else {
                if (area.getLatitude() == null || area.getLongitude() == null
                        || area.getRadiusMeters() == null || area.getRadiusMeters() <= 0) {
                    throw new IllegalStateException("Risk area '" + area.getName()
                            + "' needs latitude, longitude and a positive radius-meters");
                }
                compiled.add(new CompiledRiskArea(area.getName(), area.getRisk(), null,
                        area.getLatitude(), area.getLongitude(), area.getRadiusMeters()));
            }
        }
        return List.copyOf(compiled);
    }

    /** Risk area with its polygon parsed once at startup. */
    private static final class CompiledRiskArea {

        private final String name;
        private final RiskLevel risk;
        private final double[][] polygon;
        private final double latitude;
        private final double longitude;
        private final double radiusMeters;

        private CompiledRiskArea(String name, RiskLevel risk, double[][] polygon,
                                 double latitude, double longitude, double radiusMeters) {
            this.name = name;
            this.risk = risk;
            this.polygon = polygon;
            this.latitude = latitude;
            this.longitude = longitude;
            this.radiusMeters = radiusMeters;
        }

        boolean contains(double lat, double lng) {
            return polygon != null
                    ? GeofenceUtil.isWithinPolygon(lat, lng, polygon)
                    : GeofenceUtil.isWithinRadius(lat, lng, latitude, longitude, radiusMeters);
        }
    }
}
