package com.suraksha.safetymonitor.service;

import com.suraksha.safetymonitor.config.SafetyProperties;
import com.suraksha.safetymonitor.entity.IncidentSeverity;
import com.suraksha.safetymonitor.entity.IncidentType;
import com.suraksha.safetymonitor.model.IncidentDecision;
import com.suraksha.safetymonitor.model.RiskAssessment;
import com.suraksha.safetymonitor.model.RiskHit;
import com.suraksha.safetymonitor.model.RiskLevel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Decides whether a location report becomes an incident.
 *
 *  1. anomaly present            → ANOMALY,  high,   description = anomaly code
 *  2. any risk hit is high       → GEOFENCE, medium, "Entered {all hit names}"
 *  3. external score is high     → OTHER,    medium, "elevated_area_risk:{score}"
 *  4. otherwise                  → no incident
 */
@Component
@RequiredArgsConstructor
public class IncidentPolicy {

    private final SafetyProperties properties;

    public Optional<IncidentDecision> decide(String anomaly, List<RiskHit> riskHits) {
        return decide(anomaly, riskHits, null);
    }

    /**
     * @param externalRisk score from the external risk service, null when unavailable
     */
    public Optional<IncidentDecision> decide(String anomaly, List<RiskHit> riskHits, RiskAssessment externalRisk) {
        if (anomaly != null) {
            return Optional.of(new IncidentDecision(IncidentType.ANOMALY, IncidentSeverity.HIGH, anomaly));
        }
        if (riskHits.stream().anyMatch(hit -> hit.getRisk() == RiskLevel.HIGH)) {
            String names = riskHits.stream().map(RiskHit::getName).collect(Collectors.joining(", "));
            return Optional.of(new IncidentDecision(IncidentType.GEOFENCE, IncidentSeverity.MEDIUM, "Entered " + names));
        }
        if (externalRisk != null && isHigh(externalRisk)) {
            String description = String.format(Locale.ROOT, "elevated_area_risk:%.2f", externalRisk.getScore());
            return Optional.of(new IncidentDecision(IncidentType.OTHER, IncidentSeverity.MEDIUM, description));
        }
        return Optional.empty();
    }

    private boolean isHigh(RiskAssessment assessment) {
        return assessment.getScore() >= properties.getRiskService().getHighRiskScore()
                || RiskLevel.HIGH.getCode().equalsIgnoreCase(assessment.getLevel());
    }
}
