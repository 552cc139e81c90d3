package com.suraksha.safetymonitor.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.suraksha.safetymonitor.config.SafetyProperties;
import com.suraksha.safetymonitor.model.RiskAssessment;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Client for the external area-risk model.
 *
 *   POST {base-url}/api/predict/area-risk
 *   { "latitude": .., "longitude": .., "radius": .. }  →  { "risk_score": 0..1, "risk_level": "low|medium|high" }
 *
 * Fails open: when disabled, unreachable, slow or returning garbage the result
 * is empty and ingest carries on without the extra signal.
 */
@Service
@Slf4j
public class RiskScoringClient {

    static final String AREA_RISK_PATH = "/api/predict/area-risk";

    private final RestTemplate restTemplate;
    private final SafetyProperties.RiskService settings;

    public RiskScoringClient(@Qualifier("riskServiceRestTemplate") RestTemplate restTemplate,
                             SafetyProperties properties) {
        this.restTemplate = restTemplate;
        this.settings = properties.getRiskService();
    }

    public boolean isEnabled() {
        return settings.isEnabled();
    }

    public Optional<RiskAssessment> assessArea(double latitude, double longitude) {
        if (!settings.isEnabled()) {
            return Optional.empty();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("latitude", latitude);
        body.put("longitude", longitude);
        body.put("radius", settings.getAreaRadiusMeters());

        try {
            AreaRiskResponse response = restTemplate.postForObject(
                    settings.getBaseUrl() + AREA_RISK_PATH, body, AreaRiskResponse.class);
            if (response == null || response.getRiskScore() == null) {
                log.warn("Risk service returned no score for ({}, {})", latitude, longitude);
                return Optional.empty();
            }
            log.debug("Area risk at ({}, {}): {} ({})", latitude, longitude,
                    response.getRiskScore(), response.getRiskLevel());
            return Optional.of(new RiskAssessment(response.getRiskScore(), response.getRiskLevel()));
        } catch (RestClientException e) {
            log.warn("Risk service unavailable, continuing without it: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Getter
    @Setter
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AreaRiskResponse {

        @JsonProperty("risk_score")
        private Double riskScore;

        @JsonProperty("risk_level")
        private String riskLevel;
    }
}
