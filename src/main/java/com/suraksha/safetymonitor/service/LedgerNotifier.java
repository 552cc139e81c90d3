package com.suraksha.safetymonitor.service;

import com.suraksha.safetymonitor.config.SafetyProperties;
import com.suraksha.safetymonitor.entity.Incident;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Registers created incidents with the external audit ledger.
 *
 * Runs on the collaborator pool after the incident is stored. A failure is
 * logged and reported through the returned future only; the stored incident
 * is never rolled back.
 */
@Service
@Slf4j
public class LedgerNotifier {

    static final String REGISTER_PATH = "/api/incidents/register";

    private final RestTemplate restTemplate;
    private final SafetyProperties.Ledger settings;

    public LedgerNotifier(@Qualifier("ledgerRestTemplate") RestTemplate restTemplate,
                          SafetyProperties properties) {
        this.restTemplate = restTemplate;
        this.settings = properties.getLedger();
    }

    /**
     * @return true once the ledger accepted the record, false when disabled or failed
     */
    @Async("collaboratorTaskExecutor")
    public CompletableFuture<Boolean> register(Incident incident) {
        if (!settings.isEnabled()) {
            return CompletableFuture.completedFuture(false);
        }
        try {
            restTemplate.postForObject(settings.getBaseUrl() + REGISTER_PATH, payload(incident), Map.class);
            log.info("Incident #{} registered on ledger", incident.getId());
            return CompletableFuture.completedFuture(true);
        } catch (RestClientException e) {
            log.warn("Ledger registration failed for incident #{}: {}", incident.getId(), e.getMessage());
            return CompletableFuture.completedFuture(false);
        }
    }

    Map<String, Object> payload(Incident incident) {
        Map<String, Object> location = new LinkedHashMap<>();
        location.put("latitude", incident.getLatitude());
        location.put("longitude", incident.getLongitude());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("incidentId", String.valueOf(incident.getId()));
        body.put("incidentType", incident.getType().getCode());
        body.put("description", incident.getDescription());
        body.put("location", location);
        body.put("severity", incident.getSeverity().getCode());
        body.put("reporterAddress", settings.getReporterAddress());
        return body;
    }
}
