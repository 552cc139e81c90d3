package com.suraksha.safetymonitor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP clients for the external collaborators. Short timeouts: neither
 * collaborator may hold up location ingest.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate riskServiceRestTemplate(SafetyProperties properties) {
        SafetyProperties.RiskService riskService = properties.getRiskService();
        return build(riskService.getConnectTimeoutMs(), riskService.getReadTimeoutMs());
    }

    @Bean
    public RestTemplate ledgerRestTemplate(SafetyProperties properties) {
        SafetyProperties.Ledger ledger = properties.getLedger();
        return build(ledger.getConnectTimeoutMs(), ledger.getReadTimeoutMs());
    }

    private RestTemplate build(int connectTimeoutMs, int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }
}
