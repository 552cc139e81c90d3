package com.suraksha.safetymonitor.config;

import com.suraksha.safetymonitor.model.RiskLevel;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * All tunables under the {@code safety.*} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "safety")
@Data
@Validated
public class SafetyProperties {

    @Valid
    private Anomaly anomaly = new Anomaly();

    @Valid
    private SafeZone safeZone = new SafeZone();

    @Valid
    private List<RiskArea> riskAreas = new ArrayList<>();

    @Valid
    private Incidents incidents = new Incidents();

    @Valid
    private PanicAlerts panicAlerts = new PanicAlerts();

    @Valid
    private Panic panic = new Panic();

    @Valid
    private Broadcast broadcast = new Broadcast();

    @Valid
    private RiskService riskService = new RiskService();

    @Valid
    private Ledger ledger = new Ledger();

    @Valid
    private Seed seed = new Seed();

    @Data
    public static class Anomaly {
        /** ~120 km/h */
        @Positive
        private double maxSpeedMps = 33.0;

        @Positive
        private double maxAccuracyMeters = 100.0;

        /** Client timestamps further ahead of server time are rejected */
        @Min(0)
        private long maxClockSkewSeconds = 300;
    }

    @Data
    public static class SafeZone {
        /** Grace period when the user has no zone history to take a threshold from */
        @Positive
        private long defaultAlertThresholdSeconds = 300;

        /** Minimum gap between broadcasts of an unchanged status */
        @Min(0)
        private long statusRefreshSeconds = 30;

        @Positive
        private long sweepIntervalMs = 30000;

        @Positive
        private long staleAfterMinutes = 360;
    }

    @Data
    public static class RiskArea {
        @NotBlank
        private String name;

        @NotNull
        private RiskLevel risk = RiskLevel.MEDIUM;

        /** CIRCULAR (center + radius) or POLYGON */
        @NotNull
        private Shape shape = Shape.CIRCULAR;

        private Double latitude;

        private Double longitude;

        private Double radiusMeters;

        /** JSON array of [lat,lon] pairs, POLYGON only */
        private String polygon;
    }

    public enum Shape {
        CIRCULAR,
        POLYGON
    }

    @Data
    public static class Incidents {
        @Min(1)
        @Max(200)
        private int listLimit = 200;
    }

    @Data
    public static class PanicAlerts {
        @Min(1)
        private int listLimit = 50;

        @Min(1)
        private int nearLimit = 100;

        @Positive
        private double defaultNearRadiusMeters = 1000;
    }

    @Data
    public static class Panic {
        /** Also open a critical PANIC incident for every panic trigger */
        private boolean createIncident = true;
    }

    @Data
    public static class Broadcast {
        /** Per in-process subscriber; oldest events are dropped beyond this */
        @Min(1)
        private int subscriberQueueCapacity = 256;

        /** Per WebSocket session; the session is closed when exceeded */
        @Positive
        private int sendBufferSizeBytes = 512 * 1024;

        @Positive
        private int sendTimeLimitMs = 10000;

        private List<String> allowedOriginPatterns = new ArrayList<>(List.of("*"));
    }

    @Data
    public static class RiskService {
        private boolean enabled = false;

        private String baseUrl = "http://localhost:5000";

        @Positive
        private int connectTimeoutMs = 500;

        @Positive
        private int readTimeoutMs = 1000;

        @Positive
        private double areaRadiusMeters = 1000;

        /** Scores at or above this count as a high-risk signal */
        @Positive
        private double highRiskScore = 0.7;
    }

    @Data
    public static class Ledger {
        private boolean enabled = false;

        private String baseUrl = "http://localhost:3001";

        @Positive
        private int connectTimeoutMs = 1000;

        @Positive
        private int readTimeoutMs = 5000;

        /** Address recorded as reporter on the ledger */
        private String reporterAddress = "0x0000000000000000000000000000000000000000";
    }

    @Data
    public static class Seed {
        private boolean enabled = false;
    }
}
