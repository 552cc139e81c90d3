package com.suraksha.safetymonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot Application Class
 * Suraksha safety monitor: location ingest, safe-zone monitoring, incidents and live alerts
 */
@SpringBootApplication
public class SafetyMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SafetyMonitorApplication.class, args);
    }

}
