package com.suraksha.safetymonitor.service;

import com.suraksha.safetymonitor.model.UserSafetyStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Emergency-contact notifications for the user's own circle.
 *
 * Distinct from the incident store and the broadcaster: these target the
 * people the user registered, not the monitoring staff. Delivery is simulated
 * with log statements; a push/SMS gateway plugs in here.
 */
@Service
@Slf4j
public class NotificationService {

    /**
     * User has been outside every safe zone for longer than the grace period.
     * Called at most once per excursion.
     */
    public void sendOutsideSafeZoneAlert(UserSafetyStatus status) {
        log.info("================================================================");
        log.info("[EMERGENCY CONTACTS] User {} has left all safe zones", status.getUserId());
        log.info("[EMERGENCY CONTACTS] Outside since {} (grace {}s)",
                status.getOutsideSinceTimestamp(), status.getGraceThresholdSeconds());
        log.info("[EMERGENCY CONTACTS] Last known location: ({}, {})",
                status.getLastLatitude(), status.getLastLongitude());
        log.info("[SMS FALLBACK] 'Your contact has been outside a safe zone for a while. Please check in.'");
        log.info("================================================================");
    }

    /**
     * User is back inside a safe zone after an alert was sent.
     */
    public void sendSafeReturnNotification(UserSafetyStatus status) {
        log.info("================================================================");
        log.info("[EMERGENCY CONTACTS] User {} is back inside safe zone(s) {}",
                status.getUserId(), status.getCurrentSafeZoneIds());
        log.info("[SMS FALLBACK] 'Your contact has returned to a safe zone.'");
        log.info("================================================================");
    }
}
