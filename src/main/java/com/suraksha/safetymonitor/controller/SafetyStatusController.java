package com.suraksha.safetymonitor.controller;

import com.suraksha.safetymonitor.config.AuthInterceptor;
import com.suraksha.safetymonitor.exception.NotFoundException;
import com.suraksha.safetymonitor.model.RequestActor;
import com.suraksha.safetymonitor.model.Role;
import com.suraksha.safetymonitor.model.UserSafetyStatus;
import com.suraksha.safetymonitor.service.SafeZoneMonitor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collection;

/**
 * Live safe-zone status, the reconciliation path for user-safety-status events.
 * A user may read their own status; officers and admins may read anyone's.
 */
@RestController
@RequestMapping("/api/safety-status")
@RequiredArgsConstructor
public class SafetyStatusController {

    private final SafeZoneMonitor safeZoneMonitor;

    @GetMapping
    public ResponseEntity<Collection<UserSafetyStatus>> all(
            @RequestAttribute(AuthInterceptor.ACTOR_ATTRIBUTE) RequestActor actor) {
        actor.requireAnyRole(Role.OFFICER, Role.ADMIN);
        return ResponseEntity.ok(safeZoneMonitor.getAllStatuses());
    }

    @GetMapping("/{userId}")
    public ResponseEntity<UserSafetyStatus> get(
            @RequestAttribute(AuthInterceptor.ACTOR_ATTRIBUTE) RequestActor actor,
            @PathVariable String userId) {
        if (!actor.getUserId().equals(userId)) {
            actor.requireAnyRole(Role.OFFICER, Role.ADMIN);
        }
        return safeZoneMonitor.getStatus(userId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new NotFoundException("No safety status for user " + userId));
    }
}
