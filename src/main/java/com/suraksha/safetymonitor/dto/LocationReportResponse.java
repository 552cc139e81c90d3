package com.suraksha.safetymonitor.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.suraksha.safetymonitor.entity.Incident;
import com.suraksha.safetymonitor.entity.SafeZone;
import com.suraksha.safetymonitor.model.RiskHit;
import com.suraksha.safetymonitor.model.UserSafetyStatus;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Reply to a location report. {@code geofences} and {@code safeZones} are
 * always present, empty when nothing matched; {@code anomaly} and
 * {@code incident} only when they exist.
 */
@Value
@Builder
public class LocationReportResponse {

    boolean saved;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    String anomaly;

    /** Risk areas containing the reported point */
    List<RiskHit> geofences;

    /** Active safe zones containing the reported point */
    List<SafeZone> safeZones;

    UserSafetyStatus safetyStatus;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    Incident incident;
}
