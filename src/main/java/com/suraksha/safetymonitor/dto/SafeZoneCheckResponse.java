package com.suraksha.safetymonitor.dto;

import com.suraksha.safetymonitor.entity.SafeZone;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class SafeZoneCheckResponse {

    boolean withinSafeZone;

    List<SafeZone> safeZones;

    Map<String, Double> location;
}
