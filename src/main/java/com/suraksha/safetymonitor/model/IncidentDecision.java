package com.suraksha.safetymonitor.model;

import com.suraksha.safetymonitor.entity.IncidentSeverity;
import com.suraksha.safetymonitor.entity.IncidentType;
import lombok.Value;

/** Incident the policy decided to raise for a report. */
@Value
public class IncidentDecision {

    IncidentType type;

    IncidentSeverity severity;

    String description;
}
