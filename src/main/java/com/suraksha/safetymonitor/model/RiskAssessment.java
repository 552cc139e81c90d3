package com.suraksha.safetymonitor.model;

import lombok.Value;

/**
 * Area risk returned by the external scoring service.
 * Score is in [0, 1]; level is the service's own bucket ("low", "medium", "high").
 */
@Value
public class RiskAssessment {

    double score;

    String level;
}
