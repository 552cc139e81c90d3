package com.suraksha.safetymonitor.model;

import com.suraksha.safetymonitor.entity.SafeZone;
import lombok.Value;

import java.util.List;

/**
 * Advisory output of the rule evaluator: (anomaly, zoneHits, riskHits).
 */
@Value
public class EvaluationResult {

    /** anomaly code, null when no rule fired */
    String anomaly;

    List<SafeZone> zoneHits;

    List<RiskHit> riskHits;
}
