package com.suraksha.safetymonitor.model;

import lombok.Value;

/** A named risk area that contains the reported point. */
@Value
public class RiskHit {

    String name;

    RiskLevel risk;
}
