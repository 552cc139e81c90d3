package com.suraksha.safetymonitor.model;

import lombok.Value;

import java.time.Instant;

/**
 * One published event as seen by an in-process subscriber.
 * {@code sequence} is assigned at publish time and increases monotonically.
 */
@Value
public class BroadcastEnvelope {

    Topic topic;

    Object payload;

    long sequence;

    Instant publishedAt;
}
