package com.suraksha.safetymonitor.service;

import com.suraksha.safetymonitor.config.SafetyProperties;
import com.suraksha.safetymonitor.exception.BroadcastException;
import com.suraksha.safetymonitor.exception.ValidationException;
import com.suraksha.safetymonitor.model.BroadcastEnvelope;
import com.suraksha.safetymonitor.model.Topic;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Publish/subscribe hub for real-time events.
 *
 * Two kinds of subscriber receive every publish:
 *   1. STOMP sessions on /topic/{topic} via the simple broker
 *   2. in-process {@link BroadcastSubscription}s (SSE streams, tests)
 *
 * Publishing is best-effort and never throws: the record is already stored,
 * a failed delivery is logged and the reconciliation path is the REST listing.
 * Publishes are serialized so every subscriber sees one topic's events in
 * publish order; slow subscribers lose their oldest events instead of
 * blocking the publisher.
 */
@Service
@Slf4j
public class AlertBroadcaster {

    private final SimpMessagingTemplate messagingTemplate;
    private final Executor executor;
    private final int subscriberQueueCapacity;
    private final Clock clock;

    private final Set<BroadcastSubscription> subscriptions = ConcurrentHashMap.newKeySet();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong subscriptionIds = new AtomicLong();
    private final Object publishLock = new Object();

    public AlertBroadcaster(SimpMessagingTemplate messagingTemplate,
                            @Qualifier("broadcastTaskExecutor") Executor executor,
                            SafetyProperties properties,
                            Clock clock) {
        this.messagingTemplate = messagingTemplate;
        this.executor = executor;
        this.subscriberQueueCapacity = properties.getBroadcast().getSubscriberQueueCapacity();
        this.clock = clock;
    }

    /**
     * Delivers {@code payload} to every subscriber currently listening on {@code topic}.
     * Subscribers that connect afterwards never see it.
     */
    public void publish(Topic topic, Object payload) {
        long seq;
        synchronized (publishLock) {
            seq = sequence.incrementAndGet();
            BroadcastEnvelope envelope = new BroadcastEnvelope(topic, payload, seq, clock.instant());
            for (BroadcastSubscription subscription : subscriptions) {
                subscription.offer(envelope);
            }
            try {
                sendToSessions(topic, payload);
            } catch (BroadcastException e) {
                log.warn("Broadcast on '{}' failed: {}", topic.getCode(), e.getMessage(), e.getCause());
            }
        }
        log.debug("Published #{} to '{}'", seq, topic.getCode());
    }

    /**
     * Opens an in-process subscription to the given topics. The sink is called
     * from a broadcast pool thread, one envelope at a time. A sink that throws
     * ends the subscription.
     */
    public BroadcastSubscription subscribe(Set<Topic> topics, Consumer<BroadcastEnvelope> sink) {
        if (topics == null || topics.isEmpty()) {
            throw new ValidationException("At least one topic is required");
        }
        BroadcastSubscription subscription = new BroadcastSubscription(subscriptionIds.incrementAndGet(), topics, sink,
                subscriberQueueCapacity, executor, subscriptions::remove);
        subscriptions.add(subscription);
        log.info("Subscriber #{} connected — topics {}", subscription.getId(), topics);
        return subscription;
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    private void sendToSessions(Topic topic, Object payload) {
        try {
            messagingTemplate.convertAndSend(topic.destination(), payload);
        } catch (RuntimeException e) {
            throw new BroadcastException("STOMP delivery to " + topic.destination() + " failed", e);
        }
    }
}
