package com.suraksha.safetymonitor.service;

import com.suraksha.safetymonitor.model.BroadcastEnvelope;
import com.suraksha.safetymonitor.model.Topic;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * One in-process subscriber of the {@link AlertBroadcaster}.
 *
 * Envelopes are buffered in a bounded queue; when it is full the oldest
 * envelope is dropped, so a slow sink never blocks the publisher. At most one
 * drain task runs at a time, which keeps delivery in enqueue order.
 *
 * The subscription ends when the caller closes it, when the sink throws, or
 * when the executor rejects a drain. Ending is idempotent.
 */
@Slf4j
public class BroadcastSubscription implements AutoCloseable {

    private final long id;
    private final Set<Topic> topics;
    private final Consumer<BroadcastEnvelope> sink;
    private final Executor executor;
    private final Consumer<BroadcastSubscription> onClose;
    private final BlockingQueue<BroadcastEnvelope> queue;

    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();

    BroadcastSubscription(long id, Set<Topic> topics, Consumer<BroadcastEnvelope> sink, int capacity,
                          Executor executor, Consumer<BroadcastSubscription> onClose) {
        this.id = id;
        this.topics = Set.copyOf(topics);
        this.sink = sink;
        this.executor = executor;
        this.onClose = onClose;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Enqueues the envelope if this subscription listens to its topic and
     * schedules a drain. Never blocks.
     */
    void offer(BroadcastEnvelope envelope) {
        if (closed.get() || !topics.contains(envelope.getTopic())) {
            return;
        }
        while (!queue.offer(envelope)) {
            if (queue.poll() != null) {
                long total = dropped.incrementAndGet();
                if (total == 1 || total % 100 == 0) {
                    log.warn("Subscriber #{} is falling behind — {} event(s) dropped so far", id, total);
                }
            }
        }
        scheduleDrain();
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.warn("Subscriber #{} dropped — broadcast executor saturated", id);
            close();
        }
    }

    private void drain() {
        BroadcastEnvelope envelope;
        while (!closed.get() && (envelope = queue.poll()) != null) {
            try {
                sink.accept(envelope);
            } catch (RuntimeException e) {
                log.info("Subscriber #{} disconnected: {}", id, e.getMessage());
                draining.set(false);
                close();
                return;
            }
        }
        draining.set(false);
        // an offer may have landed after the last poll but before the flag cleared
        if (!closed.get() && !queue.isEmpty()) {
            scheduleDrain();
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            queue.clear();
            onClose.accept(this);
            log.debug("Subscriber #{} closed ({} dropped)", id, dropped.get());
        }
    }

    public long getId() {
        return id;
    }

    public Set<Topic> getTopics() {
        return topics;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public long getDroppedCount() {
        return dropped.get();
    }
}
