package com.overlaychat.server.room;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Outbound queue of one subscriber. Writes run on the shared delivery executor, one at a time
 * and in submission order, so a subscriber whose transport blocks only holds up its own lane.
 * When the backlog reaches {@code maxPending} further payloads for that subscriber are dropped.
 */
class DeliveryLane {
    private static final Logger log = LoggerFactory.getLogger(DeliveryLane.class);

    private final Subscriber subscriber;
    private final Executor executor;
    private final int maxPending;
    private final long roomId;

    // guarded by this
    private final Queue<String> pending = new ArrayDeque<>();
    private boolean draining;

    DeliveryLane(Subscriber subscriber, Executor executor, int maxPending, long roomId) {
        this.subscriber = subscriber;
        this.executor = executor;
        this.maxPending = maxPending;
        this.roomId = roomId;
    }

    Subscriber subscriber() {
        return subscriber;
    }

    void submit(String body) {
        synchronized (this) {
            if (pending.size() >= maxPending) {
                log.warn("[WARN] subscriber={} room={} backlog full ({}), payload dropped",
                        subscriber.id(), roomId, maxPending);
                return;
            }
            pending.add(body);
            if (draining) return;
            draining = true;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            log.warn("[WARN] delivery rejected subscriber={} room={}: {}", subscriber.id(), roomId, e.getMessage());
            synchronized (this) {
                pending.clear();
                draining = false;
            }
        }
    }

    private void drain() {
        while (true) {
            String body;
            synchronized (this) {
                body = pending.poll();
                if (body == null) {
                    draining = false;
                    return;
                }
            }
            try {
                subscriber.send(body);
            } catch (Exception e) {
                log.warn("[WARN] send fail room={} subscriber={} {}", roomId, subscriber.id(), e.getMessage());
            }
        }
    }

    synchronized int backlog() {
        return pending.size();
    }
}
