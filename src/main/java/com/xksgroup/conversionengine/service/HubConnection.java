package com.xksgroup.conversionengine.service;

import com.xksgroup.conversionengine.model.event.EventEnvelope;
import com.xksgroup.conversionengine.service.helper.EventSink;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One registered client: its sink, its group memberships and a bounded outbound queue.
 * When the queue is full the oldest envelope is dropped.
 */
@Slf4j
public class HubConnection {

    private final String id;
    private final EventSink sink;
    private final int capacity;

    private final Deque<EventEnvelope> queue = new ArrayDeque<>();
    private final Set<String> groups = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicLong dropped = new AtomicLong();
    private volatile LocalDateTime lastPongAt;
    private volatile boolean closed;

    public HubConnection(String id, EventSink sink, int capacity, LocalDateTime connectedAt) {
        this.id = id;
        this.sink = sink;
        this.capacity = capacity;
        this.lastPongAt = connectedAt;
    }

    void enqueue(EventEnvelope envelope) {
        EventEnvelope evicted = null;
        synchronized (queue) {
            if (queue.size() >= capacity) {
                evicted = queue.pollFirst();
            }
            queue.offerLast(envelope);
        }
        if (evicted != null) {
            long total = dropped.incrementAndGet();
            log.warn("connection-lagging - Connection {} dropped '{}' event (dropped so far: {})",
                    id, evicted.type(), total);
        }
    }

    EventEnvelope poll() {
        synchronized (queue) {
            return queue.pollFirst();
        }
    }

    boolean hasQueued() {
        synchronized (queue) {
            return !queue.isEmpty();
        }
    }

    boolean tryBeginDrain() {
        return draining.compareAndSet(false, true);
    }

    void endDrain() {
        draining.set(false);
    }

    void markClosed() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public String getId() {
        return id;
    }

    EventSink getSink() {
        return sink;
    }

    public LocalDateTime getLastPongAt() {
        return lastPongAt;
    }

    public void recordPong(LocalDateTime at) {
        this.lastPongAt = at;
    }

    Set<String> groups() {
        return groups;
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public int getQueuedCount() {
        synchronized (queue) {
            return queue.size();
        }
    }
}
