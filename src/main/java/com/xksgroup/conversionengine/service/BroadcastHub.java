package com.xksgroup.conversionengine.service;

import com.xksgroup.conversionengine.exception.NotFoundException;
import com.xksgroup.conversionengine.exception.ValidationException;
import com.xksgroup.conversionengine.model.event.EventEnvelope;
import com.xksgroup.conversionengine.service.helper.EventSink;
import com.xksgroup.conversionengine.service.helper.TimeSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Group based fan-out to connected clients. Publishing only enqueues; each connection
 * is drained by at most one delivery task at a time, which keeps per-connection order.
 */
@Slf4j
@Service
public class BroadcastHub {

    public static final String ALL = "all";
    public static final String SPACE_MONITOR = "space-monitor";
    public static final String TASK_PREFIX = "task:";
    public static final String USER_PREFIX = "user:";

    private final Executor deliveryExecutor;
    private final TimeSource timeSource;
    private final int queueCapacity;

    private final Map<String, HubConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> groups = new ConcurrentHashMap<>();

    public BroadcastHub(@Qualifier("hubDeliveryExecutor") Executor deliveryExecutor,
                        TimeSource timeSource,
                        @Value("${conversion.hub.queue-capacity:256}") int queueCapacity) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("conversion.hub.queue-capacity must be at least 1");
        }
        this.deliveryExecutor = deliveryExecutor;
        this.timeSource = timeSource;
        this.queueCapacity = queueCapacity;
    }

    public static String taskGroup(String taskId) {
        return TASK_PREFIX + taskId;
    }

    public static String userGroup(String userId) {
        return USER_PREFIX + userId;
    }

    /**
     * Accepts {@code task:<id>}, {@code user:<id>}, {@code space-monitor} and {@code all}.
     */
    public static void validateGroup(String group) {
        if (group == null || group.isBlank()) {
            throw new ValidationException("Group name is required");
        }
        if (ALL.equals(group) || SPACE_MONITOR.equals(group)) {
            return;
        }
        if (group.startsWith(TASK_PREFIX) && group.length() > TASK_PREFIX.length()) {
            return;
        }
        if (group.startsWith(USER_PREFIX) && group.length() > USER_PREFIX.length()) {
            return;
        }
        throw new ValidationException("Unknown group name: " + group);
    }

    public HubConnection register(String connectionId, String userId, EventSink sink) {
        HubConnection connection = new HubConnection(connectionId, sink, queueCapacity, timeSource.now());
        if (connections.putIfAbsent(connectionId, connection) != null) {
            throw new IllegalStateException("Connection already registered: " + connectionId);
        }
        addMember(connection, ALL);
        if (userId != null && !userId.isBlank()) {
            addMember(connection, userGroup(userId));
        }
        log.info("Client connected - Connection: {}, User: {}, Total: {}", connectionId, userId, connections.size());
        return connection;
    }

    /**
     * Drops the connection and every membership it had.
     *
     * @return false if it was not registered
     */
    public boolean unregister(String connectionId) {
        HubConnection connection = connections.remove(connectionId);
        if (connection == null) {
            return false;
        }
        synchronized (connection) {
            connection.markClosed();
            for (String group : connection.groups()) {
                removeFromGroup(group, connectionId);
            }
            connection.groups().clear();
        }
        try {
            connection.getSink().close();
        } catch (RuntimeException e) {
            log.debug("Closing sink of {} failed: {}", connectionId, e.getMessage());
        }
        log.info("Client disconnected - Connection: {}, Remaining: {}", connectionId, connections.size());
        return true;
    }

    public void join(String connectionId, String group) {
        validateGroup(group);
        HubConnection connection = requireConnection(connectionId);
        addMember(connection, group);
        log.debug("Connection {} joined {}", connectionId, group);
    }

    public void leave(String connectionId, String group) {
        validateGroup(group);
        HubConnection connection = requireConnection(connectionId);
        synchronized (connection) {
            if (connection.groups().remove(group)) {
                removeFromGroup(group, connectionId);
            }
        }
        log.debug("Connection {} left {}", connectionId, group);
    }

    public void publish(String group, EventEnvelope envelope) {
        publish(List.of(group), envelope);
    }

    /**
     * Delivers once to every connection in any of the groups, however many of them it
     * belongs to.
     */
    public void publish(Collection<String> targetGroups, EventEnvelope envelope) {
        Set<String> recipients = new LinkedHashSet<>();
        for (String group : targetGroups) {
            Set<String> members = groups.get(group);
            if (members != null) {
                recipients.addAll(members);
            }
        }
        for (String connectionId : recipients) {
            HubConnection connection = connections.get(connectionId);
            if (connection != null) {
                enqueue(connection, envelope);
            }
        }
    }

    /**
     * Direct message to one connection, used for control envelopes.
     */
    public void send(String connectionId, EventEnvelope envelope) {
        enqueue(requireConnection(connectionId), envelope);
    }

    public Optional<HubConnection> connection(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public List<HubConnection> connections() {
        return new ArrayList<>(connections.values());
    }

    public int connectionCount() {
        return connections.size();
    }

    public Set<String> members(String group) {
        Set<String> members = groups.get(group);
        return members != null ? Set.copyOf(members) : Set.of();
    }

    private void enqueue(HubConnection connection, EventEnvelope envelope) {
        connection.enqueue(envelope);
        scheduleDrain(connection);
    }

    private void scheduleDrain(HubConnection connection) {
        if (!connection.tryBeginDrain()) {
            return;
        }
        try {
            deliveryExecutor.execute(() -> drain(connection));
        } catch (RejectedExecutionException e) {
            connection.endDrain();
            log.warn("Delivery executor rejected work for connection {}", connection.getId());
        }
    }

    private void drain(HubConnection connection) {
        while (true) {
            EventEnvelope envelope = connection.poll();
            if (envelope == null) {
                connection.endDrain();
                // Something may have been queued between poll and endDrain
                if (connection.hasQueued() && connection.tryBeginDrain()) {
                    continue;
                }
                return;
            }
            if (connection.isClosed()) {
                return;
            }
            try {
                connection.getSink().send(envelope);
            } catch (Exception e) {
                log.info("Delivery to connection {} failed, removing it: {}", connection.getId(), e.getMessage());
                unregister(connection.getId());
                return;
            }
        }
    }

    private void addMember(HubConnection connection, String group) {
        synchronized (connection) {
            if (connection.isClosed()) {
                throw new NotFoundException("Connection not found: " + connection.getId());
            }
            connection.groups().add(group);
            groups.compute(group, (key, members) -> {
                Set<String> updated = members != null ? members : ConcurrentHashMap.newKeySet();
                updated.add(connection.getId());
                return updated;
            });
        }
    }

    private void removeFromGroup(String group, String connectionId) {
        groups.computeIfPresent(group, (key, members) -> {
            members.remove(connectionId);
            return members.isEmpty() ? null : members;
        });
    }

    private HubConnection requireConnection(String connectionId) {
        HubConnection connection = connections.get(connectionId);
        if (connection == null) {
            throw new NotFoundException("Connection not found: " + connectionId);
        }
        return connection;
    }
}
