package com.xksgroup.conversionengine.service;

import com.xksgroup.conversionengine.exception.NotFoundException;
import com.xksgroup.conversionengine.model.event.EventEnvelope;
import com.xksgroup.conversionengine.service.helper.BackgroundSupervisor;
import com.xksgroup.conversionengine.service.helper.EventSink;
import com.xksgroup.conversionengine.service.helper.IdGenerator;
import com.xksgroup.conversionengine.service.helper.SseEventSink;
import com.xksgroup.conversionengine.service.helper.TimeSource;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.LocalDateTime;

/**
 * Server side of the event stream: opens SSE connections, keeps them alive with pings
 * and drops the ones that stop answering.
 */
@Slf4j
@Service
public class ConnectionManager {

    private final BroadcastHub hub;
    private final IdGenerator idGenerator;
    private final TimeSource timeSource;
    private final BackgroundSupervisor supervisor;
    private final long pingIntervalMs;
    private final long pongTimeoutMs;

    public ConnectionManager(BroadcastHub hub,
                             IdGenerator idGenerator,
                             TimeSource timeSource,
                             BackgroundSupervisor supervisor,
                             @Value("${conversion.connection.ping-interval-ms:30000}") long pingIntervalMs,
                             @Value("${conversion.connection.pong-timeout-ms:90000}") long pongTimeoutMs) {
        this.hub = hub;
        this.idGenerator = idGenerator;
        this.timeSource = timeSource;
        this.supervisor = supervisor;
        this.pingIntervalMs = pingIntervalMs;
        this.pongTimeoutMs = pongTimeoutMs;
    }

    @PostConstruct
    public void init() {
        if (pingIntervalMs > 0) {
            supervisor.scheduleWithFixedDelay("connection-heartbeat", this::heartbeat, pingIntervalMs, pingIntervalMs);
        }
    }

    /**
     * Client subscribes to the event stream.
     */
    public SseEmitter openStream(String userId) {
        SseEmitter emitter = new SseEmitter(0L);
        String connectionId = open(userId, new SseEventSink(emitter));

        Runnable cleanup = () -> hub.unregister(connectionId);
        emitter.onCompletion(cleanup);
        emitter.onTimeout(cleanup);
        emitter.onError(t -> {
            log.debug("Event stream {} errored: {}", connectionId, t.getMessage());
            cleanup.run();
        });
        return emitter;
    }

    /**
     * Registers a connection on any sink and greets it with its id.
     */
    public String open(String userId, EventSink sink) {
        String connectionId = idGenerator.newConnectionId();
        hub.register(connectionId, userId, sink);
        hub.send(connectionId, EventEnvelope.connected(connectionId, timeSource.now()));
        return connectionId;
    }

    public void join(String connectionId, String group) {
        hub.join(connectionId, group);
    }

    public void leave(String connectionId, String group) {
        hub.leave(connectionId, group);
    }

    public void recordPong(String connectionId) {
        hub.connection(connectionId)
                .orElseThrow(() -> new NotFoundException("Connection not found: " + connectionId))
                .recordPong(timeSource.now());
    }

    public void close(String connectionId) {
        if (!hub.unregister(connectionId)) {
            throw new NotFoundException("Connection not found: " + connectionId);
        }
    }

    /**
     * Drops silent connections and pings the rest.
     */
    public void heartbeat() {
        LocalDateTime now = timeSource.now();
        LocalDateTime deadline = now.minusNanos(pongTimeoutMs * 1_000_000);

        for (HubConnection connection : hub.connections()) {
            if (connection.getLastPongAt().isBefore(deadline)) {
                log.info("Connection {} missed pongs since {}, removing it", connection.getId(), connection.getLastPongAt());
                hub.unregister(connection.getId());
                continue;
            }
            try {
                hub.send(connection.getId(), EventEnvelope.ping(connection.getId(), now));
            } catch (NotFoundException e) {
                log.debug("Connection {} went away before ping", connection.getId());
            }
        }
    }
}
