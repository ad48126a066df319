package com.xksgroup.conversionengine.client;

import com.xksgroup.conversionengine.model.dto.TaskSnapshotDto;
import com.xksgroup.conversionengine.model.event.EventEnvelope;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Consumer side of the event stream. Keeps one stream open, reconnects with backoff
 * when it drops, and after every successful connection re-joins the groups the caller
 * asked for and fetches the active tasks, so a consumer ends up in the same state as
 * if the connection had never dropped.
 * <p>
 * All state changes and listener callbacks run on a single client thread.
 */
@Slf4j
public class ReconnectingClient implements AutoCloseable {

    private final EventStreamTransport transport;
    private final ReconnectPolicy policy;
    private final ScheduledExecutorService executor;
    private final boolean ownsExecutor;

    private final List<ClientListener> listeners = new CopyOnWriteArrayList<>();
    private final Set<String> desiredGroups = new CopyOnWriteArraySet<>();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile String connectionId;

    // Confined to the client thread
    private EventStreamTransport.StreamHandle stream;
    private int generation;
    private int attempts;

    public ReconnectingClient(EventStreamTransport transport, ReconnectPolicy policy) {
        this(transport, policy, Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "event-client");
            thread.setDaemon(true);
            return thread;
        }), true);
    }

    public ReconnectingClient(EventStreamTransport transport, ReconnectPolicy policy, ScheduledExecutorService executor) {
        this(transport, policy, executor, false);
    }

    private ReconnectingClient(EventStreamTransport transport,
                               ReconnectPolicy policy,
                               ScheduledExecutorService executor,
                               boolean ownsExecutor) {
        this.transport = transport;
        this.policy = policy;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    public void addListener(ClientListener listener) {
        listeners.add(listener);
    }

    public void start() {
        post(() -> {
            if (state != ConnectionState.DISCONNECTED) {
                return;
            }
            changeState(ConnectionState.CONNECTING);
            openStream();
        });
    }

    /**
     * Remembers the group and joins it now if connected. Groups are joined again after
     * every reconnection.
     */
    public void joinGroup(String group) {
        post(() -> {
            if (desiredGroups.add(group) && state == ConnectionState.CONNECTED) {
                try {
                    transport.joinGroup(connectionId, group);
                } catch (IOException e) {
                    log.warn("Could not join {}: {}", group, e.getMessage());
                }
            }
        });
    }

    public void leaveGroup(String group) {
        post(() -> {
            if (desiredGroups.remove(group) && state == ConnectionState.CONNECTED) {
                try {
                    transport.leaveGroup(connectionId, group);
                } catch (IOException e) {
                    log.warn("Could not leave {}: {}", group, e.getMessage());
                }
            }
        });
    }

    public ConnectionState getState() {
        return state;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public Set<String> getDesiredGroups() {
        return Set.copyOf(desiredGroups);
    }

    @Override
    public void close() {
        post(() -> {
            generation++;
            closeStream();
            connectionId = null;
            changeState(ConnectionState.CLOSED);
        });
        if (ownsExecutor) {
            executor.shutdown();
        }
    }

    private void openStream() {
        int current = ++generation;
        try {
            stream = transport.openStream(new EventStreamTransport.StreamListener() {
                @Override
                public void onEnvelope(EventEnvelope envelope) {
                    post(() -> {
                        if (current == generation) {
                            handleEnvelope(envelope);
                        }
                    });
                }

                @Override
                public void onClosed(Throwable error) {
                    post(() -> {
                        if (current == generation) {
                            handleDisconnect(error);
                        }
                    });
                }
            });
        } catch (IOException | RuntimeException e) {
            handleDisconnect(e);
        }
    }

    private void handleEnvelope(EventEnvelope envelope) {
        switch (envelope.type()) {
            case EventEnvelope.CONNECTED -> onConnected(envelope);
            case EventEnvelope.PING -> answerPing();
            default -> listeners.forEach(listener -> listener.onEvent(envelope));
        }
    }

    private void onConnected(EventEnvelope envelope) {
        if (!(envelope.payload() instanceof Map<?, ?> payload) || payload.get("connectionId") == null) {
            log.warn("Connected envelope without a connection id, ignoring it");
            return;
        }
        connectionId = String.valueOf(payload.get("connectionId"));
        attempts = 0;
        changeState(ConnectionState.CONNECTED);
        log.info("Event stream connected as {}", connectionId);

        try {
            for (String group : desiredGroups) {
                transport.joinGroup(connectionId, group);
            }
            List<TaskSnapshotDto> activeTasks = transport.fetchActiveTasks();
            listeners.forEach(listener -> listener.onResync(activeTasks));
        } catch (IOException | RuntimeException e) {
            log.warn("Restoring session on {} failed: {}", connectionId, e.getMessage());
            generation++;
            handleDisconnect(e);
        }
    }

    private void answerPing() {
        if (connectionId == null) {
            return;
        }
        try {
            transport.pong(connectionId);
        } catch (IOException e) {
            log.debug("Pong for {} failed: {}", connectionId, e.getMessage());
        }
    }

    private void handleDisconnect(Throwable error) {
        if (state == ConnectionState.CLOSED || state == ConnectionState.FAILED) {
            return;
        }
        closeStream();
        connectionId = null;
        attempts++;

        if (!policy.allowsAttempt(attempts)) {
            int made = attempts - 1;
            changeState(ConnectionState.FAILED);
            log.error("Event stream lost and {} reconnect attempts failed", made);
            listeners.forEach(listener -> listener.onReconnectFailed(made, error));
            return;
        }

        long delayMs = policy.delayFor(attempts).toMillis();
        changeState(ConnectionState.RECONNECTING);
        log.info("Event stream disconnected ({}), reconnect attempt {} in {} ms",
                error != null ? error.getMessage() : "closed by server", attempts, delayMs);
        try {
            executor.schedule(() -> {
                if (state == ConnectionState.RECONNECTING) {
                    openStream();
                }
            }, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Client executor is shut down, not reconnecting");
        }
    }

    private void closeStream() {
        if (stream != null) {
            try {
                stream.close();
            } catch (RuntimeException e) {
                log.debug("Closing event stream failed: {}", e.getMessage());
            }
            stream = null;
        }
    }

    private void changeState(ConnectionState next) {
        ConnectionState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        listeners.forEach(listener -> listener.onStateChanged(previous, next));
    }

    private void post(Runnable work) {
        try {
            executor.execute(work);
        } catch (RejectedExecutionException e) {
            log.debug("Client executor is shut down, dropping work");
        }
    }
}
