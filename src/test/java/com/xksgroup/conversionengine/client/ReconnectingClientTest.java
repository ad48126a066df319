package com.xksgroup.conversionengine.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.xksgroup.conversionengine.model.TaskStatus;
import com.xksgroup.conversionengine.model.dto.TaskSnapshotDto;
import com.xksgroup.conversionengine.model.event.EventEnvelope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class ReconnectingClientTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 1, 12, 0);

    private static final ReconnectPolicy FAST = ReconnectPolicy.builder()
            .initialDelay(Duration.ofMillis(1))
            .multiplier(2.0)
            .maxDelay(Duration.ofMillis(5))
            .maxAttempts(5)
            .build();

    private final FakeTransport transport = new FakeTransport();
    private final RecordingListener listener = new RecordingListener();
    private ReconnectingClient client;

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
    }

    private ReconnectingClient startClient(ClientListener... before) {
        client = new ReconnectingClient(transport, FAST);
        for (ClientListener extra : before) {
            client.addListener(extra);
        }
        // Registered last, so awaiting on it means every other listener has run
        client.addListener(listener);
        return client;
    }

    private static TaskSnapshotDto active(String id, TaskStatus status, int progress) {
        return TaskSnapshotDto.builder()
                .taskId(id)
                .name(id)
                .status(status)
                .progress(progress)
                .createdAt(NOW)
                .build();
    }

    @Test
    void connectsThenRestoresGroupsAndResyncs() {
        transport.activeTasks = List.of(active("t1", TaskStatus.CONVERTING, 10));
        ReconnectingClient client = startClient();
        client.joinGroup("space-monitor");
        client.joinGroup("task:t1");

        client.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> listener.resyncs.size() == 1);
        assertThat(client.getState()).isEqualTo(ConnectionState.CONNECTED);
        assertThat(client.getConnectionId()).isEqualTo("conn-1");
        assertThat(transport.joins).containsExactlyInAnyOrder("conn-1:space-monitor", "conn-1:task:t1");
        assertThat(listener.resyncs.get(0)).extracting(TaskSnapshotDto::getTaskId).containsExactly("t1");
        assertThat(listener.states).containsSubsequence(ConnectionState.CONNECTING, ConnectionState.CONNECTED);
    }

    @Test
    void answersPingsAndForwardsOtherEvents() {
        ReconnectingClient client = startClient();
        client.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> client.getState() == ConnectionState.CONNECTED);

        transport.emit(EventEnvelope.ping("conn-1", NOW));
        transport.emit(new EventEnvelope("ProgressUpdate", "t1", null, NOW));

        await().atMost(Duration.ofSeconds(5)).until(() -> listener.events.size() == 1);
        assertThat(transport.pongs).containsExactly("conn-1");
        assertThat(listener.events.get(0).type()).isEqualTo("ProgressUpdate");
    }

    @Test
    void reconnectsAfterDropAndEndsInSameStateAsUninterruptedClient() {
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        TaskStateView view = new TaskStateView(mapper);
        transport.activeTasks = List.of(active("t1", TaskStatus.CONVERTING, 10), active("t2", TaskStatus.PENDING, 0));
        ReconnectingClient client = startClient(view);
        client.joinGroup("all");
        client.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> listener.resyncs.size() == 1);

        // While disconnected t1 finished and t2 progressed
        transport.activeTasks = List.of(active("t2", TaskStatus.CONVERTING, 55));
        transport.dropStream(new IOException("connection reset"));

        await().atMost(Duration.ofSeconds(5)).until(() -> listener.resyncs.size() == 2);
        assertThat(client.getState()).isEqualTo(ConnectionState.CONNECTED);
        assertThat(client.getConnectionId()).isEqualTo("conn-2");
        assertThat(transport.joins).containsExactly("conn-1:all", "conn-2:all");
        assertThat(transport.handles.get(0).closed).isTrue();
        assertThat(listener.states).containsSubsequence(
                ConnectionState.CONNECTED, ConnectionState.RECONNECTING, ConnectionState.CONNECTED);

        TaskStateView uninterrupted = new TaskStateView(mapper);
        uninterrupted.onResync(transport.activeTasks);
        assertThat(view.activeTasks()).usingRecursiveFieldByFieldElementComparator()
                .isEqualTo(uninterrupted.activeTasks());
    }

    @Test
    void givesUpAfterMaxAttempts() {
        transport.failOpens = Integer.MAX_VALUE;
        ReconnectingClient client = startClient();

        client.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> !listener.failedAttempts.isEmpty());
        assertThat(client.getState()).isEqualTo(ConnectionState.FAILED);
        assertThat(transport.opens.get()).isEqualTo(1 + FAST.getMaxAttempts());
        assertThat(listener.failedAttempts).containsExactly(FAST.getMaxAttempts());
    }

    @Test
    void successfulConnectResetsAttemptCounter() {
        transport.failOpens = 4;
        ReconnectingClient client = startClient();
        client.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> client.getState() == ConnectionState.CONNECTED);

        transport.failOpens = transport.opens.get() + 4;
        transport.dropStream(null);

        await().atMost(Duration.ofSeconds(5)).until(() -> listener.resyncs.size() == 2);
        assertThat(client.getState()).isEqualTo(ConnectionState.CONNECTED);
        assertThat(listener.failedAttempts).isEmpty();
    }

    @Test
    void eventsFromReplacedStreamAreIgnored() {
        ReconnectingClient client = startClient();
        client.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> client.getState() == ConnectionState.CONNECTED);
        EventStreamTransport.StreamListener stale = transport.currentListener();

        transport.dropStream(null);
        await().atMost(Duration.ofSeconds(5)).until(() -> listener.resyncs.size() == 2);
        stale.onEnvelope(new EventEnvelope("ProgressUpdate", "old", null, NOW));
        transport.emit(new EventEnvelope("ProgressUpdate", "new", null, NOW));

        await().atMost(Duration.ofSeconds(5)).until(() -> !listener.events.isEmpty());
        assertThat(listener.events).extracting(EventEnvelope::taskId).containsExactly("new");
    }

    @Test
    void closeStopsTheStream() {
        ReconnectingClient client = startClient();
        client.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> client.getState() == ConnectionState.CONNECTED);

        client.close();

        await().atMost(Duration.ofSeconds(5)).until(() -> client.getState() == ConnectionState.CLOSED);
        assertThat(transport.handles.get(0).closed).isTrue();
        assertThat(client.getConnectionId()).isNull();
    }

    static class RecordingListener implements ClientListener {
        final List<ConnectionState> states = new CopyOnWriteArrayList<>();
        final List<EventEnvelope> events = new CopyOnWriteArrayList<>();
        final List<List<TaskSnapshotDto>> resyncs = new CopyOnWriteArrayList<>();
        final List<Integer> failedAttempts = new CopyOnWriteArrayList<>();

        @Override
        public void onStateChanged(ConnectionState previous, ConnectionState current) {
            states.add(current);
        }

        @Override
        public void onEvent(EventEnvelope envelope) {
            events.add(envelope);
        }

        @Override
        public void onResync(List<TaskSnapshotDto> activeTasks) {
            resyncs.add(new ArrayList<>(activeTasks));
        }

        @Override
        public void onReconnectFailed(int attempts, Throwable lastError) {
            failedAttempts.add(attempts);
        }
    }

    /**
     * In-memory server: each successful open greets the listener with a fresh connection id.
     */
    static class FakeTransport implements EventStreamTransport {
        final AtomicInteger opens = new AtomicInteger();
        final List<FakeHandle> handles = new CopyOnWriteArrayList<>();
        final List<String> joins = new CopyOnWriteArrayList<>();
        final List<String> pongs = new CopyOnWriteArrayList<>();
        volatile int failOpens;
        volatile List<TaskSnapshotDto> activeTasks = List.of();
        private volatile StreamListener listener;
        private int connections;

        @Override
        public StreamHandle openStream(StreamListener streamListener) throws IOException {
            int attempt = opens.incrementAndGet();
            if (attempt <= failOpens) {
                throw new IOException("connection refused");
            }
            FakeHandle handle = new FakeHandle();
            handles.add(handle);
            listener = streamListener;
            streamListener.onEnvelope(EventEnvelope.connected("conn-" + (++connections), NOW));
            return handle;
        }

        StreamListener currentListener() {
            return listener;
        }

        void emit(EventEnvelope envelope) {
            listener.onEnvelope(envelope);
        }

        void dropStream(Throwable error) {
            listener.onClosed(error);
        }

        @Override
        public void joinGroup(String connectionId, String group) {
            joins.add(connectionId + ":" + group);
        }

        @Override
        public void leaveGroup(String connectionId, String group) {
            joins.remove(connectionId + ":" + group);
        }

        @Override
        public void pong(String connectionId) {
            pongs.add(connectionId);
        }

        @Override
        public List<TaskSnapshotDto> fetchActiveTasks() {
            return activeTasks;
        }
    }

    static class FakeHandle implements EventStreamTransport.StreamHandle {
        volatile boolean closed;

        @Override
        public void close() {
            closed = true;
        }
    }
}
