package com.xksgroup.conversionengine.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.xksgroup.conversionengine.model.TaskStatus;
import com.xksgroup.conversionengine.model.dto.TaskSnapshotDto;
import com.xksgroup.conversionengine.model.event.EventEnvelope;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OkHttpEventStreamTransportTest {

    private MockWebServer server;
    private OkHttpEventStreamTransport transport;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        transport = new OkHttpEventStreamTransport(server.url("/").toString(), new OkHttpClient(),
                new ObjectMapper().registerModule(new JavaTimeModule()), () -> "token-123", null);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void joinPostsGroupNameWithBearerToken() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));

        transport.joinGroup("conn-1", "task:t1");

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/api/v1/events/connections/conn-1/groups");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer token-123");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"name\":\"task:t1\"}");
    }

    @Test
    void fetchesActiveTasks() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("[{\"taskId\":\"t1\",\"status\":\"CONVERTING\",\"progress\":12,\"createdAt\":\"2024-06-01T12:00:00\"}]"));

        List<TaskSnapshotDto> tasks = transport.fetchActiveTasks();

        assertThat(tasks).singleElement().satisfies(task -> {
            assertThat(task.getTaskId()).isEqualTo("t1");
            assertThat(task.getStatus()).isEqualTo(TaskStatus.CONVERTING);
        });
        assertThat(server.takeRequest(5, TimeUnit.SECONDS).getPath()).isEqualTo("/api/v1/tasks/active");
    }

    @Test
    void errorStatusBecomesIOException() {
        server.enqueue(new MockResponse().setResponseCode(404));

        assertThatThrownBy(() -> transport.pong("conn-gone"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("404");
    }

    @Test
    void streamDeliversEnvelopesThenReportsClose() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "text/event-stream")
                .setBody("event: Connected\n"
                        + "data: {\"type\":\"Connected\",\"payload\":{\"connectionId\":\"conn-7\"},\"timestamp\":\"2024-06-01T12:00:00\"}\n\n"
                        + "event: ProgressUpdate\n"
                        + "data: {\"type\":\"ProgressUpdate\",\"taskId\":\"t1\",\"timestamp\":\"2024-06-01T12:00:01\"}\n\n"));

        List<EventEnvelope> received = new CopyOnWriteArrayList<>();
        CountDownLatch closed = new CountDownLatch(1);
        Throwable[] closeError = new Throwable[1];
        transport.openStream(new EventStreamTransport.StreamListener() {
            @Override
            public void onEnvelope(EventEnvelope envelope) {
                received.add(envelope);
            }

            @Override
            public void onClosed(Throwable error) {
                closeError[0] = error;
                closed.countDown();
            }
        });

        assertThat(closed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(received).extracting(EventEnvelope::type).containsExactly("Connected", "ProgressUpdate");
        assertThat(closeError[0]).isNull();
        assertThat(server.takeRequest(5, TimeUnit.SECONDS).getPath()).isEqualTo("/api/v1/events/stream");
    }

    @Test
    void refusedStreamReportsError() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(401));

        CountDownLatch closed = new CountDownLatch(1);
        Throwable[] closeError = new Throwable[1];
        transport.openStream(new EventStreamTransport.StreamListener() {
            @Override
            public void onEnvelope(EventEnvelope envelope) {
            }

            @Override
            public void onClosed(Throwable error) {
                closeError[0] = error;
                closed.countDown();
            }
        });

        assertThat(closed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(closeError[0]).isNotNull();
    }
}
