package com.xksgroup.conversionengine.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.conversionengine.model.dto.TaskSnapshotDto;
import com.xksgroup.conversionengine.model.event.EventEnvelope;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okhttp3.sse.EventSource;
import okhttp3.sse.EventSourceListener;
import okhttp3.sse.EventSources;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * {@link EventStreamTransport} over HTTP: SSE for the stream, small REST calls for
 * group membership, pongs and the active task list.
 */
@Slf4j
public class OkHttpEventStreamTransport implements EventStreamTransport {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final HttpUrl baseUrl;
    private final OkHttpClient httpClient;
    private final OkHttpClient streamClient;
    private final ObjectMapper objectMapper;
    private final Supplier<String> tokenSupplier;
    private final String userId;

    /**
     * @param tokenSupplier bearer token for each request, may return null when the
     *                      server runs without security
     * @param userId        sent as a query parameter when no token is used
     */
    public OkHttpEventStreamTransport(String baseUrl,
                                      OkHttpClient httpClient,
                                      ObjectMapper objectMapper,
                                      Supplier<String> tokenSupplier,
                                      String userId) {
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid base URL: " + baseUrl);
        }
        this.baseUrl = parsed;
        this.httpClient = httpClient;
        this.streamClient = httpClient.newBuilder()
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .build();
        this.objectMapper = objectMapper;
        this.tokenSupplier = tokenSupplier != null ? tokenSupplier : () -> null;
        this.userId = userId;
    }

    @Override
    public StreamHandle openStream(StreamListener listener) {
        HttpUrl.Builder url = api("events", "stream");
        if (userId != null) {
            url.addQueryParameter("userId", userId);
        }
        Request request = authorized(new Request.Builder()
                .url(url.build())
                .header("Accept", "text/event-stream"))
                .build();

        EventSource eventSource = EventSources.createFactory(streamClient).newEventSource(request, new EventSourceListener() {
            @Override
            public void onEvent(EventSource source, String id, String type, String data) {
                try {
                    listener.onEnvelope(objectMapper.readValue(data, EventEnvelope.class));
                } catch (JsonProcessingException e) {
                    log.warn("Unreadable '{}' event: {}", type, e.getOriginalMessage());
                }
            }

            @Override
            public void onClosed(EventSource source) {
                listener.onClosed(null);
            }

            @Override
            public void onFailure(EventSource source, Throwable t, Response response) {
                Throwable error = t != null
                        ? t
                        : new IOException("Event stream refused with HTTP " + (response != null ? response.code() : "?"));
                listener.onClosed(error);
            }
        });
        return eventSource::cancel;
    }

    @Override
    public void joinGroup(String connectionId, String group) throws IOException {
        byte[] body = objectMapper.writeValueAsBytes(Map.of("name", group));
        execute(new Request.Builder()
                .url(api("events", "connections", connectionId, "groups").build())
                .post(RequestBody.create(body, JSON)));
    }

    @Override
    public void leaveGroup(String connectionId, String group) throws IOException {
        execute(new Request.Builder()
                .url(api("events", "connections", connectionId, "groups", group).build())
                .delete());
    }

    @Override
    public void pong(String connectionId) throws IOException {
        execute(new Request.Builder()
                .url(api("events", "connections", connectionId, "pong").build())
                .post(RequestBody.create(new byte[0], null)));
    }

    @Override
    public List<TaskSnapshotDto> fetchActiveTasks() throws IOException {
        byte[] body = execute(new Request.Builder()
                .url(api("tasks", "active").build())
                .get());
        return objectMapper.readValue(body, new TypeReference<List<TaskSnapshotDto>>() {
        });
    }

    private byte[] execute(Request.Builder builder) throws IOException {
        try (Response response = httpClient.newCall(authorized(builder).build()).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code() + " from " + response.request().url().encodedPath());
            }
            return body != null ? body.bytes() : new byte[0];
        }
    }

    private Request.Builder authorized(Request.Builder builder) {
        String token = tokenSupplier.get();
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder;
    }

    private HttpUrl.Builder api(String... segments) {
        HttpUrl.Builder builder = baseUrl.newBuilder()
                .addPathSegment("api")
                .addPathSegment("v1");
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder;
    }
}
