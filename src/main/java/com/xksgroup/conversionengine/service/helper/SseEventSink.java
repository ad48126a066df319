package com.xksgroup.conversionengine.service.helper;

import com.xksgroup.conversionengine.model.event.EventEnvelope;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.UUID;

public class SseEventSink implements EventSink {

    private static final long RECONNECT_TIME_MS = 3000;

    private final SseEmitter emitter;

    public SseEventSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void send(EventEnvelope envelope) throws IOException {
        try {
            emitter.send(SseEmitter.event()
                    .id(UUID.randomUUID().toString())
                    .name(envelope.type())
                    .data(envelope, MediaType.APPLICATION_JSON)
                    .reconnectTime(RECONNECT_TIME_MS));
        } catch (IllegalStateException e) {
            // Emitter already completed
            throw new IOException("Event stream already closed", e);
        }
    }

    @Override
    public void close() {
        emitter.complete();
    }
}
