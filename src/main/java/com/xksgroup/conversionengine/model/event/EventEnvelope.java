package com.xksgroup.conversionengine.model.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.xksgroup.conversionengine.model.dto.TaskSnapshotDto;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * What actually travels over the event stream.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventEnvelope(
        String type,
        String taskId,
        Object payload,
        LocalDateTime timestamp
) {
    public static final String CONNECTED = "Connected";
    public static final String PING = "Ping";

    public static EventEnvelope from(EngineEvent event) {
        Object payload = event.isTaskEvent()
                ? TaskSnapshotDto.fromTask(event.task())
                : event.space();
        return new EventEnvelope(event.type().wireType(), event.taskId(), payload, event.timestamp());
    }

    public static EventEnvelope connected(String connectionId, LocalDateTime now) {
        return new EventEnvelope(CONNECTED, null, Map.of("connectionId", connectionId), now);
    }

    public static EventEnvelope ping(String connectionId, LocalDateTime now) {
        return new EventEnvelope(PING, null, Map.of("connectionId", connectionId), now);
    }
}
