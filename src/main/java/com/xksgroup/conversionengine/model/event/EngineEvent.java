package com.xksgroup.conversionengine.model.event;

import com.xksgroup.conversionengine.model.SpaceUsageSnapshot;
import com.xksgroup.conversionengine.model.Task;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A state change inside the engine. Task events carry a detached task copy, space
 * events carry the snapshot that was current when they were raised.
 */
public record EngineEvent(
        EventType type,
        String taskId,
        Task task,
        SpaceUsageSnapshot space,
        LocalDateTime timestamp
) {

    public EngineEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static EngineEvent forTask(EventType type, Task task, LocalDateTime timestamp) {
        return new EngineEvent(type, task.getId(), task.copy(), null, timestamp);
    }

    public static EngineEvent forSpace(SpaceUsageSnapshot snapshot, LocalDateTime timestamp) {
        return new EngineEvent(EventType.SPACE_STATUS_CHANGED, null, null, snapshot, timestamp);
    }

    public boolean isTaskEvent() {
        return type != EventType.SPACE_STATUS_CHANGED;
    }
}
