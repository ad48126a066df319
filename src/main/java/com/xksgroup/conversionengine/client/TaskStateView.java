package com.xksgroup.conversionengine.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.conversionengine.model.dto.TaskSnapshotDto;
import com.xksgroup.conversionengine.model.event.EventEnvelope;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Client-side mirror of the active tasks, fed by stream events and replaced wholesale
 * on every resync.
 */
@Slf4j
public class TaskStateView implements ClientListener {

    private static final String STATUS_UPDATE = "StatusUpdate";
    private static final String PROGRESS_UPDATE = "ProgressUpdate";
    private static final String TASK_COMPLETED = "TaskCompleted";
    private static final String TASK_DELETED = "TaskDeleted";

    private final ObjectMapper objectMapper;
    private final Map<String, TaskSnapshotDto> activeTasks = new ConcurrentHashMap<>();

    public TaskStateView(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void onEvent(EventEnvelope envelope) {
        switch (envelope.type()) {
            case STATUS_UPDATE, PROGRESS_UPDATE -> toTask(envelope).ifPresent(this::applyIfNewer);
            case TASK_COMPLETED, TASK_DELETED -> {
                if (envelope.taskId() != null) {
                    activeTasks.remove(envelope.taskId());
                }
            }
            default -> {
                // Space and control envelopes are not task state
            }
        }
    }

    @Override
    public void onResync(List<TaskSnapshotDto> tasks) {
        activeTasks.clear();
        for (TaskSnapshotDto task : tasks) {
            apply(task);
        }
        log.debug("Task view resynchronized with {} active tasks", activeTasks.size());
    }

    public Optional<TaskSnapshotDto> get(String taskId) {
        return Optional.ofNullable(activeTasks.get(taskId));
    }

    /**
     * Active tasks, oldest first.
     */
    public List<TaskSnapshotDto> activeTasks() {
        return activeTasks.values().stream()
                .sorted(Comparator.comparing(TaskSnapshotDto::getCreatedAt,
                        Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder())))
                .collect(Collectors.toList());
    }

    /**
     * Envelopes queued while a resync was fetching can be older than the snapshot it
     * installed; those are skipped.
     */
    private void applyIfNewer(TaskSnapshotDto task) {
        TaskSnapshotDto known = activeTasks.get(task.getTaskId());
        if (known != null && task.getRevision() < known.getRevision()) {
            log.debug("Skipping stale update of task {} (revision {} < {})",
                    task.getTaskId(), task.getRevision(), known.getRevision());
            return;
        }
        apply(task);
    }

    private void apply(TaskSnapshotDto task) {
        if (task.getStatus() != null && task.getStatus().isActive()) {
            activeTasks.put(task.getTaskId(), task);
        } else {
            activeTasks.remove(task.getTaskId());
        }
    }

    private Optional<TaskSnapshotDto> toTask(EventEnvelope envelope) {
        if (envelope.payload() == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.convertValue(envelope.payload(), TaskSnapshotDto.class));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring {} envelope with unreadable payload: {}", envelope.type(), e.getMessage());
            return Optional.empty();
        }
    }
}
