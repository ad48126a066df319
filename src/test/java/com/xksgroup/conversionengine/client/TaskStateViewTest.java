package com.xksgroup.conversionengine.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.xksgroup.conversionengine.model.TaskStatus;
import com.xksgroup.conversionengine.model.dto.TaskSnapshotDto;
import com.xksgroup.conversionengine.model.event.EventEnvelope;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TaskStateViewTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 1, 12, 0);

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private final TaskStateView view = new TaskStateView(mapper);

    private static TaskSnapshotDto task(String id, TaskStatus status, int progress, int minute) {
        return TaskSnapshotDto.builder()
                .taskId(id)
                .status(status)
                .progress(progress)
                .createdAt(NOW.plusMinutes(minute))
                .build();
    }

    @Test
    void appliesUpdatesReceivedAsJson() throws Exception {
        String json = """
                {
                  "type": "ProgressUpdate",
                  "taskId": "t1",
                  "payload": {"taskId": "t1", "status": "CONVERTING", "progress": 37, "createdAt": "2024-06-01T12:00:00"},
                  "timestamp": "2024-06-01T12:00:05"
                }
                """;

        view.onEvent(mapper.readValue(json, EventEnvelope.class));

        assertThat(view.get("t1")).get().extracting(TaskSnapshotDto::getProgress).isEqualTo(37);
    }

    @Test
    void terminalStatusAndRemovalEventsDropTheTask() {
        view.onResync(List.of(task("t1", TaskStatus.CONVERTING, 10, 0), task("t2", TaskStatus.PENDING, 0, 1),
                task("t3", TaskStatus.PENDING, 0, 2)));

        view.onEvent(new EventEnvelope("StatusUpdate", "t1", task("t1", TaskStatus.FAILED, 10, 0), NOW));
        view.onEvent(new EventEnvelope("TaskCompleted", "t2", task("t2", TaskStatus.COMPLETED, 100, 1), NOW));
        view.onEvent(new EventEnvelope("TaskDeleted", "t3", null, NOW));

        assertThat(view.activeTasks()).isEmpty();
    }

    @Test
    void resyncReplacesEverythingAndOrdersByCreation() {
        view.onEvent(new EventEnvelope("StatusUpdate", "gone", task("gone", TaskStatus.PENDING, 0, 0), NOW));

        view.onResync(List.of(task("late", TaskStatus.PENDING, 0, 9), task("early", TaskStatus.CONVERTING, 50, 3)));

        assertThat(view.activeTasks()).extracting(TaskSnapshotDto::getTaskId).containsExactly("early", "late");
        assertThat(view.get("gone")).isEmpty();
    }

    @Test
    void updatesOlderThanTheResyncSnapshotAreSkipped() {
        TaskSnapshotDto fetched = task("t1", TaskStatus.CONVERTING, 60, 0);
        fetched.setRevision(7);
        view.onResync(List.of(fetched));

        TaskSnapshotDto queuedDuringFetch = task("t1", TaskStatus.CONVERTING, 40, 0);
        queuedDuringFetch.setRevision(5);
        view.onEvent(new EventEnvelope("ProgressUpdate", "t1", queuedDuringFetch, NOW));
        assertThat(view.get("t1")).get().extracting(TaskSnapshotDto::getProgress).isEqualTo(60);

        TaskSnapshotDto next = task("t1", TaskStatus.CONVERTING, 65, 0);
        next.setRevision(8);
        view.onEvent(new EventEnvelope("ProgressUpdate", "t1", next, NOW));
        assertThat(view.get("t1")).get().extracting(TaskSnapshotDto::getProgress).isEqualTo(65);
    }

    @Test
    void ignoresNonTaskEnvelopes() {
        view.onEvent(new EventEnvelope("SpaceStatusUpdate", null, Map.of("usedBytes", 1), NOW));
        view.onEvent(new EventEnvelope("StatusUpdate", "t1", null, NOW));

        assertThat(view.activeTasks()).isEmpty();
    }
}
