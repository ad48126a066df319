package com.xksgroup.conversionengine.controller;

import com.xksgroup.conversionengine.exception.ConflictException;
import com.xksgroup.conversionengine.exception.GlobalExceptionHandler;
import com.xksgroup.conversionengine.exception.InsufficientSpaceException;
import com.xksgroup.conversionengine.exception.InvalidTransitionException;
import com.xksgroup.conversionengine.exception.OutOfRangeException;
import com.xksgroup.conversionengine.exception.TaskNotFoundException;
import com.xksgroup.conversionengine.model.SourceDescriptor;
import com.xksgroup.conversionengine.model.SpaceCheckResult;
import com.xksgroup.conversionengine.model.Task;
import com.xksgroup.conversionengine.model.TaskStatus;
import com.xksgroup.conversionengine.model.dto.StartTaskRequest;
import com.xksgroup.conversionengine.service.AdmissionService;
import com.xksgroup.conversionengine.service.TaskRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class TaskControllerTest {

    @Mock
    private AdmissionService admissionService;

    @Mock
    private TaskRegistry taskRegistry;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new TaskController(admissionService, taskRegistry))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static Task task(String id, TaskStatus status) {
        return Task.builder()
                .id(id)
                .name("clip")
                .source(SourceDescriptor.builder().path("clip.mkv").size(1_000_000_000L).build())
                .status(status)
                .progress(status == TaskStatus.COMPLETED ? 100 : 0)
                .createdAt(LocalDateTime.of(2024, 6, 1, 12, 0))
                .reservedBytes(1_900_000_000L)
                .maxRetries(3)
                .build();
    }

    @Test
    void startTaskReturnsCreatedWithReservation() throws Exception {
        when(admissionService.startTask(any())).thenReturn(task("task-1", TaskStatus.PENDING));

        mockMvc.perform(post("/api/v1/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"clip\",\"sourcePath\":\"clip.mkv\",\"sourceSize\":1000000000}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.taskId").value("task-1"))
                .andExpect(jsonPath("$.reservedBytes").value(1_900_000_000L));
    }

    @Test
    void startTaskFillsUserFromPrincipal() throws Exception {
        when(admissionService.startTask(any())).thenReturn(task("task-1", TaskStatus.PENDING));

        mockMvc.perform(post("/api/v1/tasks")
                        .principal(() -> "user-42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"clip\",\"sourceSize\":10}"))
                .andExpect(status().isCreated());

        ArgumentCaptor<StartTaskRequest> captor = ArgumentCaptor.forClass(StartTaskRequest.class);
        verify(admissionService).startTask(captor.capture());
        assertThat(captor.getValue().getUserId()).isEqualTo("user-42");
    }

    @Test
    void invalidBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"\",\"sourceSize\":10}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        verifyNoInteractions(admissionService);
    }

    @Test
    void insufficientSpaceIs507WithCheckDetails() throws Exception {
        SpaceCheckResult check = SpaceCheckResult.builder()
                .hasEnoughSpace(false)
                .requiredSpace(800)
                .availableSpace(500)
                .message("Insufficient space: 800 B required, 500 B available")
                .build();
        when(admissionService.startTask(any())).thenThrow(new InsufficientSpaceException(check));

        mockMvc.perform(post("/api/v1/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"clip\",\"sourceSize\":10}"))
                .andExpect(status().isInsufficientStorage())
                .andExpect(jsonPath("$.error").value("INSUFFICIENT_SPACE"))
                .andExpect(jsonPath("$.details.availableSpace").value(500));
    }

    @Test
    void duplicateSourceIsConflict() throws Exception {
        when(admissionService.startTask(any())).thenThrow(new ConflictException("already converting"));

        mockMvc.perform(post("/api/v1/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"clip\",\"sourceSize\":10}"))
                .andExpect(status().isConflict());
    }

    @Test
    void unknownTaskIsNotFound() throws Exception {
        when(taskRegistry.get("task-x")).thenThrow(new TaskNotFoundException("task-x"));

        mockMvc.perform(get("/api/v1/tasks/task-x"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"))
                .andExpect(jsonPath("$.path").value("/api/v1/tasks/task-x"));
    }

    @Test
    void invalidTransitionIsConflictWithStatuses() throws Exception {
        when(taskRegistry.complete("task-1"))
                .thenThrow(new InvalidTransitionException("task-1", TaskStatus.PENDING, TaskStatus.COMPLETED));

        mockMvc.perform(post("/api/v1/tasks/task-1/complete"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INVALID_TRANSITION"))
                .andExpect(jsonPath("$.details.currentStatus").value("PENDING"));
    }

    @Test
    void progressReportWithoutProgressIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/tasks/task-1/progress")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"speed\":1.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        verifyNoInteractions(taskRegistry);
    }

    @Test
    void progressOutOfRangeIsBadRequest() throws Exception {
        when(taskRegistry.updateProgress("task-1", 150, null, null))
                .thenThrow(new OutOfRangeException("progress", 150, 0, 100));

        mockMvc.perform(post("/api/v1/tasks/task-1/progress")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"progress\":150}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.max").value(100));
    }

    @Test
    void activeTasksAreListedAsSnapshots() throws Exception {
        Task converting = task("task-1", TaskStatus.CONVERTING);
        converting.setProgress(40);
        when(taskRegistry.listActive()).thenReturn(List.of(converting));

        mockMvc.perform(get("/api/v1/tasks/active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].taskId").value("task-1"))
                .andExpect(jsonPath("$[0].statusMessage").value("Converting... 40%"))
                .andExpect(jsonPath("$[0].sourcePath").value("clip.mkv"));
    }

    @Test
    void completedListUsesPagingParameters() throws Exception {
        when(taskRegistry.listCompleted(2, 5)).thenReturn(List.of(task("task-9", TaskStatus.COMPLETED)));

        mockMvc.perform(get("/api/v1/tasks/completed").param("page", "2").param("pageSize", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].progress").value(100));
    }

    @Test
    void deleteAndCleanupReportWhatHappened() throws Exception {
        when(taskRegistry.cleanupTerminalTasks(7)).thenReturn(4);

        mockMvc.perform(delete("/api/v1/tasks/task-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(true));
        mockMvc.perform(post("/api/v1/tasks/cleanup").param("daysOld", "7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(4));

        verify(taskRegistry).delete("task-1");
    }

    @Test
    void retryReturnsNewTask() throws Exception {
        when(admissionService.retryTask("task-1")).thenReturn(task("task-2", TaskStatus.PENDING));

        mockMvc.perform(post("/api/v1/tasks/task-1/retry"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.taskId").value("task-2"));
    }

    @Test
    void workerFailureNeedsMessage() throws Exception {
        mockMvc.perform(post("/api/v1/tasks/task-1/fail")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(taskRegistry);
    }
}
