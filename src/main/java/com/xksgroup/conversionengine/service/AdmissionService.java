package com.xksgroup.conversionengine.service;

import com.xksgroup.conversionengine.exception.ConflictException;
import com.xksgroup.conversionengine.exception.OutOfRangeException;
import com.xksgroup.conversionengine.exception.ValidationException;
import com.xksgroup.conversionengine.model.SourceDescriptor;
import com.xksgroup.conversionengine.model.Task;
import com.xksgroup.conversionengine.model.TaskDraft;
import com.xksgroup.conversionengine.model.TaskStatus;
import com.xksgroup.conversionengine.model.dto.SpaceCheckRequest;
import com.xksgroup.conversionengine.model.dto.StartTaskRequest;
import com.xksgroup.conversionengine.service.helper.BackgroundSupervisor;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Front door for new conversions: a task is only created once the space it will need
 * has been reserved, and the reservation is given back when the task finishes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdmissionService implements TaskLifecycleListener {

    public static final int MAX_RETRIES_LIMIT = 10;

    private final TaskRegistry taskRegistry;
    private final SpaceAccountant spaceAccountant;
    private final SpaceLedger ledger;
    private final OutputSizeEstimator estimator;
    private final BackgroundSupervisor supervisor;

    // Source paths with an admission in flight
    private final Set<String> admitting = ConcurrentHashMap.newKeySet();

    @PostConstruct
    public void init() {
        taskRegistry.addListener(this);
    }

    public Task startTask(StartTaskRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        if (request.getName() == null || request.getName().isBlank()) {
            throw new ValidationException("Task name is required");
        }
        if (request.getSourceSize() <= 0) {
            throw new ValidationException("sourceSize must be positive");
        }
        int maxRetries = request.getMaxRetries() != null ? request.getMaxRetries() : TaskDraft.DEFAULT_MAX_RETRIES;
        if (maxRetries < 0 || maxRetries > MAX_RETRIES_LIMIT) {
            throw new OutOfRangeException("maxRetries", maxRetries, 0, MAX_RETRIES_LIMIT);
        }

        boolean pathProvided = request.getSourcePath() != null && !request.getSourcePath().isBlank();
        String sourcePath = pathProvided ? request.getSourcePath().trim() : request.getName().trim();

        return admit(TaskDraft.builder()
                .name(request.getName())
                .source(SourceDescriptor.builder()
                        .path(sourcePath)
                        .size(request.getSourceSize())
                        .pathProvided(pathProvided)
                        .build())
                .parameters(request.getParameters())
                .ownerId(request.getUserId())
                .maxRetries(maxRetries)
                .build());
    }

    /**
     * Re-admits a failed task as a new one. The failed record is left untouched.
     */
    public Task retryTask(String taskId) {
        Task failed = taskRegistry.get(taskId);
        if (failed.getStatus() != TaskStatus.FAILED) {
            throw new ConflictException(String.format("Task %s is %s, only failed tasks can be retried",
                    taskId, failed.getStatus().displayName()));
        }
        if (failed.getRetryCount() >= failed.getMaxRetries()) {
            throw new ConflictException(String.format("Task %s has used all %d retries",
                    taskId, failed.getMaxRetries()));
        }

        Task retried = admit(TaskDraft.builder()
                .name(failed.getName())
                .source(failed.getSource())
                .parameters(failed.getParameters())
                .ownerId(failed.getOwnerId())
                .maxRetries(failed.getMaxRetries())
                .retryCount(failed.getRetryCount() + 1)
                .build());
        log.info("Task {} retried as {} (attempt {}/{})",
                taskId, retried.getId(), retried.getRetryCount(), retried.getMaxRetries());
        return retried;
    }

    @Override
    public void onTaskFinished(Task task) {
        releaseFor(task);
    }

    @Override
    public void onTaskDeleted(Task task) {
        releaseFor(task);
    }

    private Task admit(TaskDraft draft) {
        String sourcePath = draft.getSource().getPath();
        boolean guarded = draft.getSource().isPathProvided();
        if (guarded && !admitting.add(sourcePath)) {
            throw new ConflictException("A task for source '" + sourcePath + "' is already being admitted");
        }
        try {
            if (guarded) {
                boolean duplicate = taskRegistry.listActive().stream()
                        .anyMatch(task -> task.getSource().isPathProvided() && sourcePath.equals(task.getSource().getPath()));
                if (duplicate) {
                    throw new ConflictException("An active task already converts '" + sourcePath + "'");
                }
            }

            long sourceSize = draft.getSource().getSize();
            long estimatedOutput = estimator.estimate(sourceSize, draft.getParameters());
            long required = SpaceAccountant.requiredBytes(sourceSize, estimatedOutput, true);
            SpaceCheckRequest check = SpaceCheckRequest.builder()
                    .originalFileSize(sourceSize)
                    .estimatedOutputSize(estimatedOutput)
                    .includeTempSpace(true)
                    .build();

            String reservationId = ledger.reserve(required, () -> spaceAccountant.checkSpace(check));
            Task task;
            try {
                task = taskRegistry.create(draft.toBuilder().reservedBytes(required).build());
            } catch (RuntimeException e) {
                ledger.release(reservationId);
                throw e;
            }
            ledger.bind(reservationId, task.getId());
            if (taskRegistry.get(task.getId()).getStatus().isTerminal()) {
                // Finished before the binding existed, so the listener found nothing to release
                ledger.release(reservationId);
            }

            log.info("Task {} admitted - Reserved: {} bytes (estimated output {} bytes)",
                    task.getId(), required, estimatedOutput);
            return task;
        } finally {
            if (guarded) {
                admitting.remove(sourcePath);
            }
        }
    }

    private void releaseFor(Task task) {
        long released = ledger.releaseForTask(task.getId());
        if (released > 0) {
            log.debug("Released {} bytes held by task {}", released, task.getId());
            supervisor.submit("space-refresh", spaceAccountant::refresh);
        }
    }
}
