package com.xksgroup.conversionengine.service;

import com.xksgroup.conversionengine.exception.InvalidTransitionException;
import com.xksgroup.conversionengine.exception.OutOfRangeException;
import com.xksgroup.conversionengine.exception.TaskNotFoundException;
import com.xksgroup.conversionengine.exception.ValidationException;
import com.xksgroup.conversionengine.model.ConversionParameters;
import com.xksgroup.conversionengine.model.SourceDescriptor;
import com.xksgroup.conversionengine.model.Task;
import com.xksgroup.conversionengine.model.TaskDraft;
import com.xksgroup.conversionengine.model.TaskStatus;
import com.xksgroup.conversionengine.model.event.EngineEvent;
import com.xksgroup.conversionengine.model.event.EventType;
import com.xksgroup.conversionengine.repo.TaskStore;
import com.xksgroup.conversionengine.service.helper.IdGenerator;
import com.xksgroup.conversionengine.service.helper.TimeSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Owns every task record and its lifecycle. Mutations on one task are serialized by a
 * per-task lock and each successful mutation publishes exactly one event before the
 * lock is released, so observers see changes in the order they were applied.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskRegistry {

    public static final int MAX_PAGE_SIZE = 100;
    public static final int MAX_CLEANUP_DAYS = 365;

    private final TaskStore taskStore;
    private final EngineEventPublisher eventPublisher;
    private final TimeSource timeSource;
    private final IdGenerator idGenerator;

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final List<TaskLifecycleListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(TaskLifecycleListener listener) {
        listeners.add(listener);
    }

    public Task create(String name, SourceDescriptor source, ConversionParameters parameters) {
        return create(TaskDraft.builder()
                .name(name)
                .source(source)
                .parameters(parameters)
                .build());
    }

    public Task create(TaskDraft draft) {
        if (draft.getName() == null || draft.getName().isBlank()) {
            throw new ValidationException("Task name is required");
        }
        if (draft.getSource() == null || !draft.getSource().isValid()) {
            throw new ValidationException("Source must have a path and a positive size");
        }

        LocalDateTime now = timeSource.now();
        Task task = Task.builder()
                .id(idGenerator.newTaskId())
                .name(draft.getName().trim())
                .source(draft.getSource().toBuilder().build())
                .parameters(draft.getParameters() != null ? draft.getParameters().copy() : null)
                .ownerId(draft.getOwnerId())
                .status(TaskStatus.PENDING)
                .progress(0)
                .createdAt(now)
                .retryCount(draft.getRetryCount())
                .maxRetries(draft.getMaxRetries())
                .reservedBytes(draft.getReservedBytes())
                .build();

        ReentrantLock lock = lockFor(task.getId());
        lock.lock();
        try {
            taskStore.save(task);
            eventPublisher.publish(EngineEvent.forTask(EventType.CREATED, task, now));
        } finally {
            lock.unlock();
        }

        log.info("Task created - ID: {}, Name: '{}', Source: {} ({} bytes)",
                task.getId(), task.getName(), task.getSource().getPath(), task.getSource().getSize());
        return task.copy();
    }

    public Task start(String id) {
        return transition(id, TaskStatus.CONVERTING, EventType.STATUS_CHANGED, task -> {
            task.setStartedAt(timeSource.now());
            task.setProgress(0);
        });
    }

    public Task updateProgress(String id, int progress, Double speed, Integer etaSeconds) {
        if (progress < 0 || progress > 100) {
            throw new OutOfRangeException("progress", progress, 0, 100);
        }

        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            Task task = load(id);
            if (task.getStatus() != TaskStatus.CONVERTING) {
                throw new InvalidTransitionException(id, task.getStatus(), TaskStatus.CONVERTING);
            }
            task.setProgress(progress);
            task.setSpeed(speed);
            task.setEtaSeconds(etaSeconds);
            task.setRevision(task.getRevision() + 1);
            taskStore.save(task);
            eventPublisher.publish(EngineEvent.forTask(EventType.PROGRESS_UPDATED, task, timeSource.now()));
            log.debug("Task {} progress: {}%", id, progress);
            return task.copy();
        } finally {
            lock.unlock();
        }
    }

    public Task complete(String id) {
        return transition(id, TaskStatus.COMPLETED, EventType.COMPLETED, task -> {
            task.setProgress(100);
            task.setEtaSeconds(null);
            task.setCompletedAt(timeSource.now());
        });
    }

    public Task fail(String id, String message) {
        return transition(id, TaskStatus.FAILED, EventType.STATUS_CHANGED, task -> {
            task.setErrorMessage(message);
            task.setEtaSeconds(null);
            task.setCompletedAt(timeSource.now());
        });
    }

    public Task cancel(String id) {
        return transition(id, TaskStatus.CANCELLED, EventType.STATUS_CHANGED, task -> {
            task.setEtaSeconds(null);
            task.setCompletedAt(timeSource.now());
        });
    }

    public Task get(String id) {
        return load(id).copy();
    }

    public List<Task> list() {
        return taskStore.findAll();
    }

    /**
     * Pending and converting tasks, oldest first.
     */
    public List<Task> listActive() {
        return taskStore.findByStatusIn(EnumSet.of(TaskStatus.PENDING, TaskStatus.CONVERTING));
    }

    /**
     * Finished tasks, most recent first. Pages start at 1.
     */
    public List<Task> listCompleted(int page, int pageSize) {
        if (page < 1) {
            throw new OutOfRangeException("page", page, 1, Integer.MAX_VALUE);
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new OutOfRangeException("pageSize", pageSize, 1, MAX_PAGE_SIZE);
        }
        return taskStore.findFinished(page, pageSize);
    }

    public List<Task> listRecent(int count) {
        if (count < 1 || count > MAX_PAGE_SIZE) {
            throw new OutOfRangeException("count", count, 1, MAX_PAGE_SIZE);
        }
        return taskStore.findAll().stream()
                .sorted(Comparator.comparing(Task::getCreatedAt).reversed())
                .limit(count)
                .collect(Collectors.toList());
    }

    public Map<TaskStatus, Long> counts() {
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, taskStore.countByStatus(status));
        }
        return counts;
    }

    public void delete(String id) {
        Task removed;
        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            removed = load(id);
            taskStore.deleteById(id);
            eventPublisher.publish(EngineEvent.forTask(EventType.DELETED, removed, timeSource.now()));
        } finally {
            lock.unlock();
            locks.remove(id, lock);
        }

        log.info("Task deleted - ID: {}, Status was: {}", id, removed.getStatus());
        for (TaskLifecycleListener listener : listeners) {
            listener.onTaskDeleted(removed.copy());
        }
    }

    /**
     * Deletes finished tasks created more than {@code daysOld} days ago.
     *
     * @return number of tasks removed
     */
    public int cleanupTerminalTasks(int daysOld) {
        if (daysOld < 1 || daysOld > MAX_CLEANUP_DAYS) {
            throw new OutOfRangeException("daysOld", daysOld, 1, MAX_CLEANUP_DAYS);
        }
        LocalDateTime cutoff = timeSource.now().minusDays(daysOld);

        List<Task> candidates = taskStore.findAll().stream()
                .filter(task -> task.getStatus().isTerminal())
                .filter(task -> task.getCreatedAt().isBefore(cutoff))
                .collect(Collectors.toList());

        int removed = 0;
        for (Task candidate : candidates) {
            try {
                delete(candidate.getId());
                removed++;
            } catch (TaskNotFoundException e) {
                log.debug("Task {} already removed during cleanup", candidate.getId());
            }
        }
        log.info("Cleanup removed {} finished tasks older than {} days", removed, daysOld);
        return removed;
    }

    private Task transition(String id, TaskStatus target, EventType eventType, Consumer<Task> changes) {
        Task result;
        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            Task task = load(id);
            TaskStatus current = task.getStatus();
            if (!current.canTransitionTo(target)) {
                throw new InvalidTransitionException(id, current, target);
            }
            task.setStatus(target);
            changes.accept(task);
            task.setRevision(task.getRevision() + 1);
            taskStore.save(task);
            eventPublisher.publish(EngineEvent.forTask(eventType, task, timeSource.now()));
            log.info("Task {} status: {} -> {}", id, current, target);
            result = task.copy();
        } finally {
            lock.unlock();
        }

        if (target.isTerminal()) {
            for (TaskLifecycleListener listener : listeners) {
                listener.onTaskFinished(result.copy());
            }
        }
        return result;
    }

    private Task load(String id) {
        return taskStore.findById(id).orElseThrow(() -> new TaskNotFoundException(id));
    }

    private ReentrantLock lockFor(String id) {
        return locks.computeIfAbsent(id, key -> new ReentrantLock());
    }
}
