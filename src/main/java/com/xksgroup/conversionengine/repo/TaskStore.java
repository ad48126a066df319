package com.xksgroup.conversionengine.repo;

import com.xksgroup.conversionengine.model.Task;
import com.xksgroup.conversionengine.model.TaskStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Row store for task records. Implementations hold whatever they are given; lifecycle
 * rules are enforced by the registry.
 */
public interface TaskStore {

    Optional<Task> findById(String id);

    void save(Task task);

    boolean deleteById(String id);

    List<Task> findAll();

    /**
     * Tasks in any of the given statuses, oldest first.
     */
    List<Task> findByStatusIn(Collection<TaskStatus> statuses);

    /**
     * Terminal tasks, most recently finished first. {@code page} is 1-indexed.
     */
    List<Task> findFinished(int page, int size);

    long countByStatus(TaskStatus status);
}
