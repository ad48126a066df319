package com.xksgroup.conversionengine.repo;

import com.xksgroup.conversionengine.model.Task;
import com.xksgroup.conversionengine.model.TaskStatus;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
@Profile("!mongo")
public class InMemoryTaskStore implements TaskStore {

    private final Map<String, Task> tasks = new ConcurrentHashMap<>();

    @Override
    public Optional<Task> findById(String id) {
        return Optional.ofNullable(tasks.get(id)).map(Task::copy);
    }

    @Override
    public void save(Task task) {
        tasks.put(task.getId(), task.copy());
    }

    @Override
    public boolean deleteById(String id) {
        return tasks.remove(id) != null;
    }

    @Override
    public List<Task> findAll() {
        return tasks.values().stream()
                .map(Task::copy)
                .sorted(Comparator.comparing(Task::getCreatedAt))
                .collect(Collectors.toList());
    }

    @Override
    public List<Task> findByStatusIn(Collection<TaskStatus> statuses) {
        return tasks.values().stream()
                .filter(task -> statuses.contains(task.getStatus()))
                .map(Task::copy)
                .sorted(Comparator.comparing(Task::getCreatedAt))
                .collect(Collectors.toList());
    }

    @Override
    public List<Task> findFinished(int page, int size) {
        return tasks.values().stream()
                .filter(task -> task.getStatus().isTerminal())
                .sorted(Comparator.comparing(Task::getCompletedAt,
                        Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder())))
                .skip((long) (page - 1) * size)
                .limit(size)
                .map(Task::copy)
                .collect(Collectors.toList());
    }

    @Override
    public long countByStatus(TaskStatus status) {
        return tasks.values().stream()
                .filter(task -> task.getStatus() == status)
                .count();
    }
}
