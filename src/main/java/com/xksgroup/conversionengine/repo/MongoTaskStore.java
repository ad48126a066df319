package com.xksgroup.conversionengine.repo;

import com.xksgroup.conversionengine.model.Task;
import com.xksgroup.conversionengine.model.TaskStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

@Component
@Profile("mongo")
@RequiredArgsConstructor
public class MongoTaskStore implements TaskStore {

    private static final Collection<TaskStatus> TERMINAL =
            EnumSet.of(TaskStatus.COMPLETED, TaskStatus.FAILED, TaskStatus.CANCELLED);

    private final TaskRepository taskRepository;

    @Override
    public Optional<Task> findById(String id) {
        return taskRepository.findById(id);
    }

    @Override
    public void save(Task task) {
        taskRepository.save(task);
    }

    @Override
    public boolean deleteById(String id) {
        if (!taskRepository.existsById(id)) {
            return false;
        }
        taskRepository.deleteById(id);
        return true;
    }

    @Override
    public List<Task> findAll() {
        return taskRepository.findAll(Sort.by(Sort.Direction.ASC, "createdAt"));
    }

    @Override
    public List<Task> findByStatusIn(Collection<TaskStatus> statuses) {
        return taskRepository.findByStatusIn(statuses, Sort.by(Sort.Direction.ASC, "createdAt"));
    }

    @Override
    public List<Task> findFinished(int page, int size) {
        PageRequest pageRequest = PageRequest.of(page - 1, size, Sort.by(Sort.Direction.DESC, "completedAt"));
        return taskRepository.findByStatusIn(TERMINAL, pageRequest).getContent();
    }

    @Override
    public long countByStatus(TaskStatus status) {
        return taskRepository.countByStatus(status);
    }
}
