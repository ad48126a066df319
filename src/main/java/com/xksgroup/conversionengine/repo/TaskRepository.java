package com.xksgroup.conversionengine.repo;

import com.xksgroup.conversionengine.model.Task;
import com.xksgroup.conversionengine.model.TaskStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface TaskRepository extends MongoRepository<Task, String> {

    List<Task> findByStatusIn(Collection<TaskStatus> statuses, Sort sort);

    Page<Task> findByStatusIn(Collection<TaskStatus> statuses, Pageable pageable);

    long countByStatus(TaskStatus status);
}
