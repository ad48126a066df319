package com.xksgroup.conversionengine.service;

import com.xksgroup.conversionengine.model.Task;

/**
 * In-process hook for components that hold resources on behalf of a task.
 * Called outside the task lock, after the change has been stored and published.
 */
public interface TaskLifecycleListener {

    void onTaskFinished(Task task);

    default void onTaskDeleted(Task task) {
    }
}
