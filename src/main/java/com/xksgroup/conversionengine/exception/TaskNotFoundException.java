package com.xksgroup.conversionengine.exception;

public class TaskNotFoundException extends NotFoundException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("No task found with ID: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
