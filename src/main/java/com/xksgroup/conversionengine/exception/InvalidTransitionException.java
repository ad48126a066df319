package com.xksgroup.conversionengine.exception;

import com.xksgroup.conversionengine.model.TaskStatus;

import java.util.Map;

public class InvalidTransitionException extends ConversionEngineException {

    private final String taskId;
    private final TaskStatus current;
    private final TaskStatus requested;

    public InvalidTransitionException(String taskId, TaskStatus current, TaskStatus requested) {
        super(ErrorCode.INVALID_TRANSITION,
                String.format("Task %s cannot move from %s to %s", taskId, current, requested));
        this.taskId = taskId;
        this.current = current;
        this.requested = requested;
    }

    public TaskStatus getCurrent() {
        return current;
    }

    public TaskStatus getRequested() {
        return requested;
    }

    @Override
    public Object getDetails() {
        return Map.of("taskId", taskId, "currentStatus", current, "requestedStatus", requested);
    }
}
