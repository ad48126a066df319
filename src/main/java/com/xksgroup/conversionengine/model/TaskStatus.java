package com.xksgroup.conversionengine.model;

public enum TaskStatus {
    PENDING,        // Task admitted, waiting for the worker
    CONVERTING,     // Worker is running the conversion
    COMPLETED,      // Conversion finished successfully
    FAILED,         // Worker reported a failure
    CANCELLED;      // Cancelled before completion

    /**
     * Whether the lifecycle allows moving from this status to {@code target}.
     * Terminal statuses never transition again.
     */
    public boolean canTransitionTo(TaskStatus target) {
        return switch (this) {
            case PENDING -> target == CONVERTING || target == CANCELLED || target == FAILED;
            case CONVERTING -> target == COMPLETED || target == FAILED || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }

    public boolean isTerminal() {
        return switch (this) {
            case PENDING, CONVERTING -> false;
            case COMPLETED, FAILED, CANCELLED -> true;
        };
    }

    public boolean isActive() {
        return !isTerminal();
    }

    public String displayName() {
        return switch (this) {
            case PENDING -> "Pending";
            case CONVERTING -> "Converting";
            case COMPLETED -> "Completed";
            case FAILED -> "Failed";
            case CANCELLED -> "Cancelled";
        };
    }
}
