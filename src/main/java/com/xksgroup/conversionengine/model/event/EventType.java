package com.xksgroup.conversionengine.model.event;

public enum EventType {
    CREATED("StatusUpdate"),
    PROGRESS_UPDATED("ProgressUpdate"),
    STATUS_CHANGED("StatusUpdate"),
    COMPLETED("TaskCompleted"),
    DELETED("TaskDeleted"),
    SPACE_STATUS_CHANGED("SpaceStatusUpdate");

    private final String wireType;

    EventType(String wireType) {
        this.wireType = wireType;
    }

    /**
     * Name used in the envelope sent to connected clients.
     */
    public String wireType() {
        return wireType;
    }
}
