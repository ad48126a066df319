package com.xksgroup.conversionengine.model;

import lombok.Builder;
import lombok.Value;

/**
 * Everything the registry needs to create a task. Id, status and timestamps are
 * assigned by the registry itself.
 */
@Value
@Builder(toBuilder = true)
public class TaskDraft {
    public static final int DEFAULT_MAX_RETRIES = 3;

    String name;
    SourceDescriptor source;
    ConversionParameters parameters;
    String ownerId;
    @Builder.Default
    int maxRetries = DEFAULT_MAX_RETRIES;
    int retryCount;
    long reservedBytes;
}
