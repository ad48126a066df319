package com.xksgroup.conversionengine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "conversion_tasks")
public class Task {
    @Id
    private String id;

    private String name;
    private SourceDescriptor source;
    private ConversionParameters parameters;
    private String ownerId;

    private TaskStatus status;

    // Progress tracking
    private int progress;
    private Double speed;
    private Integer etaSeconds;

    private String errorMessage;

    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    private int retryCount;
    private int maxRetries;

    // Bytes held in the admission ledger for this task
    private long reservedBytes;

    // Bumped on every mutation, lets consumers order snapshots of the same task
    private long revision;

    /**
     * Detached copy, so callers outside the registry never share mutable state with it.
     */
    public Task copy() {
        return toBuilder()
                .source(source != null ? source.toBuilder().build() : null)
                .parameters(parameters != null ? parameters.copy() : null)
                .build();
    }
}
