package com.xksgroup.conversionengine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SpaceBudget {
    public static final long DEFAULT_MAX_TOTAL_BYTES = 100L * 1024 * 1024 * 1024;
    public static final long DEFAULT_RESERVED_BYTES = 5L * 1024 * 1024 * 1024;

    private long maxTotalBytes;
    private long reservedBytes;
    private boolean enabled;
    private LocalDateTime updatedAt;
    private String updatedBy;

    public static SpaceBudget defaults() {
        return SpaceBudget.builder()
                .maxTotalBytes(DEFAULT_MAX_TOTAL_BYTES)
                .reservedBytes(DEFAULT_RESERVED_BYTES)
                .enabled(true)
                .updatedBy("System")
                .build();
    }
}
