package com.xksgroup.conversionengine.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Point-in-time view of the storage budget. Never patched: the accountant swaps in a
 * whole new instance on every recomputation.
 */
@Value
@Builder(toBuilder = true)
public class SpaceUsageSnapshot {
    long totalBytes;
    long reservedBytes;
    long usedBytes;
    long availableBytes;
    long pendingReservationBytes;
    double usagePercentage;
    boolean enabled;
    boolean hasSufficientSpace;

    // Breakdown
    long sourceFilesBytes;
    long outputFilesBytes;
    long tempFilesBytes;

    LocalDateTime computedAt;
    boolean stale;
    // False until a directory walk has succeeded at least once
    boolean usageKnown;

    public static SpaceUsageSnapshot of(SpaceBudget budget,
                                        long sourceBytes,
                                        long outputBytes,
                                        long tempBytes,
                                        LocalDateTime computedAt) {
        long used = sourceBytes + outputBytes + tempBytes;
        long available = budget.getMaxTotalBytes() - budget.getReservedBytes() - used;
        double percentage = budget.getMaxTotalBytes() > 0
                ? (double) used / budget.getMaxTotalBytes() * 100
                : 0;

        return SpaceUsageSnapshot.builder()
                .totalBytes(budget.getMaxTotalBytes())
                .reservedBytes(budget.getReservedBytes())
                .usedBytes(used)
                .availableBytes(available)
                .usagePercentage(percentage)
                .enabled(budget.isEnabled())
                .hasSufficientSpace(available >= 0)
                .sourceFilesBytes(sourceBytes)
                .outputFilesBytes(outputBytes)
                .tempFilesBytes(tempBytes)
                .computedAt(computedAt)
                .stale(false)
                .usageKnown(true)
                .build();
    }

    /**
     * Placeholder used when storage has never been measured: nothing is available.
     */
    public static SpaceUsageSnapshot unknown(SpaceBudget budget, LocalDateTime at) {
        return SpaceUsageSnapshot.builder()
                .totalBytes(budget.getMaxTotalBytes())
                .reservedBytes(budget.getReservedBytes())
                .enabled(budget.isEnabled())
                .hasSufficientSpace(false)
                .computedAt(at)
                .stale(true)
                .usageKnown(false)
                .build();
    }
}
