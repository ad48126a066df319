package com.xksgroup.conversionengine.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SpaceCheckResult {
    boolean hasEnoughSpace;
    long requiredSpace;
    long availableSpace;
    String message;
    Details details;

    @Value
    @Builder
    public static class Details {
        long originalFileSpace;
        long outputFileSpace;
        long tempFileSpace;
        long reservedSpace;
        long pendingReservedSpace;
        long currentUsedSpace;
        long totalConfiguredSpace;
    }
}
