package com.xksgroup.conversionengine.model.dto;

public record SpaceEstimateResponse(
        long originalFileSize,
        long estimatedOutputSize,
        long totalRequiredSpace,
        double compressionRatio,
        boolean hasEnoughSpace,
        String message
) {
}
