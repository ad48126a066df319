package com.xksgroup.conversionengine.model.dto;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpaceCheckRequest {

    @PositiveOrZero(message = "originalFileSize must be >= 0")
    private long originalFileSize;

    // When absent the accountant assumes 70% of the original size
    @PositiveOrZero(message = "estimatedOutputSize must be >= 0")
    private Long estimatedOutputSize;

    @Builder.Default
    private boolean includeTempSpace = true;

    /**
     * A bare byte count with no output or temp overhead.
     */
    public static SpaceCheckRequest ofRequiredBytes(long requiredBytes) {
        return SpaceCheckRequest.builder()
                .originalFileSize(requiredBytes)
                .estimatedOutputSize(0L)
                .includeTempSpace(false)
                .build();
    }
}
