package com.xksgroup.conversionengine.model.dto;

import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SpaceEstimateRequest {
    @Positive(message = "originalFileSize must be positive")
    private long originalFileSize;
    private String outputFormat;
    private String videoCodec;
}
