package com.xksgroup.conversionengine.model.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Progress report from the conversion worker. Range checking happens in the registry
 * so that every caller gets the same OutOfRange error.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProgressUpdateRequest {
    @NotNull(message = "progress is required")
    private Integer progress;
    private Double speed;
    private Integer etaSeconds;
}
