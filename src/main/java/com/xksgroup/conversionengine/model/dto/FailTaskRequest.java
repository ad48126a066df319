package com.xksgroup.conversionengine.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FailTaskRequest {
    @NotBlank(message = "message is required")
    private String message;
}
