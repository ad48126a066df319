package com.xksgroup.conversionengine.model.dto;

public record StartTaskResponse(String taskId, long reservedBytes) {
}
