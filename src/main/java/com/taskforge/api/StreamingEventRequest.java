package com.taskforge.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

public record StreamingEventRequest(
        @NotNull Long taskId,
        @NotNull Long subtaskId,
        @NotBlank String eventType,
        Map<String, Object> payload
) {
}
