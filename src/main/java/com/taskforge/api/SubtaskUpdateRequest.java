package com.taskforge.api;

import com.taskforge.coordination.model.SubtaskUpdate;
import com.taskforge.entity.SubtaskStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

public record SubtaskUpdateRequest(
        @NotNull Long subtaskId,
        SubtaskStatus status,
        @Min(0) @Max(100) Integer progress,
        Map<String, Object> result,
        String errorMessage,
        String subtaskTitle,
        String taskTitle,
        String executorName,
        String executorNamespace
) {
    public SubtaskUpdate toUpdate() {
        return new SubtaskUpdate(subtaskId, status, progress, result, errorMessage, subtaskTitle, taskTitle,
                executorName, executorNamespace);
    }
}
