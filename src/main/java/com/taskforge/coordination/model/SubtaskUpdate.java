package com.taskforge.coordination.model;

import com.taskforge.entity.SubtaskStatus;

import java.util.Map;

/**
 * Partial update of a subtask. {@code null} fields are left untouched.
 */
public record SubtaskUpdate(
        Long subtaskId,
        SubtaskStatus status,
        Integer progress,
        Map<String, Object> result,
        String errorMessage,
        String subtaskTitle,
        String taskTitle,
        String executorName,
        String executorNamespace
) {

    public static SubtaskUpdate terminal(Long subtaskId, SubtaskStatus status, Map<String, Object> result,
                                         String errorMessage) {
        Integer progress = status == SubtaskStatus.COMPLETED ? 100 : null;
        return new SubtaskUpdate(subtaskId, status, progress, result, errorMessage, null, null, null, null);
    }
}
