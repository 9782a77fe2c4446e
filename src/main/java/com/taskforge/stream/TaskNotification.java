package com.taskforge.stream;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Payload of a live notification pushed to the observers of a task.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskNotification(
        Long taskId,
        Long subtaskId,
        Long offset,
        String content,
        Map<String, Object> result,
        String error,
        String shellType,
        String toolId,
        String toolName,
        Object toolInput,
        Object toolOutput,
        String toolError
) {

    static TaskNotification of(Long taskId, Long subtaskId) {
        return new TaskNotification(taskId, subtaskId, null, null, null, null, null, null, null, null, null, null);
    }
}
