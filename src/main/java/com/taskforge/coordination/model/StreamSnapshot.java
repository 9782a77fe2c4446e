package com.taskforge.coordination.model;

import java.util.List;
import java.util.Map;

/**
 * What a reconnecting observer needs to redraw a subtask's output.
 *
 * @param source where the data came from: {@code session}, {@code cache} or {@code durable}
 */
public record StreamSnapshot(
        Long taskId,
        Long subtaskId,
        String status,
        String content,
        long offset,
        String reasoningContent,
        long reasoningOffset,
        List<Map<String, Object>> thinking,
        Map<String, Object> workbench,
        String source
) {
}
