package com.taskforge.cache;

import java.util.List;
import java.util.Map;

/**
 * Copy of a streaming session's projected fields as kept in the fast cache.
 * Timestamps are epoch milliseconds.
 */
public record CachedStream(
        Long taskId,
        Long subtaskId,
        String status,
        String content,
        long offset,
        String reasoningContent,
        long reasoningOffset,
        List<Map<String, Object>> thinking,
        Map<String, Object> workbench,
        long startedAt,
        long lastUpdateAt
) {
}
