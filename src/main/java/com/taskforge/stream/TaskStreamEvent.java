package com.taskforge.stream;

import java.time.Instant;

/**
 * One notification as delivered to observers of a task. {@code id} increases per task and is the replay cursor.
 */
public record TaskStreamEvent(
        long id,
        Long taskId,
        String type,
        Instant timestamp,
        Object data
) {
}
