package com.taskforge.coordination.model;

/**
 * A subtask that was claimed or selected but produced no execution context, with the reason.
 */
public record DispatchSkip(
        Long taskId,
        Long subtaskId,
        String reason
) {
}
