package com.taskforge.coordination.model;

import com.taskforge.entity.Subtask;
import com.taskforge.entity.TaskStatus;
import org.springframework.lang.Nullable;

/**
 * Task status derived from its assistant subtasks.
 *
 * @param outcomeSource the subtask whose result and error are copied onto the task, if any
 */
public record TaskStatusDecision(
        TaskStatus status,
        int progress,
        @Nullable Subtask outcomeSource
) {
}
