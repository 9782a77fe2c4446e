package com.taskforge.coordination.model;

import com.taskforge.entity.SubtaskStatus;
import com.taskforge.entity.TaskStatus;

public record SubtaskUpdateResult(
        Long subtaskId,
        Long taskId,
        SubtaskStatus status,
        int progress,
        TaskStatus taskStatus,
        int taskProgress
) {
}
