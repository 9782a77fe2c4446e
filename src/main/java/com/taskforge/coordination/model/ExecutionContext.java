package com.taskforge.coordination.model;

import com.taskforge.entity.SubtaskStatus;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Everything a worker needs to run one claimed subtask.
 * {@code warnings} lists the parts that could not be resolved and were left out.
 */
public record ExecutionContext(
        Long subtaskId,
        Long subtaskNextId,
        Long taskId,
        String executorName,
        String executorNamespace,
        String subtaskTitle,
        String taskTitle,
        UserContext user,
        List<BotContext> bot,
        Long teamId,
        String mode,
        String gitDomain,
        String gitRepo,
        Long gitRepoId,
        String branchName,
        String gitUrl,
        String prompt,
        SubtaskStatus status,
        int progress,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        List<String> warnings
) {
}
