package com.taskforge.coordination.service;

import com.taskforge.coordination.model.TaskStatusDecision;
import com.taskforge.entity.Subtask;
import com.taskforge.entity.SubtaskStatus;
import com.taskforge.entity.Task;
import com.taskforge.entity.TaskStatus;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Derives a task's status and progress from its ASSISTANT subtasks.
 *
 * <p>Any failure wins: the task fails with the error and result of the last failed subtask. When every subtask
 * completed, the task takes the last subtask's status and result with progress 100. Otherwise it is running,
 * with progress {@code floor(100 * completed / total)}.</p>
 */
@Component
public class TaskStatusAggregator {

    /**
     * @param assistantSubtasks the task's ASSISTANT subtasks in sequence order
     * @return the decision, or empty when there are no subtasks to derive from
     */
    public Optional<TaskStatusDecision> derive(List<Subtask> assistantSubtasks) {
        int total = assistantSubtasks.size();
        if (total == 0) {
            return Optional.empty();
        }
        int completed = 0;
        Subtask lastFailed = null;
        for (Subtask subtask : assistantSubtasks) {
            if (subtask.getStatus() == SubtaskStatus.COMPLETED) {
                completed++;
            } else if (subtask.getStatus() == SubtaskStatus.FAILED) {
                lastFailed = subtask;
            }
        }
        int progress = (int) Math.floor(100.0 * completed / total);
        if (lastFailed != null) {
            return Optional.of(new TaskStatusDecision(TaskStatus.FAILED, progress, lastFailed));
        }
        if (completed == total) {
            Subtask last = assistantSubtasks.get(total - 1);
            return Optional.of(new TaskStatusDecision(TaskStatus.valueOf(last.getStatus().name()), 100, last));
        }
        return Optional.of(new TaskStatusDecision(TaskStatus.RUNNING, progress, null));
    }

    public void apply(Task task, TaskStatusDecision decision, OffsetDateTime now) {
        Subtask source = decision.outcomeSource();
        task.setStatus(decision.status());
        task.setProgress(decision.progress());
        switch (decision.status()) {
            case FAILED -> {
                if (source.getErrorMessage() != null) {
                    task.setErrorMessage(source.getErrorMessage());
                }
                if (source.getResult() != null) {
                    task.setResult(source.getResult());
                }
            }
            case COMPLETED, CANCELLED -> {
                task.setResult(source.getResult());
                task.setErrorMessage(source.getErrorMessage());
                if (task.getCompletedAt() == null) {
                    task.setCompletedAt(now);
                }
            }
            default -> {
                // running: status and progress only
            }
        }
    }
}
