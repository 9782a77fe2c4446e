package com.taskforge.coordination.service;

import com.taskforge.entity.Subtask;
import com.taskforge.entity.SubtaskStatus;
import com.taskforge.entity.TaskStatus;
import com.taskforge.repository.SubtaskRepository;
import com.taskforge.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Claims subtasks with conditional updates only, so workers in separate processes never share a lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubtaskClaimService {

    private final SubtaskRepository subtaskRepository;
    private final TaskRepository taskRepository;
    private final Clock clock;

    /**
     * Moves the subtask from PENDING to RUNNING and, if that succeeded, its task from PENDING to RUNNING.
     *
     * @return {@code true} only for the caller whose update changed the subtask row
     */
    public boolean claim(Subtask subtask) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int claimed = subtaskRepository.compareAndSetStatus(subtask.getId(), SubtaskStatus.PENDING,
                SubtaskStatus.RUNNING, now);
        if (claimed != 1) {
            log.debug("Subtask {} was claimed by another worker.", subtask.getId());
            return false;
        }
        subtask.setStatus(SubtaskStatus.RUNNING);
        subtask.setUpdatedAt(now);
        if (taskRepository.compareAndSetStatus(subtask.getTaskId(), TaskStatus.PENDING, TaskStatus.RUNNING, now) == 1) {
            log.debug("Task {} moved to RUNNING by subtask {}.", subtask.getTaskId(), subtask.getId());
        }
        return true;
    }
}
