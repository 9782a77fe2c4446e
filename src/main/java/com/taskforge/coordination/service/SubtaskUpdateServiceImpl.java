package com.taskforge.coordination.service;

import com.taskforge.config.TaskForgeProperties;
import com.taskforge.coordination.api.SubtaskUpdateService;
import com.taskforge.coordination.model.SubtaskUpdate;
import com.taskforge.coordination.model.SubtaskUpdateResult;
import com.taskforge.entity.Subtask;
import com.taskforge.entity.SubtaskRole;
import com.taskforge.entity.Task;
import com.taskforge.repository.SubtaskRepository;
import com.taskforge.repository.TaskRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.OffsetDateTime;

@Service
@Slf4j
public class SubtaskUpdateServiceImpl implements SubtaskUpdateService {

    private final SubtaskRepository subtaskRepository;
    private final TaskRepository taskRepository;
    private final TaskStatusAggregator aggregator;
    private final TransactionTemplate transactionTemplate;
    private final TaskForgeProperties properties;
    private final Clock clock;

    public SubtaskUpdateServiceImpl(SubtaskRepository subtaskRepository,
                                    TaskRepository taskRepository,
                                    TaskStatusAggregator aggregator,
                                    TransactionTemplate transactionTemplate,
                                    TaskForgeProperties properties,
                                    Clock clock) {
        this.subtaskRepository = subtaskRepository;
        this.taskRepository = taskRepository;
        this.aggregator = aggregator;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public SubtaskUpdateResult update(SubtaskUpdate update) {
        int maxAttempts = Math.max(1, properties.getAggregation().getMaxAttempts());
        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(status -> applyUpdate(update));
            } catch (OptimisticLockingFailureException ex) {
                if (attempt >= maxAttempts) {
                    log.error("Giving up on subtask {} after {} conflicting attempts.", update.subtaskId(), attempt);
                    throw ex;
                }
                log.debug("Task of subtask {} changed concurrently, retrying ({}/{}).", update.subtaskId(),
                        attempt, maxAttempts);
            }
        }
    }

    private SubtaskUpdateResult applyUpdate(SubtaskUpdate update) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Subtask subtask = subtaskRepository.findById(update.subtaskId())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Subtask not found"));
        merge(subtask, update, now);
        subtaskRepository.saveAndFlush(subtask);

        Task task = taskRepository.findById(subtask.getTaskId())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Task not found"));
        if (StringUtils.hasText(update.taskTitle())) {
            task.setTitle(update.taskTitle());
        }
        aggregator.derive(subtaskRepository.findByTaskIdAndRoleOrderByMessageIdAscCreatedAtAsc(task.getId(),
                        SubtaskRole.ASSISTANT))
                .ifPresent(decision -> aggregator.apply(task, decision, now));
        taskRepository.saveAndFlush(task);

        log.debug("Subtask {} updated to {} ({}%), task {} is {} ({}%).", subtask.getId(), subtask.getStatus(),
                subtask.getProgress(), task.getId(), task.getStatus(), task.getProgress());
        return new SubtaskUpdateResult(subtask.getId(), task.getId(), subtask.getStatus(), subtask.getProgress(),
                task.getStatus(), task.getProgress());
    }

    private void merge(Subtask subtask, SubtaskUpdate update, OffsetDateTime now) {
        if (update.status() != null) {
            subtask.setStatus(update.status());
            if (update.status().isTerminal() && subtask.getCompletedAt() == null) {
                subtask.setCompletedAt(now);
            }
        }
        if (update.progress() != null) {
            subtask.setProgress(Math.max(0, Math.min(100, update.progress())));
        }
        if (update.result() != null) {
            subtask.setResult(update.result());
        }
        if (update.errorMessage() != null) {
            subtask.setErrorMessage(update.errorMessage());
        }
        if (StringUtils.hasText(update.subtaskTitle())) {
            subtask.setTitle(update.subtaskTitle());
        }
        if (update.executorName() != null) {
            subtask.setExecutorName(update.executorName());
        }
        if (update.executorNamespace() != null) {
            subtask.setExecutorNamespace(update.executorNamespace());
        }
    }
}
