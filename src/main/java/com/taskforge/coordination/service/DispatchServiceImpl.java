package com.taskforge.coordination.service;

import com.taskforge.config.TaskForgeProperties;
import com.taskforge.coordination.api.DispatchService;
import com.taskforge.coordination.model.ContextAssembly;
import com.taskforge.coordination.model.DispatchBatch;
import com.taskforge.coordination.model.DispatchSkip;
import com.taskforge.coordination.model.ExecutionContext;
import com.taskforge.entity.Subtask;
import com.taskforge.entity.SubtaskRole;
import com.taskforge.entity.SubtaskStatus;
import com.taskforge.entity.Task;
import com.taskforge.entity.TaskStatus;
import com.taskforge.repository.SubtaskRepository;
import com.taskforge.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class DispatchServiceImpl implements DispatchService {

    private final TaskRepository taskRepository;
    private final SubtaskRepository subtaskRepository;
    private final SubtaskClaimService claimService;
    private final ExecutionContextAssembler assembler;
    private final TaskForgeProperties properties;

    @Override
    public DispatchBatch dispatch(SubtaskStatus statusFilter, @Nullable Integer limit, @Nullable List<Long> taskIds) {
        SubtaskStatus filter = statusFilter != null ? statusFilter : SubtaskStatus.PENDING;
        List<DispatchSkip> skipped = new ArrayList<>();
        List<Subtask> candidates = taskIds != null && !taskIds.isEmpty()
                ? selectTargeted(filter, taskIds, skipped)
                : selectFromPool(filter, properties.getDispatch().effectiveLimit(limit));

        List<ExecutionContext> contexts = new ArrayList<>();
        for (Subtask candidate : candidates) {
            if (!claimService.claim(candidate)) {
                continue;
            }
            ContextAssembly assembly = assemble(candidate);
            if (assembly.isAssembled()) {
                contexts.add(assembly.context());
            } else {
                log.warn("Claimed subtask {} skipped: {}", candidate.getId(), assembly.skip().reason());
                skipped.add(assembly.skip());
            }
        }
        log.info("Dispatched subtasks count={} ids={} skipped={}", contexts.size(),
                contexts.stream().map(ExecutionContext::subtaskId).toList(), skipped.size());
        return new DispatchBatch(contexts, skipped);
    }

    private List<Subtask> selectTargeted(SubtaskStatus filter, List<Long> taskIds, List<DispatchSkip> skipped) {
        List<Subtask> candidates = new ArrayList<>();
        for (Long taskId : new LinkedHashSet<>(taskIds)) {
            Optional<Task> task = taskRepository.findById(taskId);
            if (task.isEmpty()) {
                skipped.add(new DispatchSkip(taskId, null, "task not found"));
                continue;
            }
            if (!task.get().getStatus().isDispatchable()) {
                skipped.add(new DispatchSkip(taskId, null, "task is " + task.get().getStatus()));
                continue;
            }
            if (subtaskRepository.countByTaskIdAndStatus(taskId, SubtaskStatus.RUNNING) > 0) {
                skipped.add(new DispatchSkip(taskId, null, "task already has a running subtask"));
                continue;
            }
            subtaskRepository.findFirstByTaskIdAndRoleAndStatusOrderByMessageIdAscCreatedAtAsc(taskId,
                    SubtaskRole.ASSISTANT, filter).ifPresent(candidates::add);
        }
        return candidates;
    }

    private List<Subtask> selectFromPool(SubtaskStatus filter, int limit) {
        TaskStatus taskStatus = TaskStatus.valueOf(filter.name());
        List<Subtask> candidates = new ArrayList<>();
        for (Task task : taskRepository.findByStatusOrderByCreatedAtDesc(taskStatus, PageRequest.of(0, limit))) {
            subtaskRepository.findFirstByTaskIdAndRoleAndStatusOrderByMessageIdAscCreatedAtAsc(task.getId(),
                    SubtaskRole.ASSISTANT, filter).ifPresent(candidates::add);
        }
        return candidates;
    }

    private ContextAssembly assemble(Subtask claimed) {
        try {
            return assembler.assemble(claimed);
        } catch (RuntimeException ex) {
            log.error("Failed to assemble context for subtask {}", claimed.getId(), ex);
            return ContextAssembly.skipped(claimed.getTaskId(), claimed.getId(),
                    "context assembly failed: " + ex.getMessage());
        }
    }
}
