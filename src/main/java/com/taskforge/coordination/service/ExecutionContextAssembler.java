package com.taskforge.coordination.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskforge.coordination.model.ContextAssembly;
import com.taskforge.coordination.model.ExecutionContext;
import com.taskforge.coordination.model.UserContext;
import com.taskforge.entity.AppUser;
import com.taskforge.entity.GitIdentity;
import com.taskforge.entity.Subtask;
import com.taskforge.entity.SubtaskRole;
import com.taskforge.entity.Task;
import com.taskforge.repository.AppUserRepository;
import com.taskforge.repository.SubtaskRepository;
import com.taskforge.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the execution context of a claimed subtask: aggregated prompt, next subtask, bot roster,
 * user git identity and the task's workspace fields.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExecutionContextAssembler {

    static final String PREVIOUS_RESULT_PREFIX = "\nPrevious execution result: ";

    private final TaskRepository taskRepository;
    private final SubtaskRepository subtaskRepository;
    private final AppUserRepository appUserRepository;
    private final BotRosterResolver botRosterResolver;
    private final ObjectMapper objectMapper;

    public ContextAssembly assemble(Subtask subtask) {
        Optional<Task> task = taskRepository.findById(subtask.getTaskId());
        if (task.isEmpty()) {
            return ContextAssembly.skipped(subtask.getTaskId(), subtask.getId(), "task no longer exists");
        }
        List<Subtask> related = subtaskRepository.findByTaskIdOrderByMessageIdAscCreatedAtAsc(subtask.getTaskId());
        PromptScan scan = scan(related, subtask);

        List<String> warnings = new ArrayList<>();
        BotRosterResolver.BotRoster roster = botRosterResolver.resolve(task.get(), subtask, scan.pipelineIndex());
        warnings.addAll(roster.warnings());
        if (!roster.warnings().isEmpty()) {
            log.warn("Subtask {} dispatched with a degraded context: {}", subtask.getId(), roster.warnings());
        }

        Task owner = task.get();
        UserContext user = userContext(subtask.getUserId(), owner.getGitDomain());
        return ContextAssembly.assembled(new ExecutionContext(
                subtask.getId(),
                scan.nextSubtaskId(),
                subtask.getTaskId(),
                subtask.getExecutorName(),
                subtask.getExecutorNamespace(),
                subtask.getTitle(),
                owner.getTitle(),
                user,
                roster.bots(),
                roster.teamId(),
                roster.mode(),
                owner.getGitDomain(),
                owner.getGitRepo(),
                owner.getGitRepoId(),
                owner.getBranchName(),
                owner.getGitUrl(),
                scan.prompt(),
                subtask.getStatus(),
                subtask.getProgress(),
                subtask.getCreatedAt(),
                subtask.getUpdatedAt(),
                List.copyOf(warnings)));
    }

    /**
     * Walks the task's subtasks in sequence order up to the target.
     * A USER subtask replaces the prompt and clears the carried-over result; an ASSISTANT subtask before the
     * target replaces the carried-over result and advances the pipeline position.
     */
    PromptScan scan(List<Subtask> related, Subtask target) {
        String userPrompt = "";
        String previousResult = "";
        int pipelineIndex = 0;
        Long nextSubtaskId = null;
        for (int i = 0; i < related.size(); i++) {
            Subtask current = related.get(i);
            if (Objects.equals(current.getId(), target.getId())) {
                nextSubtaskId = i + 1 < related.size() ? related.get(i + 1).getId() : null;
                break;
            }
            if (current.getRole() == SubtaskRole.USER) {
                userPrompt = current.getPrompt() != null ? current.getPrompt() : "";
                previousResult = "";
            } else {
                pipelineIndex++;
                previousResult = resultText(current.getResult());
            }
        }
        String prompt = previousResult.isEmpty() ? userPrompt : userPrompt + PREVIOUS_RESULT_PREFIX + previousResult;
        return new PromptScan(prompt, nextSubtaskId, pipelineIndex);
    }

    private String resultText(@Nullable Map<String, Object> result) {
        if (result == null || result.isEmpty()) {
            return "";
        }
        Object value = result.get("value");
        if (value instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException ex) {
            return String.valueOf(result);
        }
    }

    private UserContext userContext(Long userId, @Nullable String gitDomain) {
        Optional<AppUser> user = appUserRepository.findById(userId);
        if (user.isEmpty()) {
            return new UserContext(userId, null, null, null, null, null, null);
        }
        List<GitIdentity> identities = user.get().getGitInfo() != null ? user.get().getGitInfo() : List.of();
        GitIdentity identity = identities.stream()
                .filter(candidate -> candidate != null && Objects.equals(candidate.getGitDomain(), gitDomain))
                .findFirst()
                .orElse(null);
        if (identity == null) {
            return new UserContext(userId, user.get().getUserName(), null, null, null, null, null);
        }
        return new UserContext(userId, user.get().getUserName(), identity.getGitDomain(), identity.getGitToken(),
                identity.getGitId(), identity.getGitLogin(), identity.getGitEmail());
    }

    record PromptScan(String prompt, @Nullable Long nextSubtaskId, int pipelineIndex) {
    }
}
