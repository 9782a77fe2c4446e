package com.taskforge.coordination.service;

import com.taskforge.coordination.model.BotContext;
import com.taskforge.entity.ResourceDocument;
import com.taskforge.entity.Subtask;
import com.taskforge.entity.Task;
import com.taskforge.resource.BotSpec;
import com.taskforge.resource.GhostSpec;
import com.taskforge.resource.ModelSpec;
import com.taskforge.resource.ResourceKind;
import com.taskforge.resource.ResourceRef;
import com.taskforge.resource.ResourceSpec;
import com.taskforge.resource.ResourceStore;
import com.taskforge.resource.ShellSpec;
import com.taskforge.resource.TeamMember;
import com.taskforge.resource.TeamSpec;
import com.taskforge.resource.WorkflowMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the bots of a claimed subtask from the resource store: team, bot, ghost, shell and model documents.
 * A bot that cannot be resolved is left out and reported as a warning instead of failing the subtask.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BotRosterResolver {

    private final ResourceStore resourceStore;

    public BotRoster resolve(Task task, Subtask subtask, int pipelineIndex) {
        List<String> warnings = new ArrayList<>();
        ResourceRef teamRef = new ResourceRef(task.getTeamName(), task.getTeamNamespace());
        Optional<ResourceDocument> teamDocument = resourceStore.find(ResourceKind.TEAM, task.getUserId(), teamRef);
        if (teamDocument.isEmpty()) {
            warnings.add("team %s/%s not found".formatted(teamRef.namespaceOrDefault(), teamRef.name()));
            return new BotRoster(null, null, List.of(), warnings);
        }
        TeamSpec team;
        try {
            team = resourceStore.readSpec(teamDocument.get(), TeamSpec.class);
        } catch (RuntimeException ex) {
            warnings.add("team %s is malformed: %s".formatted(teamRef.name(), ex.getMessage()));
            return new BotRoster(teamDocument.get().getId(), null, List.of(), warnings);
        }
        WorkflowMode mode = team.workflowMode();
        List<TeamMember> members = team.getMembers() != null ? team.getMembers() : List.of();
        List<BotContext> bots = new ArrayList<>();
        List<Long> botIds = subtask.getBotIds() != null ? subtask.getBotIds() : List.of();
        for (int index = 0; index < botIds.size(); index++) {
            Long botId = botIds.get(index);
            int memberIndex = mode == WorkflowMode.PIPELINE ? pipelineIndex : index;
            TeamMember member = memberIndex < members.size() ? members.get(memberIndex) : null;
            try {
                resolveBot(task.getUserId(), botId, member).ifPresentOrElse(bots::add,
                        () -> warnings.add("bot %d not found".formatted(botId)));
            } catch (RuntimeException ex) {
                log.warn("Skipping bot {} of subtask {}: {}", botId, subtask.getId(), ex.getMessage());
                warnings.add("bot %d skipped: %s".formatted(botId, ex.getMessage()));
            }
        }
        return new BotRoster(teamDocument.get().getId(), team.getCollaborationModel(), bots, warnings);
    }

    private Optional<BotContext> resolveBot(Long userId, Long botId, @Nullable TeamMember member) {
        Optional<ResourceDocument> botDocument = resourceStore.getById(ResourceKind.BOT, botId)
                .filter(document -> userId.equals(document.getUserId()));
        if (botDocument.isEmpty()) {
            return Optional.empty();
        }
        BotSpec bot = resourceStore.readSpec(botDocument.get(), BotSpec.class);

        String systemPrompt = "";
        Map<String, Object> mcpServers = Map.of();
        Optional<GhostSpec> ghost = readReferenced(ResourceKind.GHOST, userId, bot.getGhostRef(), GhostSpec.class);
        if (ghost.isPresent()) {
            systemPrompt = ghost.get().getSystemPrompt() != null ? ghost.get().getSystemPrompt() : "";
            mcpServers = ghost.get().getMcpServers() != null ? ghost.get().getMcpServers() : Map.of();
        }
        String agentName = readReferenced(ResourceKind.SHELL, userId, bot.getShellRef(), ShellSpec.class)
                .map(ShellSpec::getRuntime)
                .orElse("");
        Optional<ModelSpec> model = readReferenced(ResourceKind.MODEL, userId, bot.getModelRef(), ModelSpec.class);
        Map<String, Object> agentConfig = model.map(this::effectiveAgentConfig).orElse(Map.of());

        if (member != null && StringUtils.hasText(member.prompt())) {
            systemPrompt = systemPrompt + "\n" + member.prompt();
        }
        String role = member != null && member.role() != null ? member.role() : "";
        return Optional.of(new BotContext(botDocument.get().getId(), botDocument.get().getName(), agentName,
                agentConfig, systemPrompt, mcpServers, role));
    }

    /**
     * The shared model's config when the bot's model names one, the bot's own config otherwise.
     */
    Map<String, Object> effectiveAgentConfig(ModelSpec model) {
        Map<String, Object> ownConfig = model.getModelConfig() != null ? model.getModelConfig() : Map.of();
        String privateModel = model.privateModelName();
        if (privateModel == null) {
            return ownConfig;
        }
        try {
            return resourceStore.findShared(ResourceKind.PUBLIC_MODEL, privateModel)
                    .map(document -> resourceStore.readSpec(document, ModelSpec.class).getModelConfig())
                    .<Map<String, Object>>map(LinkedHashMap::new)
                    .orElse(ownConfig);
        } catch (RuntimeException ex) {
            log.debug("Falling back to own model config, shared model {} unusable: {}", privateModel, ex.getMessage());
            return ownConfig;
        }
    }

    private <T extends ResourceSpec> Optional<T> readReferenced(ResourceKind kind, Long userId,
                                                                @Nullable ResourceRef ref, Class<T> specType) {
        if (ref == null) {
            return Optional.empty();
        }
        return resourceStore.find(kind, userId, ref).map(document -> resourceStore.readSpec(document, specType));
    }

    /**
     * Resolved roster of a subtask.
     *
     * @param teamId id of the team document, {@code null} when the team is missing
     * @param mode the team's collaboration model as written on the team
     */
    public record BotRoster(@Nullable Long teamId, @Nullable String mode, List<BotContext> bots, List<String> warnings) {
    }
}
