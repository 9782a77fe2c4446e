package com.taskforge.coordination.model;

import java.util.Map;

public record BotContext(
        Long id,
        String name,
        String agentName,
        Map<String, Object> agentConfig,
        String systemPrompt,
        Map<String, Object> mcpServers,
        String role
) {
}
