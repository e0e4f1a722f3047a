package io.agentguard.agent;

import java.util.UUID;

public record AgentTask(
        String taskId,
        String agentId,
        String payload,
        boolean critical
) {
    public AgentTask {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId cannot be empty");
        }
        if (taskId == null || taskId.isBlank()) {
            taskId = UUID.randomUUID().toString();
        }
        if (payload == null) {
            payload = "";
        }
    }

    public static AgentTask of(String agentId, String payload) {
        return new AgentTask(null, agentId, payload, false);
    }
}
