package io.agentguard.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentguard.agent.Agent;
import io.agentguard.agent.AgentFailureException;
import io.agentguard.agent.AgentRegistry;
import io.agentguard.agent.AgentResult;
import io.agentguard.agent.AgentTask;
import io.agentguard.dlq.DeadLetterQueue;
import io.agentguard.error.NonRetryableException;
import io.agentguard.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends tasks to agents through an {@link OperationGuard} keyed by agent id, and
 * replays dead-lettered tasks straight against the agent.
 */
public final class AgentDispatcher {
    private static final Logger log = LoggerFactory.getLogger(AgentDispatcher.class);
    public static final String SOURCE = "execute-task";

    private final AgentRegistry agents;
    private final OperationGuard guard;

    public AgentDispatcher(AgentRegistry agents, OperationGuard guard) {
        this.agents = agents;
        this.guard = guard;
        DeadLetterQueue deadLetters = guard.deadLetters();
        if (deadLetters != null) {
            deadLetters.registerProcessor(SOURCE, this::replay);
        }
    }

    public AgentRegistry agents() {
        return agents;
    }

    /**
     * Runs the task and returns the agent output.
     *
     * @throws IllegalArgumentException when no agent has the task's id
     */
    public String dispatch(AgentTask task) throws Exception {
        Agent agent = agents.findById(task.agentId())
                .orElseThrow(() -> new IllegalArgumentException("Unknown agent: " + task.agentId()));
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("taskId", task.taskId());
        metadata.put("agentId", task.agentId());
        metadata.put("critical", task.critical());
        OperationGuard.GuardedOperation guarded = new OperationGuard.GuardedOperation(
                task.agentId(), SOURCE, toPayload(task), metadata);
        return guard.execute(guarded, attempt -> {
            log.debug("Dispatching task {} to {} (attempt {})", task.taskId(), agent.id(), attempt);
            return invoke(agent, task);
        });
    }

    void replay(JsonNode payload) throws Exception {
        AgentTask task = fromPayload(payload);
        Agent agent = agents.findById(task.agentId())
                .orElseThrow(() -> new NonRetryableException("Unknown agent: " + task.agentId()));
        invoke(agent, task);
        log.info("Replayed task {} on {}", task.taskId(), task.agentId());
    }

    static String invoke(Agent agent, AgentTask task) throws Exception {
        AgentResult result = agent.execute(task);
        if (result == null || !result.success()) {
            throw new AgentFailureException(agent.id(), result == null ? "no result" : result.error());
        }
        return result.output();
    }

    static JsonNode toPayload(AgentTask task) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("taskId", task.taskId());
        node.put("agentId", task.agentId());
        node.put("payload", task.payload());
        node.put("critical", task.critical());
        return node;
    }

    static AgentTask fromPayload(JsonNode payload) {
        if (payload == null || !payload.hasNonNull("agentId")) {
            throw new NonRetryableException("Dead letter payload has no agentId");
        }
        return new AgentTask(
                payload.path("taskId").asText(null),
                payload.get("agentId").asText(),
                payload.path("payload").asText(""),
                payload.path("critical").asBoolean(false)
        );
    }
}
