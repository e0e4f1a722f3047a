package io.agentguard.agent;

import io.agentguard.util.Jsons;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

public final class EchoAgent implements Agent {
    private final Clock clock;

    public EchoAgent() {
        this(Clock.systemUTC());
    }

    public EchoAgent(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String id() {
        return "echo";
    }

    @Override
    public AgentResult execute(AgentTask task) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("agent", id());
        out.put("timestamp", clock.instant().toString());
        out.put("taskId", task.taskId());
        out.put("received", task.payload());
        return AgentResult.ok(Jsons.toCompactJson(out));
    }
}
