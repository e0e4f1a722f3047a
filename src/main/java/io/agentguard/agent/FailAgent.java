package io.agentguard.agent;

/**
 * Always fails. Used to exercise retries, circuit opening and dead-lettering.
 */
public final class FailAgent implements Agent {
    public static final String ID = "fail";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public AgentResult execute(AgentTask task) {
        return AgentResult.fail("task " + task.taskId() + " rejected by fail agent");
    }
}
