package io.agentguard.agent;

/**
 * An unreliable unit of work. Returning a failed {@link AgentResult} and throwing
 * are both treated as failures by the dispatcher.
 */
public interface Agent {
    String id();

    AgentResult execute(AgentTask task) throws Exception;
}
