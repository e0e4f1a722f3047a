package io.agentguard.agent;

import io.agentguard.error.ReliabilityException;

/**
 * Raised when an agent reports a failed result. Retryable.
 */
public class AgentFailureException extends ReliabilityException {
    private final String agentId;

    public AgentFailureException(String agentId, String error) {
        super("Agent " + agentId + " failed: " + (error == null ? "no error reported" : error));
        this.agentId = agentId;
    }

    public String agentId() {
        return agentId;
    }
}
