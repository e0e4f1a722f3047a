package io.agentguard.agent;

/**
 * Outcome reported by an agent. A failed result always carries an error text.
 */
public record AgentResult(
        boolean success,
        String output,
        String error
) {
    public AgentResult {
        if (success) {
            output = output == null ? "" : output;
            error = null;
        } else if (error == null || error.isBlank()) {
            error = "agent reported failure without details";
        }
    }

    public static AgentResult ok(String output) {
        return new AgentResult(true, output, null);
    }

    public static AgentResult fail(String error) {
        return new AgentResult(false, null, error);
    }
}
