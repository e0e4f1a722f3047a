package io.agentguard.circuit;

public record CircuitHealth(
        String name,
        CircuitState state,
        boolean healthy,
        double errorRate,
        long sinceLastSuccessMs,
        CircuitMetrics metrics
) {
}
