package io.agentguard.circuit;

public record CircuitMetrics(
        CircuitState state,
        long totalCalls,
        long successfulCalls,
        long failedCalls,
        long rejectedCalls,
        int consecutiveFailures,
        int consecutiveSuccesses,
        Long lastFailureTimeMs,
        Long lastSuccessTimeMs,
        long stateChangeCount,
        int halfOpenPermits,
        int windowCalls,
        double windowErrorPercentage,
        long nextAttemptTimeMs
) {
}
