package io.agentguard.retry;

import java.util.List;

public record RetryMetrics(
        long totalAttempts,
        long successfulAttempts,
        long failedAttempts,
        long totalRetries,
        List<Long> recentRetryDelaysMs,
        String lastError,
        long lastLatencyMs,
        long totalLatencyMs
) {
}
