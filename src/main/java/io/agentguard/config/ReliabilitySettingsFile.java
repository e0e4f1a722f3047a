package io.agentguard.config;

/**
 * Raw shape of {@code agentguard-settings.json}. Every field is optional.
 */
public record ReliabilitySettingsFile(
        Integer circuitFailureThreshold,
        Integer circuitSuccessThreshold,
        Long circuitTimeoutMs,
        Integer circuitVolumeThreshold,
        Integer circuitErrorPercentageThreshold,
        Long circuitRollingWindowMs,
        Long circuitCallTimeoutMs,
        Integer retryMaxAttempts,
        Long retryBaseDelayMs,
        Long retryMaxDelayMs,
        String retryStrategy,
        Double retryJitterFactor,
        Long retryTimeoutPerAttemptMs,
        Long retryTotalTimeoutMs,
        String rateLimitStrategy,
        Integer rateLimitMaxRequests,
        Long rateLimitWindowMs,
        Long rateLimitBlockDurationMs,
        Boolean rateLimitSkipSuccessfulRequests,
        Boolean rateLimitSkipFailedRequests,
        Boolean rateLimitDistributed,
        Integer dlqMaxRetries,
        Long dlqRetryDelayMs,
        Double dlqRetryBackoffMultiplier,
        Long dlqMaxBackoffMs,
        Integer dlqMaxQueueSize,
        Boolean dlqPersist,
        Long dlqProcessIntervalMs,
        Long healthIntervalMs,
        Long healthTimeoutMs,
        Integer healthRetries,
        String healthAggregationStrategy,
        Boolean healthAutoRecovery,
        Boolean healthAlertOnCriticalFailure,
        Long minFreeDiskBytes,
        Double dlqBacklogThreshold
) {
}
