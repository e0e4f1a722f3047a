package io.agentguard.health;

public record HealthCheckConfig(
        long defaultIntervalMs,
        long defaultTimeoutMs,
        int defaultRetries,
        AggregationStrategy aggregationStrategy,
        boolean autoRecovery,
        boolean alertOnCriticalFailure
) {
    public static final long DEFAULT_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_TIMEOUT_MS = 5_000L;
    public static final int DEFAULT_RETRIES = 3;

    public HealthCheckConfig {
        if (defaultIntervalMs < 1L) {
            throw new IllegalArgumentException("defaultIntervalMs must be at least 1");
        }
        if (defaultTimeoutMs < 1L) {
            throw new IllegalArgumentException("defaultTimeoutMs must be at least 1");
        }
        if (defaultRetries < 0) {
            throw new IllegalArgumentException("defaultRetries must be non-negative");
        }
        aggregationStrategy = aggregationStrategy == null ? AggregationStrategy.WORST : aggregationStrategy;
    }

    public static HealthCheckConfig defaults() {
        return new HealthCheckConfig(DEFAULT_INTERVAL_MS, DEFAULT_TIMEOUT_MS, DEFAULT_RETRIES, AggregationStrategy.WORST, true, true);
    }

    public HealthCheckConfig withAggregation(AggregationStrategy value) {
        return new HealthCheckConfig(defaultIntervalMs, defaultTimeoutMs, defaultRetries, value, autoRecovery, alertOnCriticalFailure);
    }

    public HealthCheckConfig withAutoRecovery(boolean value) {
        return new HealthCheckConfig(defaultIntervalMs, defaultTimeoutMs, defaultRetries, aggregationStrategy, value, alertOnCriticalFailure);
    }
}
