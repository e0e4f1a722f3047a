package io.agentguard.retry;

public record RetryConfig(
        int maxAttempts,
        long baseDelayMs,
        long maxDelayMs,
        RetryStrategy strategy,
        double jitterFactor,
        long timeoutPerAttemptMs,
        long totalTimeoutMs
) {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_DELAY_MS = 1_000L;
    public static final long DEFAULT_MAX_DELAY_MS = 30_000L;
    public static final double DEFAULT_JITTER_FACTOR = 0.2;
    public static final long DEFAULT_TIMEOUT_PER_ATTEMPT_MS = 30_000L;
    public static final long DEFAULT_TOTAL_TIMEOUT_MS = 120_000L;

    public RetryConfig {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseDelayMs < 0L) {
            throw new IllegalArgumentException("baseDelayMs must be non-negative");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0 and 1");
        }
        if (strategy == null) {
            strategy = RetryStrategy.EXPONENTIAL;
        }
    }

    public static RetryConfig defaults() {
        return new RetryConfig(
                DEFAULT_MAX_ATTEMPTS,
                DEFAULT_BASE_DELAY_MS,
                DEFAULT_MAX_DELAY_MS,
                RetryStrategy.EXPONENTIAL,
                DEFAULT_JITTER_FACTOR,
                DEFAULT_TIMEOUT_PER_ATTEMPT_MS,
                DEFAULT_TOTAL_TIMEOUT_MS
        );
    }

    public static RetryConfig forHttp() {
        return new RetryConfig(3, 1_000L, 10_000L, RetryStrategy.EXPONENTIAL, 0.3,
                DEFAULT_TIMEOUT_PER_ATTEMPT_MS, DEFAULT_TOTAL_TIMEOUT_MS);
    }

    public static RetryConfig forDatabase() {
        return new RetryConfig(5, 100L, 5_000L, RetryStrategy.DECORRELATED, DEFAULT_JITTER_FACTOR,
                10_000L, DEFAULT_TOTAL_TIMEOUT_MS);
    }

    public static RetryConfig forFileSystem() {
        return new RetryConfig(3, 50L, 1_000L, RetryStrategy.LINEAR, DEFAULT_JITTER_FACTOR,
                5_000L, DEFAULT_TOTAL_TIMEOUT_MS);
    }

    public RetryConfig withMaxAttempts(int value) {
        return new RetryConfig(value, baseDelayMs, maxDelayMs, strategy, jitterFactor, timeoutPerAttemptMs, totalTimeoutMs);
    }

    public RetryConfig withJitterFactor(double value) {
        return new RetryConfig(maxAttempts, baseDelayMs, maxDelayMs, strategy, value, timeoutPerAttemptMs, totalTimeoutMs);
    }

    public RetryConfig withTimeouts(long perAttemptMs, long totalMs) {
        return new RetryConfig(maxAttempts, baseDelayMs, maxDelayMs, strategy, jitterFactor, perAttemptMs, totalMs);
    }
}
