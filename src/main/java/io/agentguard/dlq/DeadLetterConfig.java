package io.agentguard.dlq;

public record DeadLetterConfig(
        int maxRetries,
        long retryDelayMs,
        double retryBackoffMultiplier,
        long maxBackoffMs,
        int maxQueueSize,
        boolean persist,
        long processIntervalMs
) {
    public static final int DEFAULT_MAX_RETRIES = 5;
    public static final long DEFAULT_RETRY_DELAY_MS = 5_000L;
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;
    public static final long DEFAULT_MAX_BACKOFF_MS = 300_000L;
    public static final int DEFAULT_MAX_QUEUE_SIZE = 1_000;
    public static final long DEFAULT_PROCESS_INTERVAL_MS = 30_000L;

    public DeadLetterConfig {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
        if (retryDelayMs < 0L) {
            throw new IllegalArgumentException("retryDelayMs must be non-negative");
        }
        if (retryBackoffMultiplier < 1.0) {
            throw new IllegalArgumentException("retryBackoffMultiplier must be >= 1");
        }
        if (maxBackoffMs < retryDelayMs) {
            throw new IllegalArgumentException("maxBackoffMs must be >= retryDelayMs");
        }
        if (maxQueueSize < 1) {
            throw new IllegalArgumentException("maxQueueSize must be at least 1");
        }
        if (processIntervalMs < 1L) {
            throw new IllegalArgumentException("processIntervalMs must be at least 1");
        }
    }

    public static DeadLetterConfig defaults() {
        return new DeadLetterConfig(
                DEFAULT_MAX_RETRIES,
                DEFAULT_RETRY_DELAY_MS,
                DEFAULT_BACKOFF_MULTIPLIER,
                DEFAULT_MAX_BACKOFF_MS,
                DEFAULT_MAX_QUEUE_SIZE,
                true,
                DEFAULT_PROCESS_INTERVAL_MS
        );
    }

    public static DeadLetterConfig forAgents() {
        return new DeadLetterConfig(5, 10_000L, 1.5, DEFAULT_MAX_BACKOFF_MS, 100, true, DEFAULT_PROCESS_INTERVAL_MS);
    }

    public long backoffMs(int attempts) {
        double delay = retryDelayMs * Math.pow(retryBackoffMultiplier, Math.max(0, attempts - 1));
        return (long) Math.min((double) maxBackoffMs, delay);
    }
}
