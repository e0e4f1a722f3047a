package io.agentguard.ratelimit;

public record RateLimitConfig(
        RateLimitStrategy strategy,
        int maxRequests,
        long windowMs,
        long blockDurationMs,
        boolean skipSuccessfulRequests,
        boolean skipFailedRequests,
        boolean distributed
) {
    public static final int DEFAULT_MAX_REQUESTS = 100;
    public static final long DEFAULT_WINDOW_MS = 60_000L;
    public static final long DEFAULT_BLOCK_DURATION_MS = 60_000L;

    public RateLimitConfig {
        if (strategy == null) {
            strategy = RateLimitStrategy.TOKEN_BUCKET;
        }
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be at least 1");
        }
        if (windowMs < 1L) {
            throw new IllegalArgumentException("windowMs must be at least 1");
        }
        if (blockDurationMs < 0L) {
            throw new IllegalArgumentException("blockDurationMs must be non-negative");
        }
    }

    public static RateLimitConfig defaults() {
        return new RateLimitConfig(RateLimitStrategy.TOKEN_BUCKET, DEFAULT_MAX_REQUESTS, DEFAULT_WINDOW_MS,
                DEFAULT_BLOCK_DURATION_MS, false, true, false);
    }

    public static RateLimitConfig forApi() {
        return new RateLimitConfig(RateLimitStrategy.TOKEN_BUCKET, 100, 60_000L, 300_000L, false, false, false);
    }

    public static RateLimitConfig forUser() {
        return new RateLimitConfig(RateLimitStrategy.SLIDING_WINDOW, 1_000, 3_600_000L, 3_600_000L, false, true, false);
    }

    public static RateLimitConfig forExpensiveOps() {
        return new RateLimitConfig(RateLimitStrategy.LEAKY_BUCKET, 10, 60_000L, 600_000L, false, true, false);
    }

    public static RateLimitConfig of(RateLimitStrategy strategy, int maxRequests, long windowMs, long blockDurationMs) {
        return new RateLimitConfig(strategy, maxRequests, windowMs, blockDurationMs, false, true, false);
    }

    public RateLimitConfig withDistributed(boolean value) {
        return new RateLimitConfig(strategy, maxRequests, windowMs, blockDurationMs,
                skipSuccessfulRequests, skipFailedRequests, value);
    }

    public RateLimitConfig withSkips(boolean skipSuccessful, boolean skipFailed) {
        return new RateLimitConfig(strategy, maxRequests, windowMs, blockDurationMs,
                skipSuccessful, skipFailed, distributed);
    }
}
