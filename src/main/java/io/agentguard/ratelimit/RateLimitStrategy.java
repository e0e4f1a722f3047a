package io.agentguard.ratelimit;

public enum RateLimitStrategy {
    TOKEN_BUCKET,
    SLIDING_WINDOW,
    FIXED_WINDOW,
    LEAKY_BUCKET;

    public static RateLimitStrategy fromString(String raw, RateLimitStrategy fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return RateLimitStrategy.valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
