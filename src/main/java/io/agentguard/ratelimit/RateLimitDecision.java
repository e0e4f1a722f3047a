package io.agentguard.ratelimit;

public record RateLimitDecision(
        String key,
        boolean allowed,
        long retryAfterMs
) {
    public static RateLimitDecision allow(String key) {
        return new RateLimitDecision(key, true, 0L);
    }

    public static RateLimitDecision reject(String key, long retryAfterMs) {
        return new RateLimitDecision(key, false, Math.max(1L, retryAfterMs));
    }
}
