package io.agentguard.retry;

public enum RetryStrategy {
    EXPONENTIAL,
    LINEAR,
    FIXED,
    FIBONACCI,
    DECORRELATED;

    public static RetryStrategy fromString(String raw, RetryStrategy fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return RetryStrategy.valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
