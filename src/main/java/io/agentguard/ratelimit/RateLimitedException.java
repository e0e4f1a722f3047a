package io.agentguard.ratelimit;

import io.agentguard.error.NonRetryableException;

/**
 * Admission was refused. Retry policies treat this as terminal; callers wait
 * {@link #retryAfterMs()} before trying again.
 */
public class RateLimitedException extends NonRetryableException {
    private final String key;
    private final long retryAfterMs;

    public RateLimitedException(String key, long retryAfterMs) {
        super("Rate limit exceeded for " + key + ". Retry after " + retryAfterMs + "ms");
        this.key = key;
        this.retryAfterMs = retryAfterMs;
    }

    public String key() {
        return key;
    }

    public long retryAfterMs() {
        return retryAfterMs;
    }
}
