package io.agentguard.ratelimit;

@FunctionalInterface
public interface LimitReachedListener {
    LimitReachedListener NOOP = (key, retryAfterMs) -> {
    };

    void onLimitReached(String key, long retryAfterMs);
}
