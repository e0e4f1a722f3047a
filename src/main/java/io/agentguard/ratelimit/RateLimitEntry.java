package io.agentguard.ratelimit;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Mutable per-key state. {@code level} holds available tokens for the token
 * bucket, the counter for the fixed window and the fill level for the leaky
 * bucket. Guarded by its own monitor.
 */
final class RateLimitEntry {
    double level;
    long lastRefillMs;
    long lastSeenMs;
    final Deque<Long> requests = new ArrayDeque<>();
    boolean blocked;
    long blockUntilMs;

    RateLimitEntry(double level, long nowMs) {
        this.level = level;
        this.lastRefillMs = nowMs;
        this.lastSeenMs = nowMs;
    }
}
