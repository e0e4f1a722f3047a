package io.agentguard.ratelimit;

public record RateLimitMetrics(
        long totalRequests,
        long allowedRequests,
        long blockedRequests,
        int currentlyBlocked,
        int trackedKeys,
        long distributedFallbacks
) {
}
