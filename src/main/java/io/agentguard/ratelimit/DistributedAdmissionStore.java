package io.agentguard.ratelimit;

/**
 * Shared admission counter for limiters running in several processes. Each call
 * must check and increment atomically, and a fresh counter expires after one
 * window.
 */
public interface DistributedAdmissionStore {
    Admission tryAcquire(String key, int cost, int maxRequests, long windowMs, long nowMs) throws Exception;

    void reset(String key) throws Exception;

    record Admission(boolean allowed, long retryAfterMs) {
    }
}
