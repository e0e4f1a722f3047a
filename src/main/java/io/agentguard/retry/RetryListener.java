package io.agentguard.retry;

@FunctionalInterface
public interface RetryListener {
    RetryListener NOOP = (attempt, error, nextDelayMs) -> {
    };

    void onRetry(int attempt, Throwable error, long nextDelayMs);
}
