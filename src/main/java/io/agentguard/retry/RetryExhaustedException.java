package io.agentguard.retry;

import io.agentguard.error.ReliabilityException;

public class RetryExhaustedException extends ReliabilityException {
    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastError) {
        super("All " + attempts + " retry attempts failed: "
                + (lastError == null ? "unknown error" : lastError.getMessage()), lastError);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
