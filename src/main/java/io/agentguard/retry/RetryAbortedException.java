package io.agentguard.retry;

import io.agentguard.error.ReliabilityException;

public class RetryAbortedException extends ReliabilityException {
    public enum Reason {
        CANCELLED,
        TOTAL_TIMEOUT
    }

    private final Reason reason;
    private final int attempts;

    public RetryAbortedException(Reason reason, int attempts, Throwable lastError) {
        super(describe(reason, attempts), lastError);
        this.reason = reason;
        this.attempts = attempts;
    }

    public Reason reason() {
        return reason;
    }

    public int attempts() {
        return attempts;
    }

    private static String describe(Reason reason, int attempts) {
        if (reason == Reason.TOTAL_TIMEOUT) {
            return "Total timeout exceeded after " + attempts + " attempts";
        }
        return "Operation aborted after " + attempts + " attempts";
    }
}
