package io.agentguard.error;

public class OperationTimeoutException extends ReliabilityException {
    private final long timeoutMs;

    public OperationTimeoutException(String operation, long timeoutMs) {
        super(operation + " timed out after " + timeoutMs + "ms");
        this.timeoutMs = timeoutMs;
    }

    public long timeoutMs() {
        return timeoutMs;
    }
}
