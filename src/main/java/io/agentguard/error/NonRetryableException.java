package io.agentguard.error;

/**
 * Thrown by an operation to signal that repeating it cannot succeed.
 */
public class NonRetryableException extends ReliabilityException {
    public NonRetryableException(String message) {
        super(message);
    }

    public NonRetryableException(String message, Throwable cause) {
        super(message, cause);
    }
}
