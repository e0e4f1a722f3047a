package io.agentguard.error;

/**
 * Base type for failures raised by the reliability primitives themselves, as
 * opposed to failures of the protected operation.
 */
public class ReliabilityException extends RuntimeException {
    public ReliabilityException(String message) {
        super(message);
    }

    public ReliabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
