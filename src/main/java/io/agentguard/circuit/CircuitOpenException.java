package io.agentguard.circuit;

import io.agentguard.error.ReliabilityException;

/**
 * Raised when a call is rejected without running because the circuit is open or
 * its half-open trial permits are used up.
 */
public class CircuitOpenException extends ReliabilityException {
    private final String circuitName;
    private final CircuitState circuitState;
    private final long retryAfterMs;

    public CircuitOpenException(String circuitName, CircuitState circuitState, long retryAfterMs) {
        super("Circuit breaker " + circuitName + " is " + circuitState);
        this.circuitName = circuitName;
        this.circuitState = circuitState;
        this.retryAfterMs = retryAfterMs;
    }

    public CircuitOpenException(String circuitName, CircuitState circuitState, long retryAfterMs, Throwable fallbackError) {
        super("Circuit breaker " + circuitName + " is " + circuitState + " and fallback failed: "
                + fallbackError.getMessage(), fallbackError);
        this.circuitName = circuitName;
        this.circuitState = circuitState;
        this.retryAfterMs = retryAfterMs;
    }

    public String circuitName() {
        return circuitName;
    }

    public CircuitState circuitState() {
        return circuitState;
    }

    public long retryAfterMs() {
        return retryAfterMs;
    }
}
