package io.agentguard.circuit;

public record CircuitBreakerConfig(
        int failureThreshold,
        int successThreshold,
        long timeoutMs,
        int volumeThreshold,
        int errorPercentageThreshold,
        long rollingWindowMs,
        long callTimeoutMs
) {
    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final int DEFAULT_SUCCESS_THRESHOLD = 2;
    public static final long DEFAULT_TIMEOUT_MS = 60_000L;
    public static final int DEFAULT_VOLUME_THRESHOLD = 10;
    public static final int DEFAULT_ERROR_PERCENTAGE_THRESHOLD = 50;
    public static final long DEFAULT_ROLLING_WINDOW_MS = 60_000L;
    public static final long DEFAULT_CALL_TIMEOUT_MS = 30_000L;

    public CircuitBreakerConfig {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be >= 1");
        }
        if (timeoutMs < 0L) {
            throw new IllegalArgumentException("timeoutMs must be >= 0");
        }
        if (volumeThreshold < 1) {
            throw new IllegalArgumentException("volumeThreshold must be >= 1");
        }
        if (errorPercentageThreshold < 1 || errorPercentageThreshold > 100) {
            throw new IllegalArgumentException("errorPercentageThreshold must be within 1..100");
        }
        if (rollingWindowMs < 1L) {
            throw new IllegalArgumentException("rollingWindowMs must be >= 1");
        }
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(
                DEFAULT_FAILURE_THRESHOLD,
                DEFAULT_SUCCESS_THRESHOLD,
                DEFAULT_TIMEOUT_MS,
                DEFAULT_VOLUME_THRESHOLD,
                DEFAULT_ERROR_PERCENTAGE_THRESHOLD,
                DEFAULT_ROLLING_WINDOW_MS,
                DEFAULT_CALL_TIMEOUT_MS
        );
    }

    /**
     * Settings used for per-agent circuits: quicker to trip on volume, slower to close.
     */
    public static CircuitBreakerConfig forAgents() {
        return new CircuitBreakerConfig(5, 3, 60_000L, 5, 60, DEFAULT_ROLLING_WINDOW_MS, DEFAULT_CALL_TIMEOUT_MS);
    }

    public CircuitBreakerConfig withTimeoutMs(long value) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, value, volumeThreshold,
                errorPercentageThreshold, rollingWindowMs, callTimeoutMs);
    }

    public CircuitBreakerConfig withCallTimeoutMs(long value) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs, volumeThreshold,
                errorPercentageThreshold, rollingWindowMs, value);
    }
}
