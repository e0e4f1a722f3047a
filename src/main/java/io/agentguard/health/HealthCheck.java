package io.agentguard.health;

import java.util.Objects;

/**
 * A named probe plus its scheduling policy. Null interval, timeout and retries
 * take the service defaults at registration.
 */
public record HealthCheck(
        String name,
        CheckType type,
        Long intervalMs,
        Long timeoutMs,
        Integer retries,
        boolean critical,
        double weight,
        HealthProbe probe
) {
    public HealthCheck {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("health check name cannot be empty");
        }
        Objects.requireNonNull(probe, "probe");
        type = type == null ? CheckType.LIVENESS : type;
        if (intervalMs != null && intervalMs < 1L) {
            throw new IllegalArgumentException("intervalMs must be at least 1");
        }
        if (timeoutMs != null && timeoutMs < 1L) {
            throw new IllegalArgumentException("timeoutMs must be at least 1");
        }
        if (retries != null && retries < 0) {
            throw new IllegalArgumentException("retries must be non-negative");
        }
        if (!(weight > 0.0)) {
            throw new IllegalArgumentException("weight must be positive");
        }
    }

    public static HealthCheck of(String name, CheckType type, HealthProbe probe) {
        return new HealthCheck(name, type, null, null, null, false, 1.0, probe);
    }

    public HealthCheck withInterval(long value) {
        return new HealthCheck(name, type, value, timeoutMs, retries, critical, weight, probe);
    }

    public HealthCheck withTimeout(long value) {
        return new HealthCheck(name, type, intervalMs, value, retries, critical, weight, probe);
    }

    public HealthCheck withRetries(int value) {
        return new HealthCheck(name, type, intervalMs, timeoutMs, value, critical, weight, probe);
    }

    public HealthCheck withWeight(double value) {
        return new HealthCheck(name, type, intervalMs, timeoutMs, retries, critical, value, probe);
    }

    public HealthCheck asCritical() {
        return new HealthCheck(name, type, intervalMs, timeoutMs, retries, true, weight, probe);
    }

    HealthCheck resolve(HealthCheckConfig config) {
        return new HealthCheck(
                name,
                type,
                intervalMs == null ? config.defaultIntervalMs() : intervalMs,
                timeoutMs == null ? config.defaultTimeoutMs() : timeoutMs,
                retries == null ? config.defaultRetries() : retries,
                critical,
                weight,
                probe
        );
    }
}
