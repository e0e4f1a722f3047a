package io.agentguard.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record HealthCheckResult(
        HealthStatus status,
        String message,
        Map<String, Object> details,
        long timestampMs,
        long durationMs
) {
    public HealthCheckResult {
        if (status == null) {
            status = HealthStatus.UNKNOWN;
        }
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static HealthCheckResult of(HealthStatus status, String message) {
        return new HealthCheckResult(status, message, Map.of(), 0L, 0L);
    }

    public static HealthCheckResult of(HealthStatus status, String message, Map<String, Object> details) {
        return new HealthCheckResult(status, message, details, 0L, 0L);
    }

    public static HealthCheckResult healthy(String message) {
        return of(HealthStatus.HEALTHY, message);
    }

    public static HealthCheckResult degraded(String message) {
        return of(HealthStatus.DEGRADED, message);
    }

    public static HealthCheckResult unhealthy(String message) {
        return of(HealthStatus.UNHEALTHY, message);
    }

    public HealthCheckResult withTiming(long timestampMs, long durationMs) {
        return new HealthCheckResult(status, message, details, timestampMs, durationMs);
    }
}
