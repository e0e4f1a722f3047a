package io.agentguard.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record AggregatedHealth(
        HealthStatus overall,
        Map<String, HealthCheckResult> checks,
        long timestampMs,
        long uptimeMs,
        Long lastHealthyTimeMs,
        int consecutiveFailures
) {
    public AggregatedHealth {
        checks = checks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(checks));
    }
}
