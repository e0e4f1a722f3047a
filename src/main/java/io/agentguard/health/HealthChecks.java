package io.agentguard.health;

import io.agentguard.circuit.CircuitBreakerRegistry;
import io.agentguard.circuit.CircuitState;
import io.agentguard.dlq.DeadLetterMetrics;
import io.agentguard.dlq.DeadLetterQueue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Built-in probes over the JVM and the other reliability components.
 */
public final class HealthChecks {
    static final double HEAP_DEGRADED_PERCENT = 75.0;
    static final double HEAP_UNHEALTHY_PERCENT = 90.0;

    private HealthChecks() {
    }

    public static HealthCheck memory() {
        return HealthCheck.of("memory", CheckType.LIVENESS, () -> {
            Runtime runtime = Runtime.getRuntime();
            return heapResult(runtime.totalMemory() - runtime.freeMemory(), runtime.maxMemory());
        }).withInterval(60_000L);
    }

    static HealthCheckResult heapResult(long usedBytes, long maxBytes) {
        double percentage = maxBytes <= 0L ? 0.0 : usedBytes * 100.0 / maxBytes;
        HealthStatus status = HealthStatus.HEALTHY;
        if (percentage > HEAP_UNHEALTHY_PERCENT) {
            status = HealthStatus.UNHEALTHY;
        } else if (percentage > HEAP_DEGRADED_PERCENT) {
            status = HealthStatus.DEGRADED;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("heapUsedBytes", usedBytes);
        details.put("heapMaxBytes", maxBytes);
        details.put("percentage", percentage);
        String message = String.format(Locale.ROOT, "Heap usage: %.2fMB / %.2fMB (%.1f%%)",
                usedBytes / 1024.0 / 1024.0, maxBytes / 1024.0 / 1024.0, percentage);
        return HealthCheckResult.of(status, message, details);
    }

    /**
     * UNHEALTHY below {@code minFreeBytes} of usable space, DEGRADED below twice that.
     */
    public static HealthCheck diskSpace(Path root, long minFreeBytes) {
        return HealthCheck.of("disk-space", CheckType.READINESS, () -> {
            Path probePath = Files.exists(root) ? root : root.toAbsolutePath().getParent();
            long usable = probePath == null ? 0L : probePath.toFile().getUsableSpace();
            return diskResult(root, usable, minFreeBytes);
        }).asCritical();
    }

    static HealthCheckResult diskResult(Path root, long usableBytes, long minFreeBytes) {
        HealthStatus status = HealthStatus.HEALTHY;
        if (usableBytes < minFreeBytes) {
            status = HealthStatus.UNHEALTHY;
        } else if (usableBytes < minFreeBytes * 2L) {
            status = HealthStatus.DEGRADED;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("root", root.toString());
        details.put("usableBytes", usableBytes);
        details.put("minFreeBytes", minFreeBytes);
        return HealthCheckResult.of(status, "Usable disk space: " + usableBytes + " bytes", details);
    }

    /**
     * DEGRADED while any circuit is open, UNHEALTHY once most of them are.
     */
    public static HealthCheck circuitBreakers(CircuitBreakerRegistry registry) {
        return HealthCheck.of("circuit-breakers", CheckType.READINESS, () -> {
            Map<CircuitState, Integer> counts = registry.countByState();
            int open = counts.getOrDefault(CircuitState.OPEN, 0);
            int total = 0;
            for (int count : counts.values()) {
                total += count;
            }
            HealthStatus status = HealthStatus.HEALTHY;
            if (open > 0 && open * 2 > total) {
                status = HealthStatus.UNHEALTHY;
            } else if (open > 0) {
                status = HealthStatus.DEGRADED;
            }
            Map<String, Object> details = new LinkedHashMap<>();
            for (CircuitState state : CircuitState.values()) {
                details.put(state.name().toLowerCase(Locale.ROOT), counts.getOrDefault(state, 0));
            }
            return HealthCheckResult.of(status, open + " of " + total + " circuits open", details);
        });
    }

    /**
     * DEGRADED when the backlog exceeds {@code thresholdFraction} of the queue capacity.
     */
    public static HealthCheck deadLetterQueue(DeadLetterQueue queue, double thresholdFraction) {
        if (thresholdFraction <= 0.0 || thresholdFraction > 1.0) {
            throw new IllegalArgumentException("thresholdFraction must be in (0, 1]");
        }
        return HealthCheck.of("dead-letter-queue", CheckType.READINESS, () -> {
            DeadLetterMetrics metrics = queue.metrics();
            int capacity = queue.config().maxQueueSize();
            HealthStatus status = metrics.currentQueueSize() > capacity * thresholdFraction
                    ? HealthStatus.DEGRADED
                    : HealthStatus.HEALTHY;
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("queue", queue.name());
            details.put("size", metrics.currentQueueSize());
            details.put("capacity", capacity);
            details.put("expired", metrics.expiredMessages());
            details.put("oldestMessageAgeMs", metrics.oldestMessageAgeMs());
            return HealthCheckResult.of(status, metrics.currentQueueSize() + "/" + capacity + " dead letters queued", details);
        });
    }
}
