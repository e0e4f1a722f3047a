package io.agentguard.config;

import io.agentguard.circuit.CircuitBreakerConfig;
import io.agentguard.dlq.DeadLetterConfig;
import io.agentguard.health.AggregationStrategy;
import io.agentguard.health.HealthCheckConfig;
import io.agentguard.ratelimit.RateLimitConfig;
import io.agentguard.ratelimit.RateLimitStrategy;
import io.agentguard.retry.RetryConfig;
import io.agentguard.retry.RetryStrategy;
import io.agentguard.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Resolved settings. Values read from the settings file are clamped to their
 * minimums; missing or unparseable enum values keep the defaults.
 */
public record ReliabilitySettings(
        int circuitFailureThreshold,
        int circuitSuccessThreshold,
        long circuitTimeoutMs,
        int circuitVolumeThreshold,
        int circuitErrorPercentageThreshold,
        long circuitRollingWindowMs,
        long circuitCallTimeoutMs,
        int retryMaxAttempts,
        long retryBaseDelayMs,
        long retryMaxDelayMs,
        RetryStrategy retryStrategy,
        double retryJitterFactor,
        long retryTimeoutPerAttemptMs,
        long retryTotalTimeoutMs,
        RateLimitStrategy rateLimitStrategy,
        int rateLimitMaxRequests,
        long rateLimitWindowMs,
        long rateLimitBlockDurationMs,
        boolean rateLimitSkipSuccessfulRequests,
        boolean rateLimitSkipFailedRequests,
        boolean rateLimitDistributed,
        int dlqMaxRetries,
        long dlqRetryDelayMs,
        double dlqRetryBackoffMultiplier,
        long dlqMaxBackoffMs,
        int dlqMaxQueueSize,
        boolean dlqPersist,
        long dlqProcessIntervalMs,
        long healthIntervalMs,
        long healthTimeoutMs,
        int healthRetries,
        AggregationStrategy healthAggregationStrategy,
        boolean healthAutoRecovery,
        boolean healthAlertOnCriticalFailure,
        long minFreeDiskBytes,
        double dlqBacklogThreshold
) {
    public static final long DEFAULT_MIN_FREE_DISK_BYTES = 100L * 1024L * 1024L;
    public static final double DEFAULT_DLQ_BACKLOG_THRESHOLD = 0.8;
    public static final int DEFAULT_RATE_LIMIT_MAX_REQUESTS = 60;

    public static ReliabilitySettings defaults() {
        CircuitBreakerConfig circuit = CircuitBreakerConfig.forAgents();
        RetryConfig retry = RetryConfig.defaults();
        DeadLetterConfig dlq = DeadLetterConfig.forAgents();
        HealthCheckConfig health = HealthCheckConfig.defaults();
        return new ReliabilitySettings(
                circuit.failureThreshold(),
                circuit.successThreshold(),
                circuit.timeoutMs(),
                circuit.volumeThreshold(),
                circuit.errorPercentageThreshold(),
                circuit.rollingWindowMs(),
                circuit.callTimeoutMs(),
                retry.maxAttempts(),
                retry.baseDelayMs(),
                retry.maxDelayMs(),
                retry.strategy(),
                retry.jitterFactor(),
                retry.timeoutPerAttemptMs(),
                retry.totalTimeoutMs(),
                RateLimitStrategy.TOKEN_BUCKET,
                DEFAULT_RATE_LIMIT_MAX_REQUESTS,
                RateLimitConfig.DEFAULT_WINDOW_MS,
                RateLimitConfig.DEFAULT_BLOCK_DURATION_MS,
                false,
                true,
                false,
                dlq.maxRetries(),
                dlq.retryDelayMs(),
                dlq.retryBackoffMultiplier(),
                dlq.maxBackoffMs(),
                dlq.maxQueueSize(),
                dlq.persist(),
                dlq.processIntervalMs(),
                health.defaultIntervalMs(),
                health.defaultTimeoutMs(),
                health.defaultRetries(),
                health.aggregationStrategy(),
                health.autoRecovery(),
                health.alertOnCriticalFailure(),
                DEFAULT_MIN_FREE_DISK_BYTES,
                DEFAULT_DLQ_BACKLOG_THRESHOLD
        );
    }

    /**
     * Reads the settings file, or returns defaults when it does not exist.
     */
    public static ReliabilitySettings load(Path file) {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        try {
            ReliabilitySettingsFile raw = Jsons.mapper().readValue(file.toFile(), ReliabilitySettingsFile.class);
            return fromFile(raw, defaults());
        } catch (IOException e) {
            throw new RuntimeException("Failed to load reliability settings: " + file, e);
        }
    }

    public static ReliabilitySettings fromFile(ReliabilitySettingsFile file, ReliabilitySettings defaults) {
        if (file == null) {
            return defaults;
        }
        long retryBase = sanitizeLong(file.retryBaseDelayMs(), defaults.retryBaseDelayMs(), 0L);
        long retryMax = sanitizeLong(file.retryMaxDelayMs(), defaults.retryMaxDelayMs(), retryBase);
        if (retryMax < retryBase) {
            retryMax = retryBase;
        }
        long dlqDelay = sanitizeLong(file.dlqRetryDelayMs(), defaults.dlqRetryDelayMs(), 0L);
        long dlqMaxBackoff = sanitizeLong(file.dlqMaxBackoffMs(), defaults.dlqMaxBackoffMs(), dlqDelay);
        if (dlqMaxBackoff < dlqDelay) {
            dlqMaxBackoff = dlqDelay;
        }
        return new ReliabilitySettings(
                sanitizeInt(file.circuitFailureThreshold(), defaults.circuitFailureThreshold(), 1),
                sanitizeInt(file.circuitSuccessThreshold(), defaults.circuitSuccessThreshold(), 1),
                sanitizeLong(file.circuitTimeoutMs(), defaults.circuitTimeoutMs(), 0L),
                sanitizeInt(file.circuitVolumeThreshold(), defaults.circuitVolumeThreshold(), 1),
                Math.min(100, sanitizeInt(file.circuitErrorPercentageThreshold(), defaults.circuitErrorPercentageThreshold(), 1)),
                sanitizeLong(file.circuitRollingWindowMs(), defaults.circuitRollingWindowMs(), 1L),
                sanitizeLong(file.circuitCallTimeoutMs(), defaults.circuitCallTimeoutMs(), 0L),
                sanitizeInt(file.retryMaxAttempts(), defaults.retryMaxAttempts(), 1),
                retryBase,
                retryMax,
                RetryStrategy.fromString(file.retryStrategy(), defaults.retryStrategy()),
                sanitizeFraction(file.retryJitterFactor(), defaults.retryJitterFactor(), 0.0),
                sanitizeLong(file.retryTimeoutPerAttemptMs(), defaults.retryTimeoutPerAttemptMs(), 0L),
                sanitizeLong(file.retryTotalTimeoutMs(), defaults.retryTotalTimeoutMs(), 0L),
                RateLimitStrategy.fromString(file.rateLimitStrategy(), defaults.rateLimitStrategy()),
                sanitizeInt(file.rateLimitMaxRequests(), defaults.rateLimitMaxRequests(), 1),
                sanitizeLong(file.rateLimitWindowMs(), defaults.rateLimitWindowMs(), 1L),
                sanitizeLong(file.rateLimitBlockDurationMs(), defaults.rateLimitBlockDurationMs(), 0L),
                sanitizeBoolean(file.rateLimitSkipSuccessfulRequests(), defaults.rateLimitSkipSuccessfulRequests()),
                sanitizeBoolean(file.rateLimitSkipFailedRequests(), defaults.rateLimitSkipFailedRequests()),
                sanitizeBoolean(file.rateLimitDistributed(), defaults.rateLimitDistributed()),
                sanitizeInt(file.dlqMaxRetries(), defaults.dlqMaxRetries(), 1),
                dlqDelay,
                sanitizeDouble(file.dlqRetryBackoffMultiplier(), defaults.dlqRetryBackoffMultiplier(), 1.0),
                dlqMaxBackoff,
                sanitizeInt(file.dlqMaxQueueSize(), defaults.dlqMaxQueueSize(), 1),
                sanitizeBoolean(file.dlqPersist(), defaults.dlqPersist()),
                sanitizeLong(file.dlqProcessIntervalMs(), defaults.dlqProcessIntervalMs(), 100L),
                sanitizeLong(file.healthIntervalMs(), defaults.healthIntervalMs(), 100L),
                sanitizeLong(file.healthTimeoutMs(), defaults.healthTimeoutMs(), 1L),
                sanitizeInt(file.healthRetries(), defaults.healthRetries(), 0),
                AggregationStrategy.fromString(file.healthAggregationStrategy(), defaults.healthAggregationStrategy()),
                sanitizeBoolean(file.healthAutoRecovery(), defaults.healthAutoRecovery()),
                sanitizeBoolean(file.healthAlertOnCriticalFailure(), defaults.healthAlertOnCriticalFailure()),
                sanitizeLong(file.minFreeDiskBytes(), defaults.minFreeDiskBytes(), 0L),
                sanitizeFraction(file.dlqBacklogThreshold(), defaults.dlqBacklogThreshold(), 0.01)
        );
    }

    public CircuitBreakerConfig circuitConfig() {
        return new CircuitBreakerConfig(
                circuitFailureThreshold,
                circuitSuccessThreshold,
                circuitTimeoutMs,
                circuitVolumeThreshold,
                circuitErrorPercentageThreshold,
                circuitRollingWindowMs,
                circuitCallTimeoutMs
        );
    }

    public RetryConfig retryConfig() {
        return new RetryConfig(
                retryMaxAttempts,
                retryBaseDelayMs,
                retryMaxDelayMs,
                retryStrategy,
                retryJitterFactor,
                retryTimeoutPerAttemptMs,
                retryTotalTimeoutMs
        );
    }

    public RateLimitConfig rateLimitConfig() {
        return new RateLimitConfig(
                rateLimitStrategy,
                rateLimitMaxRequests,
                rateLimitWindowMs,
                rateLimitBlockDurationMs,
                rateLimitSkipSuccessfulRequests,
                rateLimitSkipFailedRequests,
                rateLimitDistributed
        );
    }

    public DeadLetterConfig deadLetterConfig() {
        return new DeadLetterConfig(
                dlqMaxRetries,
                dlqRetryDelayMs,
                dlqRetryBackoffMultiplier,
                dlqMaxBackoffMs,
                dlqMaxQueueSize,
                dlqPersist,
                dlqProcessIntervalMs
        );
    }

    public HealthCheckConfig healthConfig() {
        return new HealthCheckConfig(
                healthIntervalMs,
                healthTimeoutMs,
                healthRetries,
                healthAggregationStrategy,
                healthAutoRecovery,
                healthAlertOnCriticalFailure
        );
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static double sanitizeDouble(Double raw, double fallback, double min) {
        if (raw == null || raw.isNaN() || raw.isInfinite()) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static double sanitizeFraction(Double raw, double fallback, double min) {
        return Math.min(1.0, sanitizeDouble(raw, fallback, min));
    }

    private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw;
    }
}
