package io.agentguard.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentguard.circuit.CircuitBreaker;
import io.agentguard.circuit.CircuitBreakerRegistry;
import io.agentguard.circuit.CircuitOpenException;
import io.agentguard.dlq.DeadLetterMessage;
import io.agentguard.dlq.DeadLetterQueue;
import io.agentguard.ratelimit.RateLimitedException;
import io.agentguard.ratelimit.RateLimiter;
import io.agentguard.retry.RetryAbortedException;
import io.agentguard.retry.RetryConfig;
import io.agentguard.retry.RetryExecutor;
import io.agentguard.retry.RetryListener;
import io.agentguard.retry.RetryMetrics;
import io.agentguard.retry.RetryPredicates;
import io.agentguard.retry.RetryableOperation;
import io.agentguard.retry.Sleeper;
import io.agentguard.util.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * Composes the primitives around one keyed operation: admission check, then a
 * per-key circuit, then bounded retries, then the dead letter queue for whatever
 * still fails. Rate-limit rejections and cancellations are returned to the
 * caller without being dead-lettered.
 */
public final class OperationGuard {
    private static final Logger log = LoggerFactory.getLogger(OperationGuard.class);

    private final RateLimiter<String> rateLimiter;
    private final CircuitBreakerRegistry circuits;
    private final RetryConfig retryConfig;
    private final DeadLetterQueue deadLetters;
    private final Clock clock;
    private final Sleeper sleeper;
    private final TimeLimiter timeLimiter;
    private final Predicate<Throwable> retryable;
    private final Map<String, RetryExecutor> executors = new ConcurrentHashMap<>();

    public OperationGuard(
            RateLimiter<String> rateLimiter,
            CircuitBreakerRegistry circuits,
            RetryConfig retryConfig,
            DeadLetterQueue deadLetters
    ) {
        this(rateLimiter, circuits, retryConfig, deadLetters, Clock.systemUTC(), Sleeper.SYSTEM, TimeLimiter.shared());
    }

    public OperationGuard(
            RateLimiter<String> rateLimiter,
            CircuitBreakerRegistry circuits,
            RetryConfig retryConfig,
            DeadLetterQueue deadLetters,
            Clock clock,
            Sleeper sleeper,
            TimeLimiter timeLimiter
    ) {
        this.rateLimiter = rateLimiter;
        this.circuits = circuits;
        this.retryConfig = retryConfig == null ? RetryConfig.defaults() : retryConfig;
        this.deadLetters = deadLetters;
        this.clock = clock;
        this.sleeper = sleeper;
        this.timeLimiter = timeLimiter;
        // Open circuits go straight to the dead letter queue.
        this.retryable = RetryPredicates.defaultPredicate().and(e -> !(e instanceof CircuitOpenException));
    }

    public CircuitBreakerRegistry circuits() {
        return circuits;
    }

    public RateLimiter<String> rateLimiter() {
        return rateLimiter;
    }

    public DeadLetterQueue deadLetters() {
        return deadLetters;
    }

    public <T> T execute(GuardedOperation guarded, RetryableOperation<T> operation) throws Exception {
        if (rateLimiter != null) {
            rateLimiter.acquire(guarded.key());
        }
        RetryExecutor executor = executors.computeIfAbsent(guarded.key(), this::newExecutor);
        try {
            return executor.execute(operation, guarded.key());
        } catch (Exception e) {
            if (deadLetters != null && shouldDeadLetter(e)) {
                DeadLetterMessage message = deadLetters.addMessage(guarded.payload(), e, guarded.source(), guarded.metadata());
                log.warn("Operation {} failed and was dead-lettered as {}", guarded.key(), message.id());
            }
            throw e;
        }
    }

    /**
     * Whether a failure of a guarded operation belongs in the dead letter queue.
     */
    public static boolean shouldDeadLetter(Throwable error) {
        if (error instanceof RateLimitedException || error instanceof InterruptedException) {
            return false;
        }
        if (error instanceof RetryAbortedException) {
            return ((RetryAbortedException) error).reason() != RetryAbortedException.Reason.CANCELLED;
        }
        return true;
    }

    /**
     * Retry counters summed over every key seen so far.
     */
    public RetryMetrics retryMetrics() {
        long attempts = 0L;
        long successful = 0L;
        long failed = 0L;
        long retries = 0L;
        long lastLatency = 0L;
        long totalLatency = 0L;
        String lastError = null;
        List<Long> delays = new ArrayList<>();
        for (RetryExecutor executor : executors.values()) {
            RetryMetrics m = executor.metrics();
            attempts += m.totalAttempts();
            successful += m.successfulAttempts();
            failed += m.failedAttempts();
            retries += m.totalRetries();
            totalLatency += m.totalLatencyMs();
            lastLatency = Math.max(lastLatency, m.lastLatencyMs());
            if (m.lastError() != null) {
                lastError = m.lastError();
            }
            delays.addAll(m.recentRetryDelaysMs());
        }
        return new RetryMetrics(attempts, successful, failed, retries, delays, lastError, lastLatency, totalLatency);
    }

    private RetryExecutor newExecutor(String key) {
        CircuitBreaker breaker = circuits == null ? null : circuits.breaker(key);
        RetryListener listener = (attempt, error, nextDelayMs) ->
                log.debug("Operation {} attempt {} failed ({}); next attempt in {}ms", key, attempt, error.toString(), nextDelayMs);
        return new RetryExecutor(retryConfig, retryable, listener, breaker, clock, sleeper, timeLimiter,
                () -> ThreadLocalRandom.current().nextDouble());
    }

    public record GuardedOperation(
            String key,
            String source,
            JsonNode payload,
            Map<String, Object> metadata
    ) {
        public GuardedOperation {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("operation key cannot be empty");
            }
            if (source == null || source.isBlank()) {
                source = key;
            }
            metadata = metadata == null ? Map.of() : metadata;
        }
    }
}
