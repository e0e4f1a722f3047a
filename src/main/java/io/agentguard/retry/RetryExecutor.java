package io.agentguard.retry;

import io.agentguard.circuit.CircuitBreaker;
import io.agentguard.util.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;

public final class RetryExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);
    private static final int MAX_TRACKED_DELAYS = 100;

    private final RetryConfig config;
    private final Predicate<Throwable> retryable;
    private final RetryListener listener;
    private final CircuitBreaker circuitBreaker;
    private final Clock clock;
    private final Sleeper sleeper;
    private final TimeLimiter timeLimiter;
    private final BackoffCalculator backoff;

    private long totalAttempts;
    private long successfulAttempts;
    private long failedAttempts;
    private long totalRetries;
    private final Deque<Long> retryDelays = new ArrayDeque<>();
    private String lastError;
    private long lastLatencyMs;
    private long totalLatencyMs;

    public RetryExecutor(RetryConfig config) {
        this(config, RetryPredicates.defaultPredicate(), RetryListener.NOOP, null);
    }

    public RetryExecutor(RetryConfig config, Predicate<Throwable> retryable, RetryListener listener, CircuitBreaker circuitBreaker) {
        this(config, retryable, listener, circuitBreaker, Clock.systemUTC(), Sleeper.SYSTEM, TimeLimiter.shared(),
                () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryExecutor(
            RetryConfig config,
            Predicate<Throwable> retryable,
            RetryListener listener,
            CircuitBreaker circuitBreaker,
            Clock clock,
            Sleeper sleeper,
            TimeLimiter timeLimiter,
            DoubleSupplier random
    ) {
        this.config = Objects.requireNonNull(config, "config");
        this.retryable = retryable == null ? RetryPredicates.defaultPredicate() : retryable;
        this.listener = listener == null ? RetryListener.NOOP : listener;
        this.circuitBreaker = circuitBreaker;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.timeLimiter = Objects.requireNonNull(timeLimiter, "timeLimiter");
        this.backoff = new BackoffCalculator(config, random);
        if (config.maxAttempts() > 10) {
            log.warn("maxAttempts={} is unusually high", config.maxAttempts());
        }
        if (config.timeoutPerAttemptMs() > 0L && config.timeoutPerAttemptMs() < 100L) {
            log.warn("timeoutPerAttemptMs={} is below 100ms", config.timeoutPerAttemptMs());
        }
    }

    public RetryConfig config() {
        return config;
    }

    public <T> T execute(RetryableOperation<T> operation, String context) throws Exception {
        return execute(operation, context, null);
    }

    /**
     * Runs {@code operation} until it succeeds, a non-retryable error is thrown,
     * the attempt budget is spent, the total timeout passes or {@code signal} is
     * cancelled.
     */
    public <T> T execute(RetryableOperation<T> operation, String context, CancellationSignal signal) throws Exception {
        Objects.requireNonNull(operation, "operation");
        String label = context == null || context.isBlank() ? "operation" : context;
        long startMs = clock.millis();
        Exception lastFailure = null;
        int attempted = 0;
        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            if (signal != null && signal.isCancelled()) {
                throw new RetryAbortedException(RetryAbortedException.Reason.CANCELLED, attempted, lastFailure);
            }
            if (config.totalTimeoutMs() > 0L && clock.millis() - startMs > config.totalTimeoutMs()) {
                log.warn("Total timeout of {}ms exceeded for {} after {} attempts", config.totalTimeoutMs(), label, attempted);
                throw new RetryAbortedException(RetryAbortedException.Reason.TOTAL_TIMEOUT, attempted, lastFailure);
            }
            attempted = attempt;
            try {
                T result = runAttempt(operation, attempt, label);
                recordSuccess(clock.millis() - startMs);
                return result;
            } catch (Exception e) {
                lastFailure = e;
                recordFailure(e);
                if (!retryable.test(e)) {
                    log.warn("Non-retryable error for {} at attempt {}: {}", label, attempt, e.toString());
                    throw e;
                }
                if (attempt >= config.maxAttempts()) {
                    log.error("All {} attempts failed for {}", config.maxAttempts(), label);
                    break;
                }
                long delay = backoff.delayMs(attempt);
                notifyRetry(attempt, e, delay);
                log.info("Retrying {} after {}ms (attempt {}/{})", label, delay, attempt, config.maxAttempts());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new RetryAbortedException(RetryAbortedException.Reason.CANCELLED, attempt, e);
                }
                recordRetry(delay);
            }
        }
        throw new RetryExhaustedException(attempted, lastFailure);
    }

    public synchronized RetryMetrics metrics() {
        return new RetryMetrics(
                totalAttempts,
                successfulAttempts,
                failedAttempts,
                totalRetries,
                new ArrayList<>(retryDelays),
                lastError,
                lastLatencyMs,
                totalLatencyMs
        );
    }

    public synchronized void resetMetrics() {
        totalAttempts = 0L;
        successfulAttempts = 0L;
        failedAttempts = 0L;
        totalRetries = 0L;
        retryDelays.clear();
        lastError = null;
        lastLatencyMs = 0L;
        totalLatencyMs = 0L;
    }

    private <T> T runAttempt(RetryableOperation<T> operation, int attempt, String label) throws Exception {
        if (circuitBreaker == null) {
            return timeLimiter.call(() -> operation.call(attempt), config.timeoutPerAttemptMs(), label);
        }
        return circuitBreaker.execute(() -> timeLimiter.call(() -> operation.call(attempt), config.timeoutPerAttemptMs(), label));
    }

    private void notifyRetry(int attempt, Exception error, long delay) {
        try {
            listener.onRetry(attempt, error, delay);
        } catch (RuntimeException e) {
            log.error("Retry listener failed", e);
        }
    }

    private synchronized void recordSuccess(long latencyMs) {
        totalAttempts++;
        successfulAttempts++;
        lastLatencyMs = latencyMs;
        totalLatencyMs += latencyMs;
    }

    private synchronized void recordFailure(Exception error) {
        totalAttempts++;
        failedAttempts++;
        lastError = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }

    private synchronized void recordRetry(long delay) {
        totalRetries++;
        retryDelays.addLast(delay);
        while (retryDelays.size() > MAX_TRACKED_DELAYS) {
            retryDelays.removeFirst();
        }
    }
}
