package io.agentguard.circuit;

import io.agentguard.util.Threads;
import io.agentguard.util.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-key failure isolation. CLOSED passes calls and trips to OPEN on
 * consecutive failures or on the error rate of the rolling window; OPEN rejects
 * until {@code timeoutMs} elapses; HALF_OPEN admits at most
 * {@code successThreshold} trial calls and closes once that many succeed.
 *
 * <p>State is guarded by the instance monitor. The protected call itself runs
 * outside the monitor, bounded by {@code callTimeoutMs}.
 */
public final class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);
    private static final Executor PROBE_EXECUTOR = Threads.cached("agentguard-circuit-probe");

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final TimeLimiter timeLimiter;
    private final StateChangeListener listener;
    private final Callable<Boolean> healthProbe;
    private final Executor probeExecutor;
    private final AtomicBoolean transitioning = new AtomicBoolean(false);
    private final AtomicBoolean probeInProgress = new AtomicBoolean(false);
    private final Deque<Outcome> window = new ArrayDeque<>();

    private CircuitState state = CircuitState.CLOSED;
    private long nextAttemptTimeMs;
    private long totalCalls;
    private long successfulCalls;
    private long failedCalls;
    private long rejectedCalls;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private Long lastFailureTimeMs;
    private Long lastSuccessTimeMs;
    private long stateChangeCount;
    private int halfOpenPermits;

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC(), StateChangeListener.NOOP);
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock, StateChangeListener listener) {
        this(name, config, clock, TimeLimiter.shared(), listener, null, PROBE_EXECUTOR);
    }

    public CircuitBreaker(
            String name,
            CircuitBreakerConfig config,
            Clock clock,
            TimeLimiter timeLimiter,
            StateChangeListener listener,
            Callable<Boolean> healthProbe,
            Executor probeExecutor
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("circuit name cannot be empty");
        }
        this.name = name;
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.timeLimiter = Objects.requireNonNull(timeLimiter, "timeLimiter");
        this.listener = listener == null ? StateChangeListener.NOOP : listener;
        this.healthProbe = healthProbe;
        this.probeExecutor = probeExecutor == null ? PROBE_EXECUTOR : probeExecutor;
    }

    public String name() {
        return name;
    }

    public CircuitBreakerConfig config() {
        return config;
    }

    public <T> T execute(Callable<T> operation) throws Exception {
        return execute(operation, null);
    }

    /**
     * Runs {@code operation} if the circuit admits it. A rejected call runs
     * {@code fallback} instead when one is given; without a fallback, or when the
     * fallback fails, the rejection surfaces as {@link CircuitOpenException}.
     */
    public <T> T execute(Callable<T> operation, Callable<T> fallback) throws Exception {
        Objects.requireNonNull(operation, "operation");
        Rejection rejection = tryAcquire();
        if (rejection != null) {
            if (fallback == null) {
                throw new CircuitOpenException(name, rejection.state(), rejection.retryAfterMs());
            }
            try {
                return fallback.call();
            } catch (Exception e) {
                throw new CircuitOpenException(name, rejection.state(), rejection.retryAfterMs(), e);
            }
        }
        T result;
        try {
            result = timeLimiter.call(operation, config.callTimeoutMs(), "circuit " + name);
        } catch (Exception e) {
            recordFailure(e);
            throw e;
        } catch (Error e) {
            recordFailure(e);
            throw e;
        }
        recordSuccess();
        return result;
    }

    public CircuitState state() {
        synchronized (this) {
            return state;
        }
    }

    public CircuitMetrics metrics() {
        synchronized (this) {
            long now = clock.millis();
            pruneWindow(now);
            return snapshot();
        }
    }

    public CircuitHealth healthStatus() {
        synchronized (this) {
            long now = clock.millis();
            pruneWindow(now);
            CircuitMetrics metrics = snapshot();
            long sinceLastSuccess = lastSuccessTimeMs == null ? 0L : now - lastSuccessTimeMs;
            return new CircuitHealth(
                    name,
                    state,
                    state != CircuitState.OPEN,
                    metrics.windowErrorPercentage(),
                    sinceLastSuccess,
                    metrics
            );
        }
    }

    /**
     * Drops rolling-window entries that fell out of the window.
     */
    public void cleanupWindow() {
        synchronized (this) {
            pruneWindow(clock.millis());
        }
    }

    public void forceState(CircuitState target) {
        Objects.requireNonNull(target, "target");
        log.warn("Forcing circuit {} to {}", name, target);
        Transition transition;
        synchronized (this) {
            transition = transitionTo(target, clock.millis());
        }
        fire(transition);
    }

    public void reset() {
        synchronized (this) {
            state = CircuitState.CLOSED;
            nextAttemptTimeMs = 0L;
            totalCalls = 0L;
            successfulCalls = 0L;
            failedCalls = 0L;
            rejectedCalls = 0L;
            consecutiveFailures = 0;
            consecutiveSuccesses = 0;
            lastFailureTimeMs = null;
            lastSuccessTimeMs = null;
            stateChangeCount = 0L;
            halfOpenPermits = 0;
            window.clear();
        }
        log.info("Circuit {} reset", name);
    }

    private Rejection tryAcquire() {
        Transition transition = null;
        Rejection rejection = null;
        synchronized (this) {
            long now = clock.millis();
            pruneWindow(now);
            switch (state) {
                case CLOSED -> {
                }
                case OPEN -> {
                    if (now >= nextAttemptTimeMs) {
                        transition = transitionTo(CircuitState.HALF_OPEN, now);
                        halfOpenPermits++;
                    } else {
                        rejection = new Rejection(CircuitState.OPEN, nextAttemptTimeMs - now);
                    }
                }
                case HALF_OPEN -> {
                    if (halfOpenPermits < config.successThreshold()) {
                        halfOpenPermits++;
                    } else {
                        rejection = new Rejection(CircuitState.HALF_OPEN, 0L);
                    }
                }
            }
            if (rejection != null) {
                totalCalls++;
                rejectedCalls++;
            }
        }
        fire(transition);
        return rejection;
    }

    private void recordSuccess() {
        Transition transition = null;
        synchronized (this) {
            long now = clock.millis();
            totalCalls++;
            successfulCalls++;
            lastSuccessTimeMs = now;
            consecutiveSuccesses++;
            consecutiveFailures = 0;
            window.addLast(new Outcome(now, true));
            if (state == CircuitState.HALF_OPEN && consecutiveSuccesses >= config.successThreshold()) {
                transition = transitionTo(CircuitState.CLOSED, now);
            }
        }
        fire(transition);
    }

    private void recordFailure(Throwable error) {
        Transition transition = null;
        synchronized (this) {
            long now = clock.millis();
            totalCalls++;
            failedCalls++;
            lastFailureTimeMs = now;
            consecutiveFailures++;
            consecutiveSuccesses = 0;
            window.addLast(new Outcome(now, false));
            switch (state) {
                case CLOSED -> {
                    if (shouldOpen(now)) {
                        transition = transitionTo(CircuitState.OPEN, now);
                    }
                }
                case HALF_OPEN -> transition = transitionTo(CircuitState.OPEN, now);
                case OPEN -> nextAttemptTimeMs = now + config.timeoutMs();
            }
        }
        log.debug("Circuit {} recorded failure: {}", name, error.toString());
        fire(transition);
    }

    private void recordProbeSuccess() {
        Transition transition = null;
        synchronized (this) {
            if (state != CircuitState.HALF_OPEN) {
                return;
            }
            long now = clock.millis();
            consecutiveSuccesses++;
            consecutiveFailures = 0;
            lastSuccessTimeMs = now;
            if (consecutiveSuccesses >= config.successThreshold()) {
                transition = transitionTo(CircuitState.CLOSED, now);
            }
        }
        fire(transition);
    }

    private boolean shouldOpen(long now) {
        if (consecutiveFailures >= config.failureThreshold()) {
            return true;
        }
        pruneWindow(now);
        if (window.size() < config.volumeThreshold()) {
            return false;
        }
        return errorPercentage() >= config.errorPercentageThreshold();
    }

    // Caller holds the monitor.
    private Transition transitionTo(CircuitState target, long now) {
        if (!transitioning.compareAndSet(false, true)) {
            return null;
        }
        try {
            CircuitState from = state;
            if (from == target) {
                return null;
            }
            state = target;
            stateChangeCount++;
            switch (target) {
                case OPEN -> {
                    nextAttemptTimeMs = now + config.timeoutMs();
                    consecutiveSuccesses = 0;
                    halfOpenPermits = 0;
                    log.warn("Circuit {} OPENED after {} consecutive failures", name, consecutiveFailures);
                }
                case HALF_OPEN -> {
                    halfOpenPermits = 0;
                    consecutiveSuccesses = 0;
                    log.info("Circuit {} HALF-OPEN", name);
                }
                case CLOSED -> {
                    consecutiveFailures = 0;
                    halfOpenPermits = 0;
                    window.clear();
                    log.info("Circuit {} CLOSED", name);
                }
            }
            return new Transition(from, target);
        } finally {
            transitioning.set(false);
        }
    }

    private void fire(Transition transition) {
        if (transition == null) {
            return;
        }
        try {
            listener.onStateChange(name, transition.from(), transition.to());
        } catch (RuntimeException e) {
            log.error("State change handler failed for circuit {}", name, e);
        }
        if (transition.to() == CircuitState.HALF_OPEN) {
            triggerProbe();
        }
    }

    private void triggerProbe() {
        if (healthProbe == null || !probeInProgress.compareAndSet(false, true)) {
            return;
        }
        try {
            probeExecutor.execute(() -> {
                try {
                    if (Boolean.TRUE.equals(healthProbe.call())) {
                        recordProbeSuccess();
                    }
                } catch (Exception e) {
                    log.debug("Health probe for circuit {} failed: {}", name, e.toString());
                } finally {
                    probeInProgress.set(false);
                }
            });
        } catch (RuntimeException e) {
            probeInProgress.set(false);
            log.warn("Could not schedule health probe for circuit {}", name, e);
        }
    }

    private void pruneWindow(long now) {
        long windowStart = now - config.rollingWindowMs();
        while (!window.isEmpty() && window.peekFirst().timestampMs() < windowStart) {
            window.removeFirst();
        }
    }

    private double errorPercentage() {
        if (window.isEmpty()) {
            return 0.0;
        }
        int failures = 0;
        for (Outcome outcome : window) {
            if (!outcome.success()) {
                failures++;
            }
        }
        return failures * 100.0 / window.size();
    }

    private CircuitMetrics snapshot() {
        return new CircuitMetrics(
                state,
                totalCalls,
                successfulCalls,
                failedCalls,
                rejectedCalls,
                consecutiveFailures,
                consecutiveSuccesses,
                lastFailureTimeMs,
                lastSuccessTimeMs,
                stateChangeCount,
                halfOpenPermits,
                window.size(),
                errorPercentage(),
                state == CircuitState.OPEN ? nextAttemptTimeMs : 0L
        );
    }

    private record Outcome(long timestampMs, boolean success) {
    }

    private record Rejection(CircuitState state, long retryAfterMs) {
    }

    private record Transition(CircuitState from, CircuitState to) {
    }
}
