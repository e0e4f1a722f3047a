package io.agentguard.circuit;

import io.agentguard.observability.EventJournal;
import io.agentguard.observability.JournalEvent;
import io.agentguard.observability.Notification;
import io.agentguard.observability.Notifier;
import io.agentguard.util.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Lazily creates one breaker per key from a shared configuration and keeps the
 * rolling windows trimmed on a fixed schedule.
 */
public final class CircuitBreakerRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);
    static final long WINDOW_CLEANUP_INTERVAL_MS = 10_000L;

    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final TimeLimiter timeLimiter;
    private final Notifier notifier;
    private final EventJournal journal;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private ScheduledFuture<?> cleanupTask;

    public CircuitBreakerRegistry(CircuitBreakerConfig config) {
        this(config, Clock.systemUTC(), TimeLimiter.shared(), Notifier.NOOP, EventJournal.NOOP);
    }

    public CircuitBreakerRegistry(
            CircuitBreakerConfig config,
            Clock clock,
            TimeLimiter timeLimiter,
            Notifier notifier,
            EventJournal journal
    ) {
        this.config = config;
        this.clock = clock;
        this.timeLimiter = timeLimiter;
        this.notifier = notifier == null ? Notifier.NOOP : notifier;
        this.journal = journal == null ? EventJournal.NOOP : journal;
    }

    public CircuitBreaker breaker(String key) {
        return breakers.computeIfAbsent(key, this::create);
    }

    public Optional<CircuitBreaker> find(String key) {
        return Optional.ofNullable(breakers.get(key));
    }

    public Collection<CircuitBreaker> all() {
        return breakers.values();
    }

    public boolean remove(String key) {
        return breakers.remove(key) != null;
    }

    public boolean reset(String key) {
        CircuitBreaker breaker = breakers.get(key);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }

    public void resetAll() {
        for (CircuitBreaker breaker : breakers.values()) {
            breaker.reset();
        }
    }

    public Map<String, CircuitHealth> snapshot() {
        Map<String, CircuitHealth> out = new TreeMap<>();
        for (Map.Entry<String, CircuitBreaker> e : breakers.entrySet()) {
            out.put(e.getKey(), e.getValue().healthStatus());
        }
        return out;
    }

    public Map<CircuitState, Integer> countByState() {
        Map<CircuitState, Integer> out = new LinkedHashMap<>();
        for (CircuitState state : CircuitState.values()) {
            out.put(state, 0);
        }
        for (CircuitBreaker breaker : breakers.values()) {
            out.merge(breaker.state(), 1, Integer::sum);
        }
        return out;
    }

    public synchronized void start(ScheduledExecutorService scheduler) {
        if (cleanupTask != null) {
            return;
        }
        cleanupTask = scheduler.scheduleWithFixedDelay(
                this::cleanupWindows,
                WINDOW_CLEANUP_INTERVAL_MS,
                WINDOW_CLEANUP_INTERVAL_MS,
                TimeUnit.MILLISECONDS
        );
    }

    void cleanupWindows() {
        for (CircuitBreaker breaker : breakers.values()) {
            breaker.cleanupWindow();
        }
    }

    @Override
    public synchronized void close() {
        if (cleanupTask != null) {
            cleanupTask.cancel(false);
            cleanupTask = null;
        }
    }

    private CircuitBreaker create(String key) {
        log.debug("Creating circuit breaker for {}", key);
        return new CircuitBreaker(key, config, clock, timeLimiter, this::onStateChange, null, null);
    }

    private void onStateChange(String key, CircuitState from, CircuitState to) {
        journal.record(JournalEvent.of(
                "circuit.transition",
                "circuit/" + key,
                to.name().toLowerCase(),
                Map.of("from", from.name(), "to", to.name())
        ));
        if (to == CircuitState.OPEN) {
            notifier.notify(Notification.warning("Circuit breaker opened for " + key
                    + ". Calls are rejected for " + config.timeoutMs() + "ms."));
        }
    }
}
