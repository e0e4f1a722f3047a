package io.agentguard.runtime;

import io.agentguard.error.OperationTimeoutException;
import io.agentguard.util.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs named shutdown handlers in priority order (lowest first). Each handler is
 * bounded by its own timeout and the whole sequence by an overall deadline;
 * handlers that do not get a chance before the deadline are reported as skipped.
 * Only the first call to {@link #shutdown(String)} runs the sequence.
 */
public final class ShutdownCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ShutdownCoordinator.class);
    public static final long DEFAULT_HANDLER_TIMEOUT_MS = 5_000L;
    public static final long DEFAULT_MAX_SHUTDOWN_MS = 30_000L;

    private final long maxShutdownMs;
    private final Clock clock;
    private final TimeLimiter timeLimiter;
    private final List<Handler> handlers = new ArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile ShutdownOutcome outcome;

    public ShutdownCoordinator() {
        this(DEFAULT_MAX_SHUTDOWN_MS, Clock.systemUTC(), TimeLimiter.shared());
    }

    public ShutdownCoordinator(long maxShutdownMs, Clock clock, TimeLimiter timeLimiter) {
        if (maxShutdownMs < 1L) {
            throw new IllegalArgumentException("maxShutdownMs must be at least 1");
        }
        this.maxShutdownMs = maxShutdownMs;
        this.clock = clock;
        this.timeLimiter = timeLimiter;
    }

    public void register(String name, int priority, Step step) {
        register(name, priority, DEFAULT_HANDLER_TIMEOUT_MS, step);
    }

    public synchronized void register(String name, int priority, long timeoutMs, Step step) {
        if (name == null || name.isBlank() || step == null) {
            throw new IllegalArgumentException("Invalid shutdown handler");
        }
        handlers.removeIf(h -> h.name().equals(name));
        handlers.add(new Handler(name, priority, Math.max(1L, timeoutMs), step));
        handlers.sort(Comparator.comparingInt(Handler::priority));
        log.debug("Registered shutdown handler {} (priority: {})", name, priority);
    }

    public synchronized boolean unregister(String name) {
        return handlers.removeIf(h -> h.name().equals(name));
    }

    public boolean isShuttingDown() {
        return started.get();
    }

    /**
     * Result of the completed sequence, or null while it has not run.
     */
    public ShutdownOutcome outcome() {
        return outcome;
    }

    public ShutdownOutcome shutdown(String reason) {
        if (!started.compareAndSet(false, true)) {
            log.debug("Shutdown already requested");
            return outcome;
        }
        List<Handler> ordered;
        synchronized (this) {
            ordered = new ArrayList<>(handlers);
        }
        log.info("Shutting down: {}", reason);
        long startMs = clock.millis();
        long deadline = startMs + maxShutdownMs;
        List<String> completed = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (Handler handler : ordered) {
            long remaining = deadline - clock.millis();
            if (remaining <= 0L) {
                skipped.add(handler.name());
                continue;
            }
            long budget = Math.min(handler.timeoutMs(), remaining);
            try {
                timeLimiter.call(() -> {
                    handler.step().run();
                    return null;
                }, budget, "shutdown handler " + handler.name());
                completed.add(handler.name());
            } catch (OperationTimeoutException e) {
                failed.add(handler.name());
                log.error("Shutdown handler {} timed out after {}ms", handler.name(), budget);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failed.add(handler.name());
                log.error("Shutdown interrupted during {}", handler.name());
            } catch (Exception e) {
                failed.add(handler.name());
                log.error("Shutdown handler {} failed", handler.name(), e);
            }
        }
        if (!skipped.isEmpty()) {
            log.error("Maximum shutdown time of {}ms exceeded; skipped {}", maxShutdownMs, skipped);
        }
        long durationMs = clock.millis() - startMs;
        ShutdownOutcome result = new ShutdownOutcome(reason, failed.isEmpty() && skipped.isEmpty(),
                durationMs, List.copyOf(completed), List.copyOf(failed), List.copyOf(skipped));
        outcome = result;
        log.info("Shutdown completed in {}ms ({} ok, {} failed, {} skipped)",
                durationMs, completed.size(), failed.size(), skipped.size());
        return result;
    }

    @FunctionalInterface
    public interface Step {
        void run() throws Exception;
    }

    private record Handler(String name, int priority, long timeoutMs, Step step) {
    }

    public record ShutdownOutcome(
            String reason,
            boolean clean,
            long durationMs,
            List<String> completed,
            List<String> failed,
            List<String> skipped
    ) {
    }
}
