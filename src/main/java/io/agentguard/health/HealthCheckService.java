package io.agentguard.health;

import io.agentguard.error.OperationTimeoutException;
import io.agentguard.observability.EventJournal;
import io.agentguard.observability.JournalEvent;
import io.agentguard.observability.Notification;
import io.agentguard.observability.Notifier;
import io.agentguard.util.Jsons;
import io.agentguard.util.Threads;
import io.agentguard.util.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Runs registered probes on their own schedules and folds the latest results
 * into one overall status.
 */
public final class HealthCheckService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);
    private static final Executor RECOVERY_EXECUTOR = Threads.cached("agentguard-health-recovery");

    private final HealthCheckConfig config;
    private final Clock clock;
    private final TimeLimiter timeLimiter;
    private final Notifier notifier;
    private final EventJournal journal;
    private final Executor recoveryExecutor;
    private final Map<String, CheckState> checks = new ConcurrentHashMap<>();
    private final List<Consumer<AggregatedHealth>> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean recovering = new AtomicBoolean(false);
    private volatile BiConsumer<String, HealthCheckResult> criticalFailureHandler;
    private ScheduledExecutorService scheduler;
    private boolean running;

    // Guarded by "this".
    private final Map<String, HealthCheckResult> results = new LinkedHashMap<>();
    private HealthStatus overall = HealthStatus.UNKNOWN;
    private long startTimeMs;
    private Long lastHealthyTimeMs;
    private int consecutiveFailures;

    public HealthCheckService(HealthCheckConfig config) {
        this(config, Clock.systemUTC(), TimeLimiter.shared(), Notifier.NOOP, EventJournal.NOOP, RECOVERY_EXECUTOR);
    }

    public HealthCheckService(
            HealthCheckConfig config,
            Clock clock,
            TimeLimiter timeLimiter,
            Notifier notifier,
            EventJournal journal,
            Executor recoveryExecutor
    ) {
        this.config = config == null ? HealthCheckConfig.defaults() : config;
        this.clock = clock;
        this.timeLimiter = timeLimiter;
        this.notifier = notifier == null ? Notifier.NOOP : notifier;
        this.journal = journal == null ? EventJournal.NOOP : journal;
        this.recoveryExecutor = recoveryExecutor == null ? RECOVERY_EXECUTOR : recoveryExecutor;
        this.startTimeMs = clock.millis();
    }

    public HealthCheckConfig config() {
        return config;
    }

    public void registerCheck(HealthCheck check) {
        CheckState state = new CheckState(check.resolve(config));
        CheckState previous = checks.put(check.name(), state);
        if (previous != null) {
            previous.cancel();
        }
        log.info("Registered health check {} (type: {})", check.name(), check.type());
        ScheduledExecutorService active;
        synchronized (this) {
            active = running ? scheduler : null;
        }
        if (active != null) {
            schedule(state, active);
        }
    }

    public boolean unregisterCheck(String name) {
        CheckState state = checks.remove(name);
        if (state == null) {
            return false;
        }
        state.cancel();
        synchronized (this) {
            results.remove(name);
        }
        log.info("Unregistered health check {}", name);
        reaggregate();
        return true;
    }

    public List<String> checkNames() {
        return new ArrayList<>(checks.keySet());
    }

    /**
     * Schedules every registered check and runs one immediate pass.
     */
    public void start(ScheduledExecutorService scheduler) {
        synchronized (this) {
            if (running) {
                log.warn("Health check service already running");
                return;
            }
            running = true;
            this.scheduler = scheduler;
            startTimeMs = clock.millis();
        }
        log.info("Starting health monitoring with {} checks", checks.size());
        for (CheckState state : checks.values()) {
            schedule(state, scheduler);
        }
    }

    public void stop() {
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            scheduler = null;
        }
        for (CheckState state : checks.values()) {
            state.cancel();
        }
        log.info("Stopped health monitoring");
    }

    @Override
    public void close() {
        stop();
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public AggregatedHealth performAllChecks() {
        for (CheckState state : new ArrayList<>(checks.values())) {
            performCheck(state);
        }
        return health();
    }

    /**
     * Runs one check right away, outside its schedule.
     */
    public Optional<HealthCheckResult> runCheck(String name) {
        CheckState state = checks.get(name);
        if (state == null) {
            return Optional.empty();
        }
        performCheck(state);
        return checkResult(name);
    }

    public synchronized AggregatedHealth health() {
        long now = clock.millis();
        return new AggregatedHealth(overall, results, now, Math.max(0L, now - startTimeMs), lastHealthyTimeMs, consecutiveFailures);
    }

    public synchronized Optional<HealthCheckResult> checkResult(String name) {
        return Optional.ofNullable(results.get(name));
    }

    /**
     * Subscribes to overall status changes. Closing the returned handle unsubscribes.
     */
    public Subscription onHealthChange(Consumer<AggregatedHealth> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void setCriticalFailureHandler(BiConsumer<String, HealthCheckResult> handler) {
        this.criticalFailureHandler = handler;
    }

    public String exportHealthReport() {
        AggregatedHealth health = health();
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map.Entry<String, HealthCheckResult> e : health.checks().entrySet()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("name", e.getKey());
            row.put("status", e.getValue().status());
            row.put("message", e.getValue().message());
            row.put("details", e.getValue().details());
            row.put("durationMs", e.getValue().durationMs());
            row.put("timestamp", Instant.ofEpochMilli(e.getValue().timestampMs()).toString());
            rows.add(row);
        }
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("timestamp", Instant.ofEpochMilli(health.timestampMs()).toString());
        report.put("overall", health.overall());
        report.put("uptimeMs", health.uptimeMs());
        report.put("consecutiveFailures", health.consecutiveFailures());
        report.put("checks", rows);
        return Jsons.toJson(report);
    }

    private void schedule(CheckState state, ScheduledExecutorService scheduler) {
        state.cancel();
        long interval = state.check.intervalMs();
        state.task = scheduler.scheduleWithFixedDelay(() -> {
            try {
                performCheck(state);
            } catch (RuntimeException e) {
                log.error("Health check {} failed unexpectedly", state.check.name(), e);
            }
        }, 0L, interval, TimeUnit.MILLISECONDS);
    }

    private void performCheck(CheckState state) {
        HealthCheck check = state.check;
        long start = clock.millis();
        HealthCheckResult result;
        try {
            result = timeLimiter.call(check.probe()::check, check.timeoutMs(), "health check " + check.name());
            if (result == null) {
                result = HealthCheckResult.unhealthy("Check returned no result");
            }
        } catch (OperationTimeoutException e) {
            result = HealthCheckResult.unhealthy("Health check timed out after " + e.timeoutMs() + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Health check {} interrupted", check.name());
            return;
        } catch (Exception e) {
            result = HealthCheckResult.unhealthy("Check failed: " + (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
        }
        long end = clock.millis();
        handleResult(state, result.withTiming(end, end - start));
    }

    private void handleResult(CheckState state, HealthCheckResult result) {
        String name = state.check.name();
        boolean critical = false;
        HealthStatus previousStatus;
        synchronized (this) {
            if (checks.get(name) != state) {
                return;
            }
            HealthCheckResult previous = results.put(name, result);
            previousStatus = previous == null ? HealthStatus.UNKNOWN : previous.status();
            if (result.status() == HealthStatus.UNHEALTHY) {
                state.consecutiveFailures++;
                critical = state.check.critical()
                        && config.alertOnCriticalFailure()
                        && state.consecutiveFailures > state.check.retries();
            } else {
                state.consecutiveFailures = 0;
                if (result.status() == HealthStatus.HEALTHY) {
                    lastHealthyTimeMs = result.timestampMs();
                }
            }
        }
        if (previousStatus != result.status()) {
            log.info("Health check {}: {} -> {}", name, previousStatus, result.status());
        }
        if (critical) {
            handleCriticalFailure(name, result);
        }
        reaggregate();
    }

    private void reaggregate() {
        AggregatedHealth snapshot;
        HealthStatus previous;
        synchronized (this) {
            List<AggregationStrategy.Sample> samples = new ArrayList<>(results.size());
            for (Map.Entry<String, HealthCheckResult> e : results.entrySet()) {
                CheckState state = checks.get(e.getKey());
                double weight = state == null ? 1.0 : state.check.weight();
                samples.add(new AggregationStrategy.Sample(e.getValue().status(), weight));
            }
            previous = overall;
            overall = config.aggregationStrategy().aggregate(samples);
            consecutiveFailures = overall == HealthStatus.UNHEALTHY ? consecutiveFailures + 1 : 0;
            if (previous == overall) {
                return;
            }
            snapshot = health();
        }
        log.info("Overall health: {} -> {}", previous, snapshot.overall());
        journal.record(JournalEvent.of("health.change", "health", snapshot.overall().name(),
                Map.of("from", previous.name(), "to", snapshot.overall().name(), "checks", snapshot.checks().size())));
        for (Consumer<AggregatedHealth> listener : listeners) {
            try {
                listener.accept(snapshot);
            } catch (RuntimeException e) {
                log.error("Health change listener failed", e);
            }
        }
        if (config.autoRecovery() && snapshot.overall() != HealthStatus.HEALTHY) {
            scheduleRecovery();
        }
    }

    private void handleCriticalFailure(String name, HealthCheckResult result) {
        log.error("Critical health check failure: {} ({})", name, result.message());
        notifier.notify(Notification.error("Critical health check failed: " + name
                + (result.message() == null ? "" : " (" + result.message() + ")"), "View Details"));
        BiConsumer<String, HealthCheckResult> handler = criticalFailureHandler;
        if (handler != null) {
            try {
                handler.accept(name, result);
            } catch (RuntimeException e) {
                log.error("Critical failure handler failed for {}", name, e);
            }
        }
    }

    private void scheduleRecovery() {
        if (!recovering.compareAndSet(false, true)) {
            return;
        }
        try {
            recoveryExecutor.execute(() -> {
                try {
                    attemptRecovery();
                } finally {
                    recovering.set(false);
                }
            });
        } catch (RuntimeException e) {
            recovering.set(false);
            log.error("Failed to schedule health auto-recovery", e);
        }
    }

    private void attemptRecovery() {
        List<String> unhealthy = new ArrayList<>();
        synchronized (this) {
            for (Map.Entry<String, HealthCheckResult> e : results.entrySet()) {
                if (e.getValue().status() == HealthStatus.UNHEALTHY) {
                    unhealthy.add(e.getKey());
                }
            }
        }
        if (unhealthy.isEmpty()) {
            return;
        }
        log.info("Attempting auto-recovery for {}", unhealthy);
        for (String name : unhealthy) {
            CheckState state = checks.get(name);
            if (state == null) {
                continue;
            }
            performCheck(state);
            Optional<HealthCheckResult> after = checkResult(name);
            if (after.isPresent() && after.get().status() == HealthStatus.UNHEALTHY) {
                log.warn("Health check {} still unhealthy after recovery attempt", name);
            }
        }
    }

    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    private static final class CheckState {
        private final HealthCheck check;
        private int consecutiveFailures;
        private volatile ScheduledFuture<?> task;

        private CheckState(HealthCheck check) {
            this.check = check;
        }

        private void cancel() {
            ScheduledFuture<?> current = task;
            if (current != null) {
                current.cancel(false);
                task = null;
            }
        }
    }
}
