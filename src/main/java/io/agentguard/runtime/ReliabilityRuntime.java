package io.agentguard.runtime;

import io.agentguard.agent.AgentRegistry;
import io.agentguard.agent.AgentTask;
import io.agentguard.agent.ScriptAgent;
import io.agentguard.circuit.CircuitBreakerRegistry;
import io.agentguard.circuit.CircuitHealth;
import io.agentguard.circuit.CircuitMetrics;
import io.agentguard.circuit.CircuitOpenException;
import io.agentguard.circuit.CircuitState;
import io.agentguard.config.GuardConfig;
import io.agentguard.config.ReliabilitySettings;
import io.agentguard.dlq.DeadLetterMessage;
import io.agentguard.dlq.DeadLetterMetrics;
import io.agentguard.dlq.DeadLetterQueue;
import io.agentguard.dlq.FileDeadLetterStore;
import io.agentguard.dlq.ProcessOutcome;
import io.agentguard.health.AggregatedHealth;
import io.agentguard.health.HealthCheckService;
import io.agentguard.health.HealthChecks;
import io.agentguard.health.HealthStatus;
import io.agentguard.observability.JournalEvent;
import io.agentguard.observability.JsonlEventJournal;
import io.agentguard.observability.LoggingNotifier;
import io.agentguard.observability.Notifier;
import io.agentguard.observability.PrometheusFormatter;
import io.agentguard.ratelimit.RateLimitMetrics;
import io.agentguard.ratelimit.RateLimitedException;
import io.agentguard.ratelimit.RateLimiter;
import io.agentguard.ratelimit.SqliteAdmissionStore;
import io.agentguard.retry.RetryExhaustedException;
import io.agentguard.retry.RetryMetrics;
import io.agentguard.retry.Sleeper;
import io.agentguard.util.Jsons;
import io.agentguard.util.Threads;
import io.agentguard.util.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Builds every reliability component from a data root and its settings file, and
 * exposes the operations the CLI needs.
 */
public final class ReliabilityRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReliabilityRuntime.class);
    private static final long DEFAULT_SCRIPT_TIMEOUT_MS = 60_000L;
    private static final int SCHEDULER_THREADS = 2;

    private final GuardConfig config;
    private final Clock clock;
    private final ReliabilitySettings settings;
    private final JsonlEventJournal journal;
    private final Notifier notifier;
    private final CircuitBreakerRegistry circuits;
    private final SqliteAdmissionStore admissionStore;
    private final RateLimiter<String> rateLimiter;
    private final DeadLetterQueue deadLetters;
    private final OperationGuard guard;
    private final AgentRegistry agents;
    private final AgentDispatcher dispatcher;
    private final HealthCheckService health;
    private final ShutdownCoordinator shutdown;
    private ScheduledExecutorService scheduler;

    public ReliabilityRuntime(GuardConfig config) {
        this(config, Clock.systemUTC(), new LoggingNotifier(), Sleeper.SYSTEM);
    }

    public ReliabilityRuntime(GuardConfig config, Clock clock, Notifier notifier, Sleeper sleeper) {
        this.config = config;
        this.clock = clock;
        this.notifier = notifier == null ? Notifier.NOOP : notifier;
        this.settings = ReliabilitySettings.load(config.settingsFile());
        this.journal = new JsonlEventJournal(config.journalFile(), "agentguard", clock);
        TimeLimiter timeLimiter = TimeLimiter.shared();
        this.circuits = new CircuitBreakerRegistry(settings.circuitConfig(), clock, timeLimiter, this.notifier, journal);
        this.admissionStore = settings.rateLimitDistributed() ? new SqliteAdmissionStore(config.admissionDbFile()) : null;
        this.rateLimiter = new RateLimiter<>(
                "dispatch",
                settings.rateLimitConfig(),
                agentId -> agentId,
                clock,
                admissionStore,
                (key, retryAfterMs) -> log.warn("Dispatch limit reached for {}; retry after {}ms", key, retryAfterMs),
                journal
        );
        this.deadLetters = new DeadLetterQueue(
                GuardConfig.DEFAULT_QUEUE_NAME,
                settings.deadLetterConfig(),
                new FileDeadLetterStore(config.dlqRoot()),
                clock,
                this.notifier,
                journal
        );
        this.guard = new OperationGuard(rateLimiter, circuits, settings.retryConfig(), deadLetters, clock, sleeper, timeLimiter);
        this.agents = AgentRegistry.withBuiltins();
        this.dispatcher = new AgentDispatcher(agents, guard);
        this.health = new HealthCheckService(settings.healthConfig(), clock, timeLimiter, this.notifier, journal, null);
        health.registerCheck(HealthChecks.memory());
        health.registerCheck(HealthChecks.diskSpace(config.rootDir(), settings.minFreeDiskBytes()));
        health.registerCheck(HealthChecks.circuitBreakers(circuits));
        health.registerCheck(HealthChecks.deadLetterQueue(deadLetters, settings.dlqBacklogThreshold()));
        this.shutdown = new ShutdownCoordinator(ShutdownCoordinator.DEFAULT_MAX_SHUTDOWN_MS, clock, timeLimiter);
        shutdown.register("stop-health-checks", 0, health::stop);
        shutdown.register("stop-dead-letter-processing", 1, deadLetters::stop);
        shutdown.register("stop-rate-limit-sweep", 2, rateLimiter::close);
        shutdown.register("stop-circuit-cleanup", 2, circuits::close);
        shutdown.register("stop-scheduler", 3, this::stopScheduler);
    }

    /**
     * Creates the data directories, loads script agents and restores persisted
     * dead letters.
     */
    public InitOutcome init() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.dlqRoot());
            Files.createDirectories(config.agentsRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to create data directories under: " + config.rootDir(), e);
        }
        if (admissionStore != null) {
            admissionStore.init();
            int purged = admissionStore.purgeExpired(clock.millis());
            if (purged > 0) {
                log.debug("Purged {} expired admission counters", purged);
            }
        }
        int scripts = registerConfiguredScriptAgents();
        int restored = deadLetters.restore();
        return new InitOutcome(
                config.rootDir().toString(),
                config.settingsFile().toString(),
                Files.exists(config.settingsFile()),
                scripts,
                restored
        );
    }

    /**
     * Starts every background timer: window cleanup, rate-limit sweep, dead
     * letter processing and health polling.
     */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Threads.scheduler("agentguard-timer", SCHEDULER_THREADS);
        circuits.start(scheduler);
        rateLimiter.start(scheduler);
        deadLetters.start(scheduler);
        health.start(scheduler);
        log.info("Reliability runtime started at {}", config.rootDir());
    }

    public DispatchOutcome dispatch(String agentId, String payload, boolean critical) {
        if (agentId == null || agentId.isBlank() || agents.findById(agentId).isEmpty()) {
            return new DispatchOutcome(null, agentId, false, null, "Unknown agent: " + agentId, "invalid", false, 0L);
        }
        AgentTask task = new AgentTask(null, agentId, payload, critical);
        try {
            String output = dispatcher.dispatch(task);
            return new DispatchOutcome(task.taskId(), agentId, true, output, null, null, false, 0L);
        } catch (RateLimitedException e) {
            return new DispatchOutcome(task.taskId(), agentId, false, null, e.getMessage(), "rate_limited", false, e.retryAfterMs());
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            long retryAfter = e instanceof CircuitOpenException ? ((CircuitOpenException) e).retryAfterMs() : 0L;
            return new DispatchOutcome(task.taskId(), agentId, false, null, e.getMessage(), errorType(e),
                    OperationGuard.shouldDeadLetter(e), retryAfter);
        }
    }

    public List<DeadLetterMessage> deadLetters(int limit) {
        List<DeadLetterMessage> all = deadLetters.messages();
        return all.size() <= limit ? all : all.subList(0, Math.max(0, limit));
    }

    public ReplayOutcome replayDeadLetter(String messageId) {
        try {
            ProcessOutcome outcome = deadLetters.retryMessage(messageId);
            return new ReplayOutcome(messageId, outcome == ProcessOutcome.RECOVERED, outcome.name().toLowerCase());
        } catch (IllegalArgumentException e) {
            return new ReplayOutcome(messageId, false, "not_found");
        }
    }

    public ReplayBatchOutcome replayDeadLetters(int limit) {
        List<ReplayOutcome> details = new ArrayList<>();
        int recovered = 0;
        for (DeadLetterMessage message : deadLetters(limit)) {
            ReplayOutcome outcome = replayDeadLetter(message.id());
            if (outcome.recovered()) {
                recovered++;
            }
            details.add(outcome);
        }
        return new ReplayBatchOutcome(details.size(), recovered, details.size() - recovered, details);
    }

    /**
     * Removes one message, or every message when {@code messageId} is null.
     */
    public PurgeOutcome purgeDeadLetters(String messageId) {
        int removed;
        if (messageId == null || messageId.isBlank()) {
            removed = deadLetters.clear();
        } else {
            removed = deadLetters.discard(messageId) ? 1 : 0;
        }
        journal.record(JournalEvent.of("dlq.purge", "dlq/" + deadLetters.name(), "ok",
                Map.of("removed", removed, "target", messageId == null ? "*" : messageId)));
        return new PurgeOutcome(removed);
    }

    public DeadExportOutcome exportDeadLetters(String outputPath) {
        Path output = Paths.get(outputPath).toAbsolutePath().normalize();
        String state = deadLetters.exportState();
        try {
            Files.createDirectories(output.getParent() == null ? Paths.get(".") : output.getParent());
            Files.writeString(output, state, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to export dead letters: " + output, e);
        }
        return new DeadExportOutcome(deadLetters.size(), output.toString());
    }

    /**
     * Runs every health check once and returns the aggregate.
     */
    public AggregatedHealth health() {
        return health.performAllChecks();
    }

    public String healthReport() {
        health.performAllChecks();
        return health.exportHealthReport();
    }

    public StatsOutcome stats() {
        Map<String, CircuitMetrics> circuitMetrics = new LinkedHashMap<>();
        for (Map.Entry<String, CircuitHealth> e : circuits.snapshot().entrySet()) {
            circuitMetrics.put(e.getKey(), e.getValue().metrics());
        }
        Map<String, Integer> states = new LinkedHashMap<>();
        for (Map.Entry<CircuitState, Integer> e : circuits.countByState().entrySet()) {
            states.put(e.getKey().name().toLowerCase(), e.getValue());
        }
        return new StatsOutcome(
                circuitMetrics,
                states,
                guard.retryMetrics(),
                rateLimiter.metrics(),
                deadLetters.metrics(),
                health.health().overall(),
                config.rootDir().toFile().getUsableSpace(),
                journal.writeFailures(),
                clock.instant().toString()
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(stats());
    }

    public ReliabilitySettings settings() {
        return settings;
    }

    /**
     * Writes the current settings to the settings file unless one already exists.
     */
    public SettingsWriteOutcome writeDefaultSettings() {
        Path file = config.settingsFile();
        if (Files.exists(file)) {
            return new SettingsWriteOutcome(file.toString(), false);
        }
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, Jsons.toJson(settings), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write settings: " + file, e);
        }
        return new SettingsWriteOutcome(file.toString(), true);
    }

    public JsonlEventJournal.IntegrityOutcome verifyJournal() {
        return journal.verify();
    }

    public GuardConfig config() {
        return config;
    }

    public CircuitBreakerRegistry circuits() {
        return circuits;
    }

    public RateLimiter<String> rateLimiter() {
        return rateLimiter;
    }

    public DeadLetterQueue deadLetterQueue() {
        return deadLetters;
    }

    public HealthCheckService healthService() {
        return health;
    }

    public AgentRegistry agents() {
        return agents;
    }

    public JsonlEventJournal journal() {
        return journal;
    }

    public ShutdownCoordinator shutdownCoordinator() {
        return shutdown;
    }

    @Override
    public void close() {
        shutdown.shutdown("runtime closed");
    }

    private synchronized void stopScheduler() {
        if (scheduler != null) {
            Threads.shutdown(scheduler, 1_000L);
            scheduler = null;
        }
    }

    private int registerConfiguredScriptAgents() {
        Path cfg = config.scriptAgentsFile();
        if (!Files.exists(cfg)) {
            return 0;
        }
        ScriptAgentFile file;
        try {
            file = Jsons.mapper().readValue(cfg.toFile(), ScriptAgentFile.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load script agent config: " + cfg, e);
        }
        if (file == null || file.agents() == null) {
            return 0;
        }
        int loaded = 0;
        int skipped = 0;
        for (ScriptAgentDefinition definition : file.agents()) {
            if (definition == null || definition.id() == null || definition.id().isBlank()
                    || definition.command() == null || definition.command().isEmpty()) {
                skipped++;
                continue;
            }
            try {
                long timeoutMs = definition.timeoutMs() == null ? DEFAULT_SCRIPT_TIMEOUT_MS : definition.timeoutMs();
                agents.register(new ScriptAgent(definition.id(), resolveScriptCommand(definition.command()), timeoutMs));
                loaded++;
            } catch (IllegalArgumentException e) {
                skipped++;
                log.warn("Skipping script agent {}: {}", definition.id(), e.getMessage());
            }
        }
        journal.record(JournalEvent.of("agent.script.load", "runtime/agents", "ok",
                Map.of("config", cfg.toString(), "loaded", loaded, "skipped", skipped)));
        return loaded;
    }

    private List<String> resolveScriptCommand(List<String> rawCommand) {
        List<String> resolved = new ArrayList<>(rawCommand.size());
        for (String token : rawCommand) {
            if (token == null || token.isBlank()) {
                continue;
            }
            Path candidate = config.rootDir().resolve(token).normalize();
            resolved.add(Files.exists(candidate) ? candidate.toString() : token);
        }
        if (resolved.isEmpty()) {
            throw new IllegalArgumentException("script command became empty after normalization");
        }
        return resolved;
    }

    private static String errorType(Exception e) {
        if (e instanceof CircuitOpenException) {
            return "circuit_open";
        }
        if (e instanceof RetryExhaustedException) {
            return "retries_exhausted";
        }
        return "failed";
    }

    record ScriptAgentFile(List<ScriptAgentDefinition> agents) {
    }

    record ScriptAgentDefinition(String id, List<String> command, Long timeoutMs) {
    }

    public record InitOutcome(
            String rootDir,
            String settingsFile,
            boolean settingsFileExists,
            int scriptAgentsLoaded,
            int deadLettersRestored
    ) {
    }

    public record DispatchOutcome(
            String taskId,
            String agentId,
            boolean success,
            String output,
            String error,
            String errorType,
            boolean deadLettered,
            long retryAfterMs
    ) {
    }

    public record ReplayOutcome(String messageId, boolean recovered, String outcome) {
    }

    public record ReplayBatchOutcome(int total, int recovered, int notRecovered, List<ReplayOutcome> details) {
    }

    public record PurgeOutcome(int removed) {
    }

    public record DeadExportOutcome(int exported, String outputPath) {
    }

    public record SettingsWriteOutcome(String path, boolean written) {
    }

    public record StatsOutcome(
            Map<String, CircuitMetrics> circuits,
            Map<String, Integer> circuitStates,
            RetryMetrics retry,
            RateLimitMetrics rateLimit,
            DeadLetterMetrics deadLetters,
            HealthStatus health,
            long diskFreeBytes,
            long journalWriteFailures,
            String generatedAt
    ) {
    }
}
