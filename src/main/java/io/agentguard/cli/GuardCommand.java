package io.agentguard.cli;

import io.agentguard.config.GuardConfig;
import io.agentguard.health.AggregatedHealth;
import io.agentguard.health.HealthStatus;
import io.agentguard.observability.JsonlEventJournal;
import io.agentguard.runtime.ReliabilityRuntime;
import io.agentguard.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(
        name = "agentguard",
        mixinStandardHelpOptions = true,
        description = "Reliability runtime for agent operations",
        subcommands = {
                GuardCommand.InitCommand.class,
                GuardCommand.RunCommand.class,
                GuardCommand.AgentsCommand.class,
                GuardCommand.DlqListCommand.class,
                GuardCommand.DlqReplayCommand.class,
                GuardCommand.DlqPurgeCommand.class,
                GuardCommand.DlqExportCommand.class,
                GuardCommand.HealthCommand.class,
                GuardCommand.StatsCommand.class,
                GuardCommand.MetricsCommand.class,
                GuardCommand.SettingsCommand.class,
                GuardCommand.JournalVerifyCommand.class
        }
)
public final class GuardCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = GuardConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | run | agents | dlq-list | dlq-replay | dlq-purge | dlq-export | health | stats | metrics | settings | journal-verify");
    }

    ReliabilityRuntime runtime() {
        return new ReliabilityRuntime(GuardConfig.fromRoot(root));
    }

    @Command(name = "init", description = "Create data directories and write default settings")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        GuardCommand parent;

        @Override
        public Integer call() {
            try (ReliabilityRuntime runtime = parent.runtime()) {
                runtime.writeDefaultSettings();
                ReliabilityRuntime.InitOutcome outcome = runtime.init();
                System.out.println(Jsons.toJson(outcome));
                return 0;
            }
        }
    }

    @Command(name = "run", description = "Dispatch one task to an agent through the reliability guard")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        GuardCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Target agent id")
        String agent;

        @Option(names = {"--input"}, defaultValue = "", description = "Task input payload")
        String input;

        @Option(names = {"--critical"}, defaultValue = "false", description = "Mark the task as critical")
        boolean critical;

        @Option(names = {"--serve-ms"}, defaultValue = "0",
                description = "Keep background timers running this long after dispatch")
        long serveMs;

        @Override
        public Integer call() throws Exception {
            try (ReliabilityRuntime runtime = parent.runtime()) {
                runtime.init();
                runtime.start();
                ReliabilityRuntime.DispatchOutcome outcome = runtime.dispatch(agent, input, critical);
                System.out.println(Jsons.toJson(outcome));
                if (serveMs > 0L) {
                    Thread.sleep(serveMs);
                }
                return outcome.success() ? 0 : 1;
            }
        }
    }

    @Command(name = "agents", description = "List registered agents")
    static final class AgentsCommand implements Callable<Integer> {
        @ParentCommand
        GuardCommand parent;

        @Override
        public Integer call() {
            try (ReliabilityRuntime runtime = parent.runtime()) {
                runtime.init();
                System.out.println(Jsons.toJson(runtime.agents().listAgentIds()));
                return 0;
            }
        }
    }

    @Command(name = "dlq-list", description = "List dead-lettered operations, oldest first")
    static final class DlqListCommand implements Callable<Integer> {
        @ParentCommand
        GuardCommand parent;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Maximum messages to show")
        int limit;

        @Override
        public Integer call() {
            try (ReliabilityRuntime runtime = parent.runtime()) {
                runtime.init();
                System.out.println(Jsons.toJson(runtime.deadLetters(limit)));
                return 0;
            }
        }
    }

    @Command(name = "dlq-replay", description = "Replay one dead letter, or a batch with --all")
    static final class DlqReplayCommand implements Callable<Integer> {
        @ParentCommand
        GuardCommand parent;

        @Parameters(index = "0", arity = "0..1", description = "Message id")
        String messageId;

        @Option(names = {"--all"}, defaultValue = "false", description = "Replay every queued message")
        boolean all;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Maximum messages to replay with --all")
        int limit;

        @Override
        public Integer call() {
            try (ReliabilityRuntime runtime = parent.runtime()) {
                runtime.init();
                if (all) {
                    ReliabilityRuntime.ReplayBatchOutcome outcome = runtime.replayDeadLetters(limit);
                    System.out.println(Jsons.toJson(outcome));
                    return outcome.notRecovered() == 0 ? 0 : 1;
                }
                if (messageId == null || messageId.isBlank()) {
                    System.err.println("Provide a message id or --all");
                    return 2;
                }
                ReliabilityRuntime.ReplayOutcome outcome = runtime.replayDeadLetter(messageId);
                System.out.println(Jsons.toJson(outcome));
                return outcome.recovered() ? 0 : 1;
            }
        }
    }

    @Command(name = "dlq-purge", description = "Discard one dead letter, or all of them")
    static final class DlqPurgeCommand implements Callable<Integer> {
        @ParentCommand
        GuardCommand parent;

        @Parameters(index = "0", arity = "0..1", description = "Message id; omit to purge everything")
        String messageId;

        @Override
        public Integer call() {
            try (ReliabilityRuntime runtime = parent.runtime()) {
                runtime.init();
                ReliabilityRuntime.PurgeOutcome outcome = runtime.purgeDeadLetters(messageId);
                System.out.println(Jsons.toJson(outcome));
                return 0;
            }
        }
    }

    @Command(name = "dlq-export", description = "Export the dead letter queue state to a JSON file")
    static final class DlqExportCommand implements Callable<Integer> {
        @ParentCommand
        GuardCommand parent;

        @Option(names = {"--out"}, required = true, description = "Output json file path")
        String out;

        @Override
        public Integer call() {
            try (ReliabilityRuntime runtime = parent.runtime()) {
                runtime.init();
                ReliabilityRuntime.DeadExportOutcome outcome = runtime.exportDeadLetters(out);
                System.out.println(Jsons.toJson(outcome));
                return 0;
            }
        }
    }

    @Command(name = "health", description = "Run all health checks and print the report")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand
        GuardCommand parent;

        @Override
        public Integer call() {
            try (ReliabilityRuntime runtime = parent.runtime()) {
                runtime.init();
                AggregatedHealth health = runtime.health();
                System.out.println(runtime.healthReport());
                return health.overall() == HealthStatus.UNHEALTHY ? 1 : 0;
            }
        }
    }

    @Command(name = "stats", description = "Show reliability counters")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        GuardCommand parent;

        @Override
        public Integer call() {
            try (ReliabilityRuntime runtime = parent.runtime()) {
                runtime.init();
                System.out.println(Jsons.toJson(runtime.stats()));
                return 0;
            }
        }
    }

    @Command(name = "metrics", description = "Print Prometheus metrics text")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        GuardCommand parent;

        @Override
        public Integer call() {
            try (ReliabilityRuntime runtime = parent.runtime()) {
                runtime.init();
                System.out.print(runtime.metricsText());
                return 0;
            }
        }
    }

    @Command(name = "settings", description = "Print the effective reliability settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        GuardCommand parent;

        @Override
        public Integer call() {
            try (ReliabilityRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.settings()));
                return 0;
            }
        }
    }

    @Command(name = "journal-verify", description = "Verify the event journal hash chain")
    static final class JournalVerifyCommand implements Callable<Integer> {
        @ParentCommand
        GuardCommand parent;

        @Override
        public Integer call() {
            try (ReliabilityRuntime runtime = parent.runtime()) {
                JsonlEventJournal.IntegrityOutcome out = runtime.verifyJournal();
                System.out.println(Jsons.toJson(out));
                return out.ok() ? 0 : 1;
            }
        }
    }
}
