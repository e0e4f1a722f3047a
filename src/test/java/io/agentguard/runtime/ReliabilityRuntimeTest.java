package io.agentguard.runtime;

import io.agentguard.config.GuardConfig;
import io.agentguard.dlq.DeadLetterMessage;
import io.agentguard.observability.JsonlEventJournal;
import io.agentguard.testing.MutableClock;
import io.agentguard.testing.RecordingNotifier;
import io.agentguard.testing.RecordingSleeper;
import io.agentguard.testing.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class ReliabilityRuntimeTest {

    @Test
    void echoDispatchSucceeds() throws Exception {
        Path root = Files.createTempDirectory("agentguard-runtime-");
        try (ReliabilityRuntime runtime = runtime(root)) {
            runtime.init();

            ReliabilityRuntime.DispatchOutcome outcome = runtime.dispatch("echo", "hello", false);

            Assertions.assertTrue(outcome.success(), outcome.error());
            Assertions.assertNotNull(outcome.taskId());
            Assertions.assertTrue(outcome.output().contains("\"received\":\"hello\""), outcome.output());
            Assertions.assertEquals(0, runtime.deadLetterQueue().size());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void unknownAgentIsInvalidAndNotDeadLettered() throws Exception {
        Path root = Files.createTempDirectory("agentguard-runtime-");
        try (ReliabilityRuntime runtime = runtime(root)) {
            runtime.init();

            ReliabilityRuntime.DispatchOutcome outcome = runtime.dispatch("ghost", "x", false);

            Assertions.assertFalse(outcome.success());
            Assertions.assertEquals("invalid", outcome.errorType());
            Assertions.assertFalse(outcome.deadLettered());
            Assertions.assertNull(outcome.taskId());
            Assertions.assertEquals(0, runtime.deadLetterQueue().size());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void failedDispatchIsPersistedReplayedExportedAndPurged() throws Exception {
        Path root = Files.createTempDirectory("agentguard-runtime-");
        try {
            String messageId;
            try (ReliabilityRuntime runtime = runtime(root)) {
                runtime.init();

                ReliabilityRuntime.DispatchOutcome outcome = runtime.dispatch("fail", "job", true);

                Assertions.assertFalse(outcome.success());
                Assertions.assertEquals("retries_exhausted", outcome.errorType());
                Assertions.assertTrue(outcome.deadLettered());
                List<DeadLetterMessage> queued = runtime.deadLetters(10);
                Assertions.assertEquals(1, queued.size());
                messageId = queued.get(0).id();
                Assertions.assertTrue(Files.exists(root.resolve("dlq").resolve(GuardConfig.DEFAULT_QUEUE_NAME)
                        .resolve(messageId + ".json")));
                Assertions.assertEquals(3L, runtime.stats().circuits().get("fail").failedCalls());
                Assertions.assertEquals(3L, runtime.stats().retry().failedAttempts());
            }

            try (ReliabilityRuntime runtime = runtime(root)) {
                Assertions.assertEquals(1, runtime.init().deadLettersRestored());

                ReliabilityRuntime.ReplayOutcome replay = runtime.replayDeadLetter(messageId);
                Assertions.assertFalse(replay.recovered());
                Assertions.assertEquals("retry_scheduled", replay.outcome());
                Assertions.assertEquals("not_found", runtime.replayDeadLetter("missing").outcome());

                ReliabilityRuntime.ReplayBatchOutcome batch = runtime.replayDeadLetters(10);
                Assertions.assertEquals(1, batch.total());
                Assertions.assertEquals(1, batch.notRecovered());

                Path export = root.resolve("exports").resolve("dlq.json");
                ReliabilityRuntime.DeadExportOutcome exported = runtime.exportDeadLetters(export.toString());
                Assertions.assertEquals(1, exported.exported());
                Assertions.assertTrue(Files.readString(export, StandardCharsets.UTF_8).contains(messageId));

                Assertions.assertEquals(1, runtime.purgeDeadLetters(null).removed());
                Assertions.assertEquals(0, runtime.deadLetterQueue().size());

                JsonlEventJournal.IntegrityOutcome journal = runtime.verifyJournal();
                Assertions.assertTrue(journal.ok(), journal.reason());
                Assertions.assertTrue(journal.checkedRows() > 0);
            }
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void scriptAgentsAreLoadedFromConfig() throws Exception {
        Path root = Files.createTempDirectory("agentguard-runtime-");
        try {
            Path scripts = root.resolve("agents").resolve("scripts.json");
            Files.createDirectories(scripts.getParent());
            Files.writeString(scripts, """
                    {
                      "agents": [
                        {"id": "shell-cat", "command": ["sh", "-c", "cat"], "timeoutMs": 5000},
                        {"id": "", "command": ["ignored"]}
                      ]
                    }
                    """, StandardCharsets.UTF_8);
            try (ReliabilityRuntime runtime = runtime(root)) {
                Assertions.assertEquals(1, runtime.init().scriptAgentsLoaded());
                Assertions.assertTrue(runtime.agents().listAgentIds().contains("shell-cat"));

                ReliabilityRuntime.DispatchOutcome outcome = runtime.dispatch("shell-cat", "ping", false);

                Assertions.assertTrue(outcome.success(), outcome.error());
                Assertions.assertEquals("ping", outcome.output());
            }
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void settingsAreWrittenOnce() throws Exception {
        Path root = Files.createTempDirectory("agentguard-runtime-");
        try (ReliabilityRuntime runtime = runtime(root)) {
            Assertions.assertTrue(runtime.writeDefaultSettings().written());
            Assertions.assertFalse(runtime.writeDefaultSettings().written());
            Assertions.assertTrue(runtime.init().settingsFileExists());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void healthAndMetricsCoverEveryComponent() throws Exception {
        Path root = Files.createTempDirectory("agentguard-runtime-");
        try (ReliabilityRuntime runtime = runtime(root)) {
            runtime.init();
            runtime.dispatch("echo", "hi", false);

            Assertions.assertEquals(4, runtime.health().checks().size());
            String metrics = runtime.metricsText();
            Assertions.assertTrue(metrics.contains("agentguard_circuit_calls_total{circuit=\"echo\"} 1"), metrics);
            Assertions.assertTrue(metrics.contains("agentguard_rate_limit_requests_total{decision=\"allowed\"} 1"), metrics);
            Assertions.assertTrue(metrics.contains("agentguard_dlq_size 0"), metrics);
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void closeRunsShutdownOnce() throws Exception {
        Path root = Files.createTempDirectory("agentguard-runtime-");
        try {
            ReliabilityRuntime runtime = runtime(root);
            runtime.init();
            runtime.start();
            runtime.close();
            runtime.close();

            ShutdownCoordinator.ShutdownOutcome outcome = runtime.shutdownCoordinator().outcome();
            Assertions.assertTrue(outcome.clean(), outcome.failed().toString());
            Assertions.assertEquals("stop-scheduler", outcome.completed().get(outcome.completed().size() - 1));
            Assertions.assertFalse(runtime.healthService().isRunning());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    private static ReliabilityRuntime runtime(Path root) {
        MutableClock clock = new MutableClock(1_700_000_000_000L);
        return new ReliabilityRuntime(new GuardConfig(root), clock, new RecordingNotifier(), new RecordingSleeper(clock));
    }
}
