package io.agentguard.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentguard.config.GuardConfig;
import io.agentguard.testing.TestFiles;
import io.agentguard.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

final class GuardCommandTest {

    @Test
    void initWritesSettingsAndDirectories() throws Exception {
        Path root = Files.createTempDirectory("agentguard-cli-");
        try {
            Assertions.assertEquals(0, execute(root, "init"));
            Assertions.assertTrue(Files.exists(root.resolve(GuardConfig.SETTINGS_FILE)));
            Assertions.assertTrue(Files.isDirectory(root.resolve("dlq")));
            Assertions.assertTrue(Files.isDirectory(root.resolve("agents")));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void runPrintsDispatchOutcome() throws Exception {
        Path root = Files.createTempDirectory("agentguard-cli-");
        PrintStream original = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
            int code = execute(root, "run", "--agent", "echo", "--input", "hello");
            System.out.flush();
            System.setOut(original);

            Assertions.assertEquals(0, code);
            JsonNode outcome = Jsons.mapper().readTree(captured.toString(StandardCharsets.UTF_8));
            Assertions.assertTrue(outcome.get("success").asBoolean());
            Assertions.assertEquals("echo", outcome.get("agentId").asText());
        } finally {
            System.setOut(original);
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void unknownAgentExitsWithFailure() throws Exception {
        Path root = Files.createTempDirectory("agentguard-cli-");
        try {
            Assertions.assertEquals(1, execute(root, "run", "--agent", "ghost"));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void deadLetterCommands() throws Exception {
        Path root = Files.createTempDirectory("agentguard-cli-");
        try {
            Assertions.assertEquals(0, execute(root, "dlq-list", "--limit", "5"));
            Assertions.assertEquals(2, execute(root, "dlq-replay"));
            Assertions.assertEquals(1, execute(root, "dlq-replay", "missing-id"));
            Assertions.assertEquals(0, execute(root, "dlq-replay", "--all"));
            Assertions.assertEquals(0, execute(root, "dlq-purge"));
            Path out = root.resolve("export.json");
            Assertions.assertEquals(0, execute(root, "dlq-export", "--out", out.toString()));
            Assertions.assertTrue(Files.exists(out));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void reportingCommands() throws Exception {
        Path root = Files.createTempDirectory("agentguard-cli-");
        try {
            Assertions.assertEquals(0, execute(root, "agents"));
            Assertions.assertEquals(0, execute(root, "settings"));
            Assertions.assertEquals(0, execute(root, "stats"));
            Assertions.assertEquals(0, execute(root, "metrics"));
            Assertions.assertEquals(0, execute(root, "journal-verify"));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void tamperedJournalFailsVerification() throws Exception {
        Path root = Files.createTempDirectory("agentguard-cli-");
        try {
            Assertions.assertEquals(0, execute(root, "dlq-purge"));
            Path journal = root.resolve("journal").resolve("journal.log");
            String content = Files.readString(journal, StandardCharsets.UTF_8);
            Files.writeString(journal, content.replace("\"result\":\"ok\"", "\"result\":\"edited\""), StandardCharsets.UTF_8);

            Assertions.assertEquals(1, execute(root, "journal-verify"));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    private static int execute(Path root, String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return new CommandLine(new GuardCommand()).execute(full);
    }
}
