package io.agentguard.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentguard.testing.MutableClock;
import io.agentguard.testing.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

final class JsonlEventJournalTest {

    @Test
    void chainVerifiesAcrossReopen() throws Exception {
        Path root = Files.createTempDirectory("agentguard-journal-");
        try {
            Path file = root.resolve("journal").resolve("journal.log");
            JsonlEventJournal journal = new JsonlEventJournal(file, "test", new MutableClock(1_000L));
            journal.record(JournalEvent.of("circuit.state", "circuit/a", "OPEN", Map.of("from", "CLOSED")));
            journal.record(JournalEvent.of("dlq.enqueue", "dlq/ops", "ok", Map.of("attempts", 0)));
            String head = journal.currentHash();

            JsonlEventJournal reopened = new JsonlEventJournal(file, "test", new MutableClock(2_000L));
            Assertions.assertEquals(head, reopened.currentHash());
            reopened.record(JournalEvent.of("dlq.recover", "dlq/ops", "ok", null));

            JsonlEventJournal.IntegrityOutcome outcome = reopened.verify();
            Assertions.assertTrue(outcome.ok(), outcome.reason());
            Assertions.assertEquals(3, outcome.checkedRows());
            List<JsonNode> tail = reopened.tail(2);
            Assertions.assertEquals("dlq.enqueue", tail.get(0).get("action").asText());
            Assertions.assertEquals(head, tail.get(1).get("prev_hash").asText());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksTheChain() throws Exception {
        Path root = Files.createTempDirectory("agentguard-journal-");
        try {
            Path file = root.resolve("journal.log");
            JsonlEventJournal journal = new JsonlEventJournal(file, "test", new MutableClock(1_000L));
            journal.record(JournalEvent.of("a", "r", "ok", Map.of("n", 1)));
            journal.record(JournalEvent.of("b", "r", "ok", Map.of("n", 2)));
            journal.record(JournalEvent.of("c", "r", "ok", Map.of("n", 3)));

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            lines.set(1, lines.get(1).replace("\"n\":2", "\"n\":20"));
            Files.write(file, lines, StandardCharsets.UTF_8);

            JsonlEventJournal.IntegrityOutcome outcome = journal.verify();
            Assertions.assertFalse(outcome.ok());
            Assertions.assertEquals(2, outcome.firstBrokenLine());
            Assertions.assertEquals("hash mismatch", outcome.reason());
            Assertions.assertEquals(1, outcome.checkedRows());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void sensitiveDetailsAreMasked() throws Exception {
        Path root = Files.createTempDirectory("agentguard-journal-");
        try {
            Path file = root.resolve("journal.log");
            JsonlEventJournal journal = new JsonlEventJournal(file, "test", new MutableClock(1_000L));
            journal.record(JournalEvent.of("agent.call", "agent/x", "failed", Map.of(
                    "apiKey", "plain-value",
                    "error", "request with Bearer abcdefghijklmnop rejected")));

            String row = Files.readString(file, StandardCharsets.UTF_8);
            Assertions.assertFalse(row.contains("plain-value"), row);
            Assertions.assertFalse(row.contains("abcdefghijklmnop"), row);
            Assertions.assertTrue(row.contains("Bearer ***"), row);
            Assertions.assertTrue(journal.verify().ok());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }
}
