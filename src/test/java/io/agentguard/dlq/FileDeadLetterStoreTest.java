package io.agentguard.dlq;

import io.agentguard.testing.TestFiles;
import io.agentguard.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

final class FileDeadLetterStoreTest {

    @Test
    void savesOneFilePerMessageAndLoadsOldestFirst() throws Exception {
        Path root = Files.createTempDirectory("agentguard-dlq-store-");
        try {
            FileDeadLetterStore store = new FileDeadLetterStore(root);
            DeadLetterMessage newer = message("m-2", 200L);
            DeadLetterMessage older = message("m-1", 100L);
            store.save("agent-operations", newer);
            store.save("agent-operations", older);

            Assertions.assertTrue(Files.exists(root.resolve("agent-operations").resolve("m-1.json")));
            List<DeadLetterMessage> loaded = store.loadAll("agent-operations");
            Assertions.assertEquals(List.of("m-1", "m-2"), loaded.stream().map(DeadLetterMessage::id).toList());
            Assertions.assertEquals(older, loaded.get(0));

            store.delete("agent-operations", "m-1");
            Assertions.assertEquals(1, store.loadAll("agent-operations").size());
            store.clear("agent-operations");
            Assertions.assertTrue(store.loadAll("agent-operations").isEmpty());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void skipsUnreadableFilesAndEncodesNames() throws Exception {
        Path root = Files.createTempDirectory("agentguard-dlq-store-bad-");
        try {
            FileDeadLetterStore store = new FileDeadLetterStore(root);
            store.save("../escape", message("../m", 1L));
            Path queueDir = root.resolve("%2E.%2Fescape");
            Assertions.assertTrue(Files.isDirectory(queueDir));
            Files.writeString(queueDir.resolve("broken.json"), "{not json", StandardCharsets.UTF_8);

            List<DeadLetterMessage> loaded = store.loadAll("../escape");
            Assertions.assertEquals(1, loaded.size());
            Assertions.assertEquals("../m", loaded.get(0).id());
            Assertions.assertTrue(store.loadAll("missing").isEmpty());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void idsThatOnlyDifferInUnsafeCharactersGetSeparateFiles() throws Exception {
        Path root = Files.createTempDirectory("agentguard-dlq-store-ids-");
        try {
            FileDeadLetterStore store = new FileDeadLetterStore(root);
            store.save("ops", message("a/b", 1L));
            store.save("ops", message("a_b", 2L));
            store.save("ops", message("a%2Fb", 3L));

            Assertions.assertEquals(List.of("a/b", "a_b", "a%2Fb"),
                    store.loadAll("ops").stream().map(DeadLetterMessage::id).toList());
            store.delete("ops", "a/b");
            Assertions.assertEquals(List.of("a_b", "a%2Fb"),
                    store.loadAll("ops").stream().map(DeadLetterMessage::id).toList());
            Assertions.assertEquals("caf%C3%A9", FileDeadLetterStore.safeSegment("caf\u00e9"));
            Assertions.assertThrows(IllegalArgumentException.class, () -> store.save("ops", message("", 4L)));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    private static DeadLetterMessage message(String id, long firstFailure) {
        return new DeadLetterMessage(
                id,
                Jsons.mapper().createObjectNode().put("agentId", "echo"),
                "boom",
                "stack",
                1,
                firstFailure,
                firstFailure + 5L,
                "execute-task",
                Map.of("critical", true),
                firstFailure + 1_000L
        );
    }
}
