package io.agentguard.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentguard.util.Hashing;
import io.agentguard.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON-lines journal where every row carries the hash of the previous row, so
 * truncation or in-place edits are detectable with {@link #verify()}.
 */
public final class JsonlEventJournal implements EventJournal {
    private static final Logger log = LoggerFactory.getLogger(JsonlEventJournal.class);

    private final Path journalFile;
    private final String namespace;
    private final Clock clock;
    private String previousHash;
    private long writeFailures;

    public JsonlEventJournal(Path journalFile, String namespace) {
        this(journalFile, namespace, Clock.systemUTC());
    }

    public JsonlEventJournal(Path journalFile, String namespace, Clock clock) {
        this.journalFile = journalFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.clock = clock;
        try {
            Files.createDirectories(journalFile.getParent());
            if (!Files.exists(journalFile)) {
                try {
                    Files.createFile(journalFile);
                } catch (FileAlreadyExistsException e) {
                    log.debug("Journal file created concurrently: {}", journalFile);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize journal file: " + journalFile, e);
        }
        this.previousHash = loadLastHash();
    }

    @Override
    public synchronized void record(JournalEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", maskDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(journalFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            writeFailures++;
            log.error("Failed to append journal event {} to {}", event.action(), journalFile, e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public synchronized long writeFailures() {
        return writeFailures;
    }

    public Path file() {
        return journalFile;
    }

    public List<JsonNode> tail(int limit) {
        List<String> lines = readLines();
        int safeLimit = Math.max(1, limit);
        List<JsonNode> out = new ArrayList<>();
        for (int i = Math.max(0, lines.size() - safeLimit); i < lines.size(); i++) {
            try {
                out.add(Jsons.mapper().readTree(lines.get(i)));
            } catch (IOException e) {
                throw new RuntimeException("Malformed journal row at line " + (i + 1), e);
            }
        }
        return out;
    }

    public synchronized IntegrityOutcome verify() {
        String expectedPrev = "";
        int checked = 0;
        List<String> lines = readLines();
        for (int i = 0; i < lines.size(); i++) {
            JsonNode node;
            try {
                node = Jsons.mapper().readTree(lines.get(i));
            } catch (IOException e) {
                return new IntegrityOutcome(false, checked, i + 1, "malformed row");
            }
            String prev = node.path("prev_hash").asText("");
            String hash = node.path("hash").asText("");
            if (!expectedPrev.equals(prev)) {
                return new IntegrityOutcome(false, checked, i + 1, "prev_hash mismatch");
            }
            Map<String, Object> row = Jsons.mapper().convertValue(node, LinkedHashMap.class);
            row.remove("hash");
            if (!Hashing.sha256Hex(Jsons.toCompactJson(row)).equals(hash)) {
                return new IntegrityOutcome(false, checked, i + 1, "hash mismatch");
            }
            expectedPrev = hash;
            checked++;
        }
        return new IntegrityOutcome(true, checked, -1, "ok");
    }

    private List<String> readLines() {
        try {
            List<String> out = new ArrayList<>();
            for (String line : Files.readAllLines(journalFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(line);
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read journal: " + journalFile, e);
        }
    }

    private String loadLastHash() {
        List<String> lines = readLines();
        if (lines.isEmpty()) {
            return "";
        }
        try {
            return Jsons.mapper().readTree(lines.get(lines.size() - 1)).path("hash").asText("");
        } catch (IOException e) {
            log.warn("Journal tail is unreadable, starting a fresh hash chain: {}", journalFile);
            return "";
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> maskDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        return Jsons.mapper().convertValue(SensitiveDataMasker.masked(node), LinkedHashMap.class);
    }

    public record IntegrityOutcome(
            boolean ok,
            int checkedRows,
            int firstBrokenLine,
            String reason
    ) {
    }
}
