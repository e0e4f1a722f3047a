package io.agentguard.dlq;

import io.agentguard.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * One JSON file per message under {@code <root>/<queue>/<id>.json}. Writes go to
 * a temp file first and are moved into place.
 */
public final class FileDeadLetterStore implements DeadLetterStore {
    private static final Logger log = LoggerFactory.getLogger(FileDeadLetterStore.class);
    private static final String SUFFIX = ".json";

    private final Path root;

    public FileDeadLetterStore(Path root) {
        this.root = root;
    }

    public Path root() {
        return root;
    }

    @Override
    public void save(String queueName, DeadLetterMessage message) throws IOException {
        Path dir = queueDir(queueName);
        Files.createDirectories(dir);
        Path target = dir.resolve(fileName(message.id()));
        Path tmp = dir.resolve(fileName(message.id()) + ".tmp");
        Files.writeString(tmp, Jsons.toJson(message), StandardCharsets.UTF_8);
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.debug("Atomic move unavailable for {}, replacing in place", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public List<DeadLetterMessage> loadAll(String queueName) throws IOException {
        Path dir = queueDir(queueName);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<DeadLetterMessage> out = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path file : stream) {
                try {
                    DeadLetterMessage message = Jsons.mapper().readValue(file.toFile(), DeadLetterMessage.class);
                    if (message == null || message.id() == null || message.id().isBlank()) {
                        log.warn("Skipping dead letter file without id: {}", file);
                        continue;
                    }
                    out.add(message);
                } catch (IOException e) {
                    log.error("Failed to load dead letter file {}: {}", file, e.getMessage());
                }
            }
        }
        out.sort(Comparator.comparingLong(DeadLetterMessage::firstFailureTime));
        return out;
    }

    @Override
    public void delete(String queueName, String messageId) throws IOException {
        Files.deleteIfExists(queueDir(queueName).resolve(fileName(messageId)));
    }

    @Override
    public void clear(String queueName) throws IOException {
        Path dir = queueDir(queueName);
        if (!Files.isDirectory(dir)) {
            return;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                if (name.endsWith(SUFFIX) || name.endsWith(SUFFIX + ".tmp")) {
                    Files.deleteIfExists(file);
                }
            }
        }
    }

    private Path queueDir(String queueName) {
        return root.resolve(safeSegment(queueName));
    }

    private static String fileName(String messageId) {
        return safeSegment(messageId) + SUFFIX;
    }

    /**
     * Percent-encodes every UTF-8 byte outside {@code [A-Za-z0-9_-]}, plus a leading
     * dot, so distinct names never share a file.
     */
    static String safeSegment(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("dead letter store name cannot be empty");
        }
        StringBuilder sb = new StringBuilder(raw.length());
        byte[] bytes = raw.getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < bytes.length; i++) {
            int b = bytes[i] & 0xFF;
            boolean ok = (b >= 'a' && b <= 'z')
                    || (b >= 'A' && b <= 'Z')
                    || (b >= '0' && b <= '9')
                    || b == '_' || b == '-' || (b == '.' && i > 0);
            if (ok) {
                sb.append((char) b);
            } else {
                sb.append('%').append(Character.toUpperCase(Character.forDigit(b >> 4, 16)))
                        .append(Character.toUpperCase(Character.forDigit(b & 0xF, 16)));
            }
        }
        return sb.toString();
    }
}
