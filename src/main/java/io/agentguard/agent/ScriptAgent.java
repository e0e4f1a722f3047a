package io.agentguard.agent;

import io.agentguard.error.OperationTimeoutException;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external worker process per task. The payload is written to stdin;
 * stdout and stderr are captured together. A non-zero exit is a failed result,
 * a spawn error or a timeout is thrown.
 */
public final class ScriptAgent implements Agent {
    private static final int MAX_ERROR_CHARS = 512;
    private static final long MIN_TIMEOUT_MS = 1_000L;

    private final String id;
    private final List<String> command;
    private final long timeoutMs;

    public ScriptAgent(String id, List<String> command, long timeoutMs) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("script agent id cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script agent command cannot be empty: " + id);
        }
        this.id = id;
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(MIN_TIMEOUT_MS, timeoutMs);
    }

    @Override
    public String id() {
        return id;
    }

    public List<String> command() {
        return command;
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    @Override
    public AgentResult execute(AgentTask task) throws IOException, InterruptedException {
        Path output = Files.createTempFile("agentguard-" + id + "-", ".out");
        try {
            ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
            pb.redirectErrorStream(true);
            pb.redirectOutput(output.toFile());
            pb.environment().put("AGENTGUARD_TASK_ID", task.taskId());
            pb.environment().put("AGENTGUARD_AGENT_ID", id);
            Process process = pb.start();
            try {
                try (OutputStream stdin = process.getOutputStream()) {
                    stdin.write(task.payload().getBytes(StandardCharsets.UTF_8));
                }
                if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                    throw new OperationTimeoutException("script agent " + id, timeoutMs);
                }
            } finally {
                if (process.isAlive()) {
                    process.destroyForcibly();
                    process.waitFor(1, TimeUnit.SECONDS);
                }
            }
            String combined = Files.readString(output, StandardCharsets.UTF_8);
            if (process.exitValue() == 0) {
                return AgentResult.ok(combined.strip());
            }
            return AgentResult.fail("script exit=" + process.exitValue() + " output=" + truncate(combined));
        } finally {
            Files.deleteIfExists(output);
        }
    }

    private static String truncate(String raw) {
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
