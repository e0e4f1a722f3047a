package io.agentguard.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class GuardConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DEFAULT_QUEUE_NAME = "agent-operations";
    public static final String SETTINGS_FILE = "agentguard-settings.json";

    private final Path rootDir;

    public GuardConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static GuardConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new GuardConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dlqRoot() {
        return rootDir.resolve("dlq");
    }

    public Path journalRoot() {
        return rootDir.resolve("journal");
    }

    public Path journalFile() {
        return journalRoot().resolve("journal.log");
    }

    public Path admissionDbFile() {
        return rootDir.resolve("admission.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path agentsRoot() {
        return rootDir.resolve("agents");
    }

    public Path scriptAgentsFile() {
        return agentsRoot().resolve("scripts.json");
    }
}
