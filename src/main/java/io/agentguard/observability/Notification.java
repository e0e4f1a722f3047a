package io.agentguard.observability;

import java.util.List;

public record Notification(
        Level level,
        String message,
        List<String> actions
) {
    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    public static Notification info(String message) {
        return new Notification(Level.INFO, message, List.of());
    }

    public static Notification warning(String message, String... actions) {
        return new Notification(Level.WARNING, message, List.of(actions));
    }

    public static Notification error(String message, String... actions) {
        return new Notification(Level.ERROR, message, List.of(actions));
    }
}
