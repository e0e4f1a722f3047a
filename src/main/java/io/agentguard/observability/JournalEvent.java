package io.agentguard.observability;

import java.util.Map;

public record JournalEvent(
        String action,
        String resource,
        String result,
        Map<String, Object> details
) {
    public static JournalEvent of(String action, String resource, String result, Map<String, Object> details) {
        return new JournalEvent(action, resource, result, details == null ? Map.of() : details);
    }
}
