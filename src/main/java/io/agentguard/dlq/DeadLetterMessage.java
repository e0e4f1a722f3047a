package io.agentguard.dlq;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record DeadLetterMessage(
        String id,
        JsonNode payload,
        String error,
        String errorStack,
        int attempts,
        long firstFailureTime,
        long lastFailureTime,
        String source,
        Map<String, Object> metadata,
        Long retryAfter
) {
    public DeadLetterMessage {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean critical() {
        Object flag = metadata.get("critical");
        return Boolean.TRUE.equals(flag) || "true".equals(flag);
    }

    public boolean dueAt(long nowMs) {
        return retryAfter == null || nowMs >= retryAfter;
    }

    public DeadLetterMessage withFailure(String newError, String newStack, long failedAtMs, long nextRetryAtMs) {
        return new DeadLetterMessage(
                id,
                payload,
                newError,
                newStack,
                attempts + 1,
                firstFailureTime,
                failedAtMs,
                source,
                metadata,
                nextRetryAtMs
        );
    }
}
