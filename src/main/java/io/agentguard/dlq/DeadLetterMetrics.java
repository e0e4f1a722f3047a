package io.agentguard.dlq;

public record DeadLetterMetrics(
        long totalMessages,
        long processedMessages,
        long recoveredMessages,
        long expiredMessages,
        long evictedMessages,
        int currentQueueSize,
        double averageRetries,
        long oldestMessageAgeMs
) {
}
