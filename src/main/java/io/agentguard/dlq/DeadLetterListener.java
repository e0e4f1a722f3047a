package io.agentguard.dlq;

public interface DeadLetterListener {
    default void onMessageExpired(DeadLetterMessage message) {
    }

    default void onMessageRecovered(DeadLetterMessage message) {
    }

    default void onQueueFull(DeadLetterMessage evicted) {
    }
}
