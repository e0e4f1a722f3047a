package io.agentguard.dlq;

import java.io.IOException;
import java.util.List;

public interface DeadLetterStore {
    DeadLetterStore NOOP = new DeadLetterStore() {
        @Override
        public void save(String queueName, DeadLetterMessage message) {
        }

        @Override
        public List<DeadLetterMessage> loadAll(String queueName) {
            return List.of();
        }

        @Override
        public void delete(String queueName, String messageId) {
        }

        @Override
        public void clear(String queueName) {
        }
    };

    void save(String queueName, DeadLetterMessage message) throws IOException;

    /**
     * Returns every readable message of the queue. Unreadable entries are skipped.
     */
    List<DeadLetterMessage> loadAll(String queueName) throws IOException;

    void delete(String queueName, String messageId) throws IOException;

    void clear(String queueName) throws IOException;
}
