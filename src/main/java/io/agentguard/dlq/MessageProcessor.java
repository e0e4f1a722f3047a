package io.agentguard.dlq;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Re-runs the work a dead-lettered payload describes. Returning normally marks
 * the message recovered; throwing counts a failed attempt.
 */
@FunctionalInterface
public interface MessageProcessor {
    void process(JsonNode payload) throws Exception;
}
