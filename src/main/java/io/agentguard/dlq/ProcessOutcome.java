package io.agentguard.dlq;

public enum ProcessOutcome {
    RECOVERED,
    RETRY_SCHEDULED,
    EXPIRED,
    SKIPPED
}
