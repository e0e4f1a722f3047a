package io.agentguard.circuit;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
