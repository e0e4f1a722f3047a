package io.agentguard.health;

public enum CheckType {
    LIVENESS,
    READINESS,
    STARTUP
}
