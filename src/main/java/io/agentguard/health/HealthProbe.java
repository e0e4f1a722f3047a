package io.agentguard.health;

@FunctionalInterface
public interface HealthProbe {
    HealthCheckResult check() throws Exception;
}
