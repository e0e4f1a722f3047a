package io.agentguard.health;

public enum HealthStatus {
    HEALTHY(1.0),
    DEGRADED(0.5),
    UNHEALTHY(0.0),
    UNKNOWN(0.25);

    private final double score;

    HealthStatus(double score) {
        this.score = score;
    }

    /**
     * Contribution of this status to a weighted aggregate.
     */
    public double score() {
        return score;
    }
}
