package io.agentguard.health;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Rules for folding many check results into one status. An empty input is
 * always {@link HealthStatus#UNKNOWN}.
 */
public enum AggregationStrategy {
    WORST {
        @Override
        HealthStatus combine(Collection<Sample> samples) {
            HealthStatus worst = HealthStatus.HEALTHY;
            for (Sample sample : samples) {
                if (sample.status() == HealthStatus.UNHEALTHY) {
                    return HealthStatus.UNHEALTHY;
                }
                if (sample.status() == HealthStatus.DEGRADED) {
                    worst = HealthStatus.DEGRADED;
                } else if (sample.status() == HealthStatus.UNKNOWN && worst == HealthStatus.HEALTHY) {
                    worst = HealthStatus.UNKNOWN;
                }
            }
            return worst;
        }
    },
    WEIGHTED {
        @Override
        HealthStatus combine(Collection<Sample> samples) {
            double totalWeight = 0.0;
            double score = 0.0;
            for (Sample sample : samples) {
                totalWeight += sample.weight();
                score += sample.weight() * sample.status().score();
            }
            if (totalWeight <= 0.0) {
                return HealthStatus.UNKNOWN;
            }
            double normalized = score / totalWeight;
            if (normalized >= 0.8) {
                return HealthStatus.HEALTHY;
            }
            if (normalized >= 0.5) {
                return HealthStatus.DEGRADED;
            }
            return HealthStatus.UNHEALTHY;
        }
    },
    MAJORITY {
        @Override
        HealthStatus combine(Collection<Sample> samples) {
            Map<HealthStatus, Integer> counts = new EnumMap<>(HealthStatus.class);
            for (Sample sample : samples) {
                counts.merge(sample.status(), 1, Integer::sum);
            }
            int total = samples.size();
            if (counts.getOrDefault(HealthStatus.HEALTHY, 0) * 2 > total) {
                return HealthStatus.HEALTHY;
            }
            if (counts.getOrDefault(HealthStatus.UNHEALTHY, 0) * 2 > total) {
                return HealthStatus.UNHEALTHY;
            }
            if (counts.getOrDefault(HealthStatus.DEGRADED, 0) > 0) {
                return HealthStatus.DEGRADED;
            }
            if (counts.getOrDefault(HealthStatus.UNHEALTHY, 0) > 0) {
                return HealthStatus.UNHEALTHY;
            }
            if (counts.getOrDefault(HealthStatus.UNKNOWN, 0) > 0) {
                return HealthStatus.UNKNOWN;
            }
            return HealthStatus.HEALTHY;
        }
    };

    public record Sample(HealthStatus status, double weight) {
        public static Sample of(HealthStatus status) {
            return new Sample(status, 1.0);
        }
    }

    public HealthStatus aggregate(Collection<Sample> samples) {
        if (samples == null || samples.isEmpty()) {
            return HealthStatus.UNKNOWN;
        }
        return combine(samples);
    }

    abstract HealthStatus combine(Collection<Sample> samples);

    public static AggregationStrategy fromString(String raw, AggregationStrategy fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return AggregationStrategy.valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
