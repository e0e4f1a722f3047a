package io.agentguard.observability;

import io.agentguard.circuit.CircuitMetrics;
import io.agentguard.circuit.CircuitState;
import io.agentguard.dlq.DeadLetterMetrics;
import io.agentguard.health.HealthStatus;
import io.agentguard.ratelimit.RateLimitMetrics;
import io.agentguard.retry.RetryMetrics;
import io.agentguard.runtime.ReliabilityRuntime;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class PrometheusFormatterTest {

    @Test
    void rendersEveryComponent() {
        String text = PrometheusFormatter.format(stats());

        Assertions.assertTrue(text.contains("agentguard_circuits_total{state=\"open\"} 1"), text);
        Assertions.assertTrue(text.contains("agentguard_circuit_open{circuit=\"planner\"} 1"), text);
        Assertions.assertTrue(text.contains("agentguard_circuit_rejected_total{circuit=\"planner\"} 4"), text);
        Assertions.assertTrue(text.contains("agentguard_retry_attempts_total{outcome=\"failure\"} 3"), text);
        Assertions.assertTrue(text.contains("agentguard_rate_limit_requests_total{decision=\"blocked\"} 2"), text);
        Assertions.assertTrue(text.contains("agentguard_dlq_messages_total{outcome=\"expired\"} 1"), text);
        Assertions.assertTrue(text.contains("agentguard_health_status{status=\"degraded\"} 1"), text);
        Assertions.assertTrue(text.contains("agentguard_health_status{status=\"healthy\"} 0"), text);
        Assertions.assertEquals(1, count(text, "# HELP agentguard_dlq_messages_total "));
    }

    @Test
    void namespaceLabelIsAddedToEverySample() {
        String text = PrometheusFormatter.format(stats(), "prod");

        Assertions.assertTrue(text.contains("agentguard_dlq_size{namespace=\"prod\"} 2"), text);
        Assertions.assertTrue(text.contains("agentguard_circuit_open{namespace=\"prod\",circuit=\"planner\"} 1"), text);
        for (String line : text.split("\n")) {
            if (!line.isBlank() && !line.startsWith("#")) {
                Assertions.assertTrue(line.contains("namespace=\"prod\""), line);
            }
        }
        Assertions.assertEquals(PrometheusFormatter.format(stats()), PrometheusFormatter.format(stats(), "  "));
    }

    @Test
    void labelValuesAreEscaped() {
        Assertions.assertEquals("a\\\"b\\\\c\\nd", PrometheusFormatter.escapeLabel("a\"b\\c\nd"));
    }

    private static ReliabilityRuntime.StatsOutcome stats() {
        Map<String, CircuitMetrics> circuits = new LinkedHashMap<>();
        circuits.put("planner", new CircuitMetrics(CircuitState.OPEN, 10L, 4L, 6L, 4L, 5, 0, 1_000L, 900L,
                1L, 0, 10, 60.0, 61_000L));
        Map<String, Integer> states = new LinkedHashMap<>();
        states.put("closed", 0);
        states.put("open", 1);
        states.put("half_open", 0);
        return new ReliabilityRuntime.StatsOutcome(
                circuits,
                states,
                new RetryMetrics(5L, 2L, 3L, 2L, List.of(1_000L, 2_000L), "boom", 12L, 40L),
                new RateLimitMetrics(10L, 8L, 2L, 1, 3, 0L),
                new DeadLetterMetrics(4L, 3L, 1L, 1L, 0L, 2, 1.5, 5_000L),
                HealthStatus.DEGRADED,
                1_024L,
                0L,
                "2026-01-01T00:00:00Z"
        );
    }

    private static int count(String text, String needle) {
        int n = 0;
        int idx = text.indexOf(needle);
        while (idx >= 0) {
            n++;
            idx = text.indexOf(needle, idx + needle.length());
        }
        return n;
    }
}
