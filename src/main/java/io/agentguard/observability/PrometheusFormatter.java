package io.agentguard.observability;

import io.agentguard.circuit.CircuitMetrics;
import io.agentguard.circuit.CircuitState;
import io.agentguard.dlq.DeadLetterMetrics;
import io.agentguard.health.HealthStatus;
import io.agentguard.ratelimit.RateLimitMetrics;
import io.agentguard.retry.RetryMetrics;
import io.agentguard.runtime.ReliabilityRuntime;

import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(ReliabilityRuntime.StatsOutcome stats) {
        return format(stats, null);
    }

    public static String format(ReliabilityRuntime.StatsOutcome stats, String namespace) {
        StringBuilder sb = new StringBuilder();
        appendMapGauge(sb, "agentguard_circuits_total", "Circuits grouped by state", "state", stats.circuitStates());
        for (Map.Entry<String, CircuitMetrics> e : stats.circuits().entrySet()) {
            CircuitMetrics m = e.getValue();
            appendGauge(sb, "agentguard_circuit_open", "Circuit open flag (1=open,0=otherwise)", "circuit", e.getKey(),
                    m.state() == CircuitState.OPEN ? 1L : 0L);
            appendGauge(sb, "agentguard_circuit_calls_total", "Calls admitted by each circuit", "circuit", e.getKey(), m.totalCalls());
            appendGauge(sb, "agentguard_circuit_failures_total", "Failed calls per circuit", "circuit", e.getKey(), m.failedCalls());
            appendGauge(sb, "agentguard_circuit_rejected_total", "Calls rejected by an open circuit", "circuit", e.getKey(), m.rejectedCalls());
        }

        RetryMetrics retry = stats.retry();
        appendGauge(sb, "agentguard_retry_attempts_total", "Retry attempts grouped by outcome", "outcome", "success", retry.successfulAttempts());
        appendGauge(sb, "agentguard_retry_attempts_total", "Retry attempts grouped by outcome", "outcome", "failure", retry.failedAttempts());
        appendGauge(sb, "agentguard_retries_total", "Retries scheduled after a failed attempt", null, null, retry.totalRetries());
        appendGauge(sb, "agentguard_retry_last_latency_ms", "Latency of the last guarded operation in milliseconds", null, null, retry.lastLatencyMs());

        RateLimitMetrics rateLimit = stats.rateLimit();
        appendGauge(sb, "agentguard_rate_limit_requests_total", "Admission checks grouped by decision", "decision", "allowed", rateLimit.allowedRequests());
        appendGauge(sb, "agentguard_rate_limit_requests_total", "Admission checks grouped by decision", "decision", "blocked", rateLimit.blockedRequests());
        appendGauge(sb, "agentguard_rate_limit_blocked_keys", "Keys currently inside a block period", null, null, rateLimit.currentlyBlocked());
        appendGauge(sb, "agentguard_rate_limit_tracked_keys", "Keys with admission state", null, null, rateLimit.trackedKeys());
        appendGauge(sb, "agentguard_rate_limit_distributed_fallback_total", "Admission checks that fell back to local state", null, null, rateLimit.distributedFallbacks());

        DeadLetterMetrics dlq = stats.deadLetters();
        appendGauge(sb, "agentguard_dlq_size", "Messages currently in the dead letter queue", null, null, dlq.currentQueueSize());
        appendGauge(sb, "agentguard_dlq_messages_total", "Dead letter messages grouped by outcome", "outcome", "added", dlq.totalMessages());
        appendGauge(sb, "agentguard_dlq_messages_total", "Dead letter messages grouped by outcome", "outcome", "recovered", dlq.recoveredMessages());
        appendGauge(sb, "agentguard_dlq_messages_total", "Dead letter messages grouped by outcome", "outcome", "expired", dlq.expiredMessages());
        appendGauge(sb, "agentguard_dlq_messages_total", "Dead letter messages grouped by outcome", "outcome", "evicted", dlq.evictedMessages());
        appendGauge(sb, "agentguard_dlq_oldest_message_age_ms", "Age of the oldest dead letter in milliseconds", null, null, dlq.oldestMessageAgeMs());

        for (HealthStatus status : HealthStatus.values()) {
            appendGauge(sb, "agentguard_health_status", "Overall health (1 for the current status)", "status",
                    status.name().toLowerCase(), status == stats.health() ? 1L : 0L);
        }
        appendGauge(sb, "agentguard_disk_free_bytes", "Usable bytes on the data root disk", null, null, stats.diskFreeBytes());
        appendGauge(sb, "agentguard_journal_write_failures_total", "Journal rows that could not be written", null, null, stats.journalWriteFailures());
        String base = sb.toString();
        String normalizedNamespace = namespace == null ? "" : namespace.trim();
        if (normalizedNamespace.isBlank()) {
            return base;
        }
        String escapedNs = escapeLabel(normalizedNamespace);
        StringBuilder withNamespace = new StringBuilder(base.length() + 64);
        for (String line : base.split("\\r?\\n")) {
            if (line.isBlank() || line.startsWith("#")) {
                withNamespace.append(line).append('\n');
                continue;
            }
            int sep = line.lastIndexOf(' ');
            String sample = line.substring(0, sep);
            int brace = sample.indexOf('{');
            if (brace >= 0) {
                sample = sample.substring(0, brace + 1) + "namespace=\"" + escapedNs + "\"," + sample.substring(brace + 1);
            } else {
                sample = sample + "{namespace=\"" + escapedNs + "\"}";
            }
            withNamespace.append(sample).append(line.substring(sep)).append('\n');
        }
        return withNamespace.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Integer> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Integer> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
