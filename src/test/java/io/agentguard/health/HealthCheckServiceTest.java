package io.agentguard.health;

import io.agentguard.observability.Notification;
import io.agentguard.testing.MutableClock;
import io.agentguard.testing.RecordingJournal;
import io.agentguard.testing.RecordingNotifier;
import io.agentguard.util.TimeLimiter;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

final class HealthCheckServiceTest {

    @Test
    void oneUnhealthyCheckMakesWorstAggregateUnhealthy() {
        HealthCheckService service = service(HealthCheckConfig.defaults().withAutoRecovery(false), new RecordingNotifier(), new RecordingJournal());
        service.registerCheck(HealthCheck.of("a", CheckType.LIVENESS, () -> HealthCheckResult.healthy("ok")));
        service.registerCheck(HealthCheck.of("b", CheckType.READINESS, () -> HealthCheckResult.healthy("ok")));
        service.registerCheck(HealthCheck.of("c", CheckType.STARTUP, () -> HealthCheckResult.healthy("ok")));
        service.registerCheck(HealthCheck.of("d", CheckType.LIVENESS, () -> HealthCheckResult.unhealthy("down")));

        AggregatedHealth health = service.performAllChecks();

        Assertions.assertEquals(HealthStatus.UNHEALTHY, health.overall());
        Assertions.assertEquals(4, health.checks().size());
        Assertions.assertEquals("down", health.checks().get("d").message());
    }

    @Test
    void noResultsIsUnknown() {
        HealthCheckService service = service(HealthCheckConfig.defaults(), new RecordingNotifier(), new RecordingJournal());
        Assertions.assertEquals(HealthStatus.UNKNOWN, service.health().overall());
        Assertions.assertEquals(HealthStatus.UNKNOWN, service.performAllChecks().overall());
    }

    @Test
    void throwingProbeIsReportedUnhealthy() {
        HealthCheckService service = service(HealthCheckConfig.defaults().withAutoRecovery(false), new RecordingNotifier(), new RecordingJournal());
        service.registerCheck(HealthCheck.of("broken", CheckType.LIVENESS, () -> {
            throw new IllegalStateException("boom");
        }));

        HealthCheckResult result = service.runCheck("broken").orElseThrow();

        Assertions.assertEquals(HealthStatus.UNHEALTHY, result.status());
        Assertions.assertEquals("Check failed: boom", result.message());
        Assertions.assertTrue(service.runCheck("missing").isEmpty());
    }

    @Test
    void slowProbeTimesOut() {
        HealthCheckService service = service(HealthCheckConfig.defaults().withAutoRecovery(false), new RecordingNotifier(), new RecordingJournal());
        service.registerCheck(HealthCheck.of("slow", CheckType.LIVENESS, () -> {
            Thread.sleep(5_000L);
            return HealthCheckResult.healthy("late");
        }).withTimeout(50L));

        HealthCheckResult result = service.runCheck("slow").orElseThrow();

        Assertions.assertEquals(HealthStatus.UNHEALTHY, result.status());
        Assertions.assertEquals("Health check timed out after 50ms", result.message());
    }

    @Test
    void criticalFailureFiresOnEveryRunPastRetries() {
        RecordingNotifier notifier = new RecordingNotifier();
        HealthCheckService service = service(HealthCheckConfig.defaults().withAutoRecovery(false), notifier, new RecordingJournal());
        List<String> handled = new ArrayList<>();
        service.setCriticalFailureHandler((name, result) -> handled.add(name));
        service.registerCheck(HealthCheck.of("db", CheckType.READINESS, () -> HealthCheckResult.unhealthy("refused"))
                .withRetries(1)
                .asCritical());

        service.performAllChecks();
        Assertions.assertTrue(handled.isEmpty());
        service.performAllChecks();
        service.performAllChecks();

        Assertions.assertEquals(List.of("db", "db"), handled);
        Assertions.assertEquals(2, notifier.received().size());
        Notification notification = notifier.received().get(1);
        Assertions.assertEquals(Notification.Level.ERROR, notification.level());
        Assertions.assertEquals("Critical health check failed: db (refused)", notification.message());
    }

    @Test
    void listenersSeeOverallChangesOnly() {
        RecordingJournal journal = new RecordingJournal();
        HealthCheckService service = service(HealthCheckConfig.defaults().withAutoRecovery(false), new RecordingNotifier(), journal);
        AtomicInteger healthy = new AtomicInteger(1);
        service.registerCheck(HealthCheck.of("flaky", CheckType.LIVENESS,
                () -> healthy.get() == 1 ? HealthCheckResult.healthy("ok") : HealthCheckResult.degraded("slow")));
        List<HealthStatus> seen = new ArrayList<>();
        HealthCheckService.Subscription subscription = service.onHealthChange(h -> seen.add(h.overall()));

        service.performAllChecks();
        service.performAllChecks();
        healthy.set(0);
        service.performAllChecks();
        subscription.close();
        healthy.set(1);
        service.performAllChecks();

        Assertions.assertEquals(List.of(HealthStatus.HEALTHY, HealthStatus.DEGRADED), seen);
        Assertions.assertEquals(List.of("health.change", "health.change", "health.change"), journal.actions());
        Assertions.assertEquals(HealthStatus.HEALTHY, service.health().overall());
    }

    @Test
    void autoRecoveryRerunsUnhealthyChecks() {
        AtomicInteger calls = new AtomicInteger();
        HealthCheckService service = service(HealthCheckConfig.defaults(), new RecordingNotifier(), new RecordingJournal());
        service.registerCheck(HealthCheck.of("cache", CheckType.LIVENESS,
                () -> calls.incrementAndGet() == 1 ? HealthCheckResult.unhealthy("cold") : HealthCheckResult.healthy("warm")));

        AggregatedHealth health = service.performAllChecks();

        Assertions.assertEquals(2, calls.get());
        Assertions.assertEquals(HealthStatus.HEALTHY, health.overall());
        Assertions.assertEquals("warm", health.checks().get("cache").message());
    }

    @Test
    void unregisterDropsResultAndReaggregates() {
        HealthCheckService service = service(HealthCheckConfig.defaults().withAutoRecovery(false), new RecordingNotifier(), new RecordingJournal());
        service.registerCheck(HealthCheck.of("ok", CheckType.LIVENESS, () -> HealthCheckResult.healthy("ok")));
        service.registerCheck(HealthCheck.of("bad", CheckType.LIVENESS, () -> HealthCheckResult.unhealthy("bad")));
        Assertions.assertEquals(HealthStatus.UNHEALTHY, service.performAllChecks().overall());

        Assertions.assertTrue(service.unregisterCheck("bad"));
        Assertions.assertFalse(service.unregisterCheck("bad"));

        Assertions.assertEquals(HealthStatus.HEALTHY, service.health().overall());
        Assertions.assertEquals(List.of("ok"), service.checkNames());
    }

    @Test
    void reportListsEveryCheck() {
        HealthCheckService service = service(HealthCheckConfig.defaults().withAutoRecovery(false), new RecordingNotifier(), new RecordingJournal());
        service.registerCheck(HealthCheck.of("ok", CheckType.LIVENESS, () -> HealthCheckResult.healthy("all good")));
        service.performAllChecks();

        String report = service.exportHealthReport();

        Assertions.assertTrue(report.contains("\"overall\" : \"HEALTHY\""), report);
        Assertions.assertTrue(report.contains("all good"), report);
    }

    private static HealthCheckService service(HealthCheckConfig config, RecordingNotifier notifier, RecordingJournal journal) {
        return new HealthCheckService(config, new MutableClock(1_000L), TimeLimiter.shared(), notifier, journal, Runnable::run);
    }
}
