package io.agentguard.circuit;

import io.agentguard.observability.Notification;
import io.agentguard.testing.MutableClock;
import io.agentguard.testing.RecordingJournal;
import io.agentguard.testing.RecordingNotifier;
import io.agentguard.util.TimeLimiter;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;

final class CircuitBreakerRegistryTest {

    @Test
    void createsOneBreakerPerKeyLazily() {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(CircuitBreakerConfig.defaults());
        Assertions.assertTrue(registry.find("echo").isEmpty());

        CircuitBreaker first = registry.breaker("echo");
        Assertions.assertSame(first, registry.breaker("echo"));
        Assertions.assertNotSame(first, registry.breaker("fail"));
        Assertions.assertEquals(2, registry.all().size());
        Assertions.assertTrue(registry.remove("fail"));
        Assertions.assertFalse(registry.remove("fail"));
    }

    @Test
    void journalsTransitionsAndNotifiesOnOpen() {
        RecordingJournal journal = new RecordingJournal();
        RecordingNotifier notifier = new RecordingNotifier();
        CircuitBreakerConfig config = new CircuitBreakerConfig(2, 1, 1_000L, 10, 50, 60_000L, 0L);
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(config, new MutableClock(0L),
                TimeLimiter.shared(), notifier, journal);

        CircuitBreaker breaker = registry.breaker("fail");
        for (int i = 0; i < 2; i++) {
            Assertions.assertThrows(IllegalStateException.class, () -> breaker.execute(() -> {
                throw new IllegalStateException("down");
            }));
        }

        Assertions.assertEquals(1, journal.events().size());
        Assertions.assertEquals("circuit.transition", journal.events().get(0).action());
        Assertions.assertEquals("circuit/fail", journal.events().get(0).resource());
        Assertions.assertEquals(1, notifier.received().size());
        Assertions.assertEquals(Notification.Level.WARNING, notifier.received().get(0).level());
    }

    @Test
    void countsByStateAndResetsAll() {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(CircuitBreakerConfig.defaults());
        registry.breaker("a").forceState(CircuitState.OPEN);
        registry.breaker("b");

        Map<CircuitState, Integer> counts = registry.countByState();
        Assertions.assertEquals(1, counts.get(CircuitState.OPEN));
        Assertions.assertEquals(1, counts.get(CircuitState.CLOSED));
        Assertions.assertEquals(0, counts.get(CircuitState.HALF_OPEN));
        Assertions.assertFalse(registry.snapshot().get("a").healthy());

        registry.resetAll();
        Assertions.assertEquals(2, registry.countByState().get(CircuitState.CLOSED));
        Assertions.assertFalse(registry.reset("missing"));
    }
}
