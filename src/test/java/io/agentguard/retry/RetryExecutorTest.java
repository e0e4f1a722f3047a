package io.agentguard.retry;

import io.agentguard.error.NonRetryableException;
import io.agentguard.error.OperationTimeoutException;
import io.agentguard.testing.MutableClock;
import io.agentguard.testing.RecordingSleeper;
import io.agentguard.util.TimeLimiter;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

final class RetryExecutorTest {

    private static RetryExecutor executor(RetryConfig config, MutableClock clock, Sleeper sleeper, RetryListener listener) {
        return new RetryExecutor(config, RetryPredicates.defaultPredicate(), listener, null, clock, sleeper,
                TimeLimiter.shared(), () -> 0.5);
    }

    @Test
    void exponentialRetriesUntilSuccess() throws Exception {
        MutableClock clock = new MutableClock(0L);
        RecordingSleeper sleeper = new RecordingSleeper(clock);
        RetryConfig config = new RetryConfig(3, 1_000L, 30_000L, RetryStrategy.EXPONENTIAL, 0.2, 0L, 0L);
        List<Long> announced = new ArrayList<>();
        RetryExecutor executor = executor(config, clock, sleeper, (attempt, error, delay) -> announced.add(delay));
        AtomicInteger invocations = new AtomicInteger();

        String result = executor.execute(attempt -> {
            invocations.incrementAndGet();
            if (attempt < 3) {
                throw new IOException("transient " + attempt);
            }
            return "done";
        }, "scenario");

        Assertions.assertEquals("done", result);
        Assertions.assertEquals(3, invocations.get());
        Assertions.assertEquals(List.of(1_000L, 2_000L), sleeper.sleeps());
        Assertions.assertEquals(List.of(1_000L, 2_000L), announced);
        Assertions.assertTrue(clock.millis() >= 3_000L);

        RetryMetrics metrics = executor.metrics();
        Assertions.assertEquals(3L, metrics.totalAttempts());
        Assertions.assertEquals(1L, metrics.successfulAttempts());
        Assertions.assertEquals(2L, metrics.failedAttempts());
        Assertions.assertEquals(2L, metrics.totalRetries());
        Assertions.assertEquals("transient 2", metrics.lastError());
    }

    @Test
    void exhaustionWrapsLastError() {
        MutableClock clock = new MutableClock(0L);
        RetryConfig config = new RetryConfig(3, 10L, 100L, RetryStrategy.FIXED, 0.0, 0L, 0L);
        RetryExecutor executor = executor(config, clock, new RecordingSleeper(clock), RetryListener.NOOP);
        AtomicInteger invocations = new AtomicInteger();

        RetryExhaustedException e = Assertions.assertThrows(RetryExhaustedException.class, () -> executor.execute(attempt -> {
            invocations.incrementAndGet();
            throw new IOException("down");
        }, "exhaust"));
        Assertions.assertEquals(3, invocations.get());
        Assertions.assertEquals(3, e.attempts());
        Assertions.assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void nonRetryableErrorIsRethrownImmediately() {
        MutableClock clock = new MutableClock(0L);
        RecordingSleeper sleeper = new RecordingSleeper(clock);
        RetryExecutor executor = executor(RetryConfig.defaults(), clock, sleeper, RetryListener.NOOP);
        AtomicInteger invocations = new AtomicInteger();

        Assertions.assertThrows(NonRetryableException.class, () -> executor.execute(attempt -> {
            invocations.incrementAndGet();
            throw new NonRetryableException("bad input");
        }, "fatal"));
        Assertions.assertEquals(1, invocations.get());
        Assertions.assertTrue(sleeper.sleeps().isEmpty());
    }

    @Test
    void totalTimeoutStopsFurtherAttempts() {
        MutableClock clock = new MutableClock(0L);
        RetryConfig config = new RetryConfig(5, 1_000L, 30_000L, RetryStrategy.EXPONENTIAL, 0.0, 0L, 1_500L);
        RecordingSleeper sleeper = new RecordingSleeper(clock);
        RetryExecutor executor = executor(config, clock, sleeper, RetryListener.NOOP);

        RetryAbortedException e = Assertions.assertThrows(RetryAbortedException.class, () -> executor.execute(attempt -> {
            throw new IOException("slow dependency");
        }, "deadline"));
        Assertions.assertEquals(RetryAbortedException.Reason.TOTAL_TIMEOUT, e.reason());
        Assertions.assertEquals(2, e.attempts());
        Assertions.assertEquals(List.of(1_000L, 2_000L), sleeper.sleeps());
    }

    @Test
    void cancellationAbortsBeforeNextAttempt() {
        MutableClock clock = new MutableClock(0L);
        CancellationSignal signal = new CancellationSignal();
        RetryExecutor executor = executor(RetryConfig.defaults(), clock, new RecordingSleeper(clock),
                (attempt, error, delay) -> signal.cancel());
        AtomicInteger invocations = new AtomicInteger();

        RetryAbortedException e = Assertions.assertThrows(RetryAbortedException.class, () -> executor.execute(attempt -> {
            invocations.incrementAndGet();
            throw new IOException("once");
        }, "cancel", signal));
        Assertions.assertEquals(RetryAbortedException.Reason.CANCELLED, e.reason());
        Assertions.assertEquals(1, invocations.get());
    }

    @Test
    void interruptedWaitAbortsAndKeepsInterruptFlag() {
        MutableClock clock = new MutableClock(0L);
        Sleeper interrupting = millis -> {
            throw new InterruptedException("stop");
        };
        RetryExecutor executor = executor(RetryConfig.defaults(), clock, interrupting, RetryListener.NOOP);

        RetryAbortedException e = Assertions.assertThrows(RetryAbortedException.class, () -> executor.execute(attempt -> {
            throw new IOException("once");
        }, "interrupt"));
        Assertions.assertEquals(RetryAbortedException.Reason.CANCELLED, e.reason());
        Assertions.assertTrue(Thread.interrupted());
    }

    @Test
    void slowAttemptTimesOutAndIsRetried() {
        MutableClock clock = new MutableClock(0L);
        RetryConfig config = new RetryConfig(2, 10L, 10L, RetryStrategy.FIXED, 0.0, 50L, 0L);
        RetryExecutor executor = executor(config, clock, new RecordingSleeper(clock), RetryListener.NOOP);
        AtomicInteger invocations = new AtomicInteger();

        RetryExhaustedException e = Assertions.assertThrows(RetryExhaustedException.class, () -> executor.execute(attempt -> {
            invocations.incrementAndGet();
            Thread.sleep(2_000L);
            return "late";
        }, "slow"));
        Assertions.assertEquals(2, invocations.get());
        Assertions.assertInstanceOf(OperationTimeoutException.class, e.getCause());
    }
}
