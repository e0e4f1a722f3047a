package io.agentguard.retry;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Maps a failed attempt number (1-based) to the wait before the next attempt.
 */
public final class BackoffCalculator {
    private static final int FIBONACCI_CACHE_SIZE = 92;
    private static final long[] FIBONACCI = new long[FIBONACCI_CACHE_SIZE + 1];

    static {
        FIBONACCI[1] = 1L;
        FIBONACCI[2] = 1L;
        for (int i = 3; i <= FIBONACCI_CACHE_SIZE; i++) {
            FIBONACCI[i] = FIBONACCI[i - 1] + FIBONACCI[i - 2];
        }
    }

    private final RetryConfig config;
    private final DoubleSupplier random;

    public BackoffCalculator(RetryConfig config) {
        this(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    public BackoffCalculator(RetryConfig config, DoubleSupplier random) {
        this.config = config;
        this.random = random;
    }

    public long delayMs(int attempt) {
        int n = Math.max(1, attempt);
        long base = config.baseDelayMs();
        long max = config.maxDelayMs();
        if (config.strategy() == RetryStrategy.DECORRELATED) {
            double previous = n == 1 ? base : base * Math.pow(2, n - 2);
            double upper = Math.min((double) max, previous * 3.0);
            double delay = base + random.getAsDouble() * Math.max(0.0, upper - base);
            return Math.min(max, Math.round(delay));
        }
        double raw = switch (config.strategy()) {
            case EXPONENTIAL -> base * Math.pow(2, n - 1);
            case LINEAR -> (double) base * n;
            case FIXED -> base;
            case FIBONACCI -> (double) base * fibonacci(n);
            default -> base;
        };
        double capped = Math.min((double) max, raw);
        double jitter = capped * config.jitterFactor() * (random.getAsDouble() * 2.0 - 1.0);
        double jittered = Math.max(0.0, capped + jitter);
        return Math.min(max, Math.round(jittered));
    }

    static long fibonacci(int n) {
        if (n <= 0) {
            return 0L;
        }
        if (n > FIBONACCI_CACHE_SIZE) {
            return Long.MAX_VALUE;
        }
        return FIBONACCI[n];
    }
}
