package io.agentguard.retry;

import io.agentguard.error.NonRetryableException;

import java.util.concurrent.CancellationException;
import java.util.function.Predicate;

public final class RetryPredicates {
    private RetryPredicates() {
    }

    /**
     * Retries everything except programming errors, interruption and errors that
     * explicitly opt out through {@link NonRetryableException}.
     */
    public static Predicate<Throwable> defaultPredicate() {
        return RetryPredicates::isRetryable;
    }

    public static boolean isRetryable(Throwable error) {
        if (error == null) {
            return false;
        }
        if (error instanceof Error) {
            return false;
        }
        if (error instanceof NonRetryableException
                || error instanceof InterruptedException
                || error instanceof CancellationException) {
            return false;
        }
        return !(error instanceof NullPointerException
                || error instanceof IllegalArgumentException
                || error instanceof IllegalStateException
                || error instanceof ClassCastException
                || error instanceof UnsupportedOperationException);
    }
}
