package io.agentguard.util;

import io.agentguard.error.OperationTimeoutException;

import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a call on a worker thread and waits for it with a deadline. A call that
 * misses the deadline is cancelled and its eventual result is discarded.
 */
public final class TimeLimiter {
    private static final TimeLimiter SHARED = new TimeLimiter(Threads.cached("agentguard-call"));

    private final ExecutorService executor;

    public TimeLimiter(ExecutorService executor) {
        this.executor = executor;
    }

    public static TimeLimiter shared() {
        return SHARED;
    }

    public <T> T call(Callable<T> operation, long timeoutMs, String name) throws Exception {
        if (timeoutMs <= 0L) {
            return operation.call();
        }
        Future<T> future = executor.submit(operation);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new OperationTimeoutException(name, timeoutMs);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } catch (CancellationException e) {
            throw new InterruptedException(name + " cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new RuntimeException(name + " failed", cause);
        }
    }
}
