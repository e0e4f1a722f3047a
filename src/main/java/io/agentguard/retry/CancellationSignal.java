package io.agentguard.retry;

import java.util.concurrent.atomic.AtomicBoolean;

public final class CancellationSignal {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
