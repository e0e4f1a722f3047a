package io.agentguard.testing;

import io.agentguard.retry.Sleeper;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records requested waits and advances the clock instead of blocking.
 */
public final class RecordingSleeper implements Sleeper {
    private final MutableClock clock;
    private final List<Long> sleeps = new CopyOnWriteArrayList<>();

    public RecordingSleeper(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public void sleep(long millis) {
        sleeps.add(millis);
        clock.advance(millis);
    }

    public List<Long> sleeps() {
        return List.copyOf(sleeps);
    }

    public long total() {
        long sum = 0L;
        for (Long s : sleeps) {
            sum += s;
        }
        return sum;
    }
}
