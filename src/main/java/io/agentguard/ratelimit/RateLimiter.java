package io.agentguard.ratelimit;

import io.agentguard.observability.EventJournal;
import io.agentguard.observability.JournalEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Admission control keyed by a caller-supplied key function. A rejected key is
 * blocked for {@code blockDurationMs}; while blocked it admits nothing.
 *
 * @param <C> request context the key is derived from
 */
public final class RateLimiter<C> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);
    static final long SWEEP_INTERVAL_MS = 10_000L;
    private static final String DEFAULT_KEY = "default";

    private final String name;
    private final RateLimitConfig config;
    private final Function<? super C, String> keyGenerator;
    private final Clock clock;
    private final DistributedAdmissionStore distributedStore;
    private final LimitReachedListener limitListener;
    private final EventJournal journal;
    private final Map<String, RateLimitEntry> entries = new ConcurrentHashMap<>();
    private final AtomicLong totalRequests = new AtomicLong(0L);
    private final AtomicLong allowedRequests = new AtomicLong(0L);
    private final AtomicLong blockedRequests = new AtomicLong(0L);
    private final AtomicLong distributedFallbacks = new AtomicLong(0L);
    private ScheduledFuture<?> sweepTask;

    public RateLimiter(RateLimitConfig config, Function<? super C, String> keyGenerator) {
        this("default", config, keyGenerator, Clock.systemUTC(), null, LimitReachedListener.NOOP, EventJournal.NOOP);
    }

    public RateLimiter(
            String name,
            RateLimitConfig config,
            Function<? super C, String> keyGenerator,
            Clock clock,
            DistributedAdmissionStore distributedStore,
            LimitReachedListener limitListener,
            EventJournal journal
    ) {
        this.name = name == null || name.isBlank() ? "default" : name;
        this.config = Objects.requireNonNull(config, "config");
        this.keyGenerator = keyGenerator == null ? ctx -> DEFAULT_KEY : keyGenerator;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.distributedStore = distributedStore;
        this.limitListener = limitListener == null ? LimitReachedListener.NOOP : limitListener;
        this.journal = journal == null ? EventJournal.NOOP : journal;
        if (config.windowMs() < 1_000L) {
            log.warn("Rate limiter {} uses a {}ms window; sub-second windows are imprecise", this.name, config.windowMs());
        }
        if (config.distributed() && distributedStore == null) {
            log.warn("Rate limiter {} is in distributed mode without a store; using local state", this.name);
        }
    }

    public RateLimitConfig config() {
        return config;
    }

    public RateLimitDecision isAllowed(C context) {
        return isAllowed(context, 1);
    }

    public RateLimitDecision isAllowed(C context, int cost) {
        if (cost < 1) {
            throw new IllegalArgumentException("cost must be at least 1");
        }
        String key = keyFor(context);
        totalRequests.incrementAndGet();
        RateLimitDecision decision = config.distributed() && distributedStore != null
                ? checkDistributed(key, cost)
                : checkLocal(key, cost);
        if (decision.allowed()) {
            allowedRequests.incrementAndGet();
        } else {
            blockedRequests.incrementAndGet();
        }
        return decision;
    }

    /**
     * Same as {@link #isAllowed(Object)} but raises {@link RateLimitedException} on rejection.
     */
    public void acquire(C context) {
        RateLimitDecision decision = isAllowed(context, 1);
        if (!decision.allowed()) {
            throw new RateLimitedException(decision.key(), decision.retryAfterMs());
        }
    }

    /**
     * Accounts for a completed request. Successful or failed requests are not
     * counted when the configuration skips them.
     */
    public boolean consume(C context, int cost, boolean success) {
        if (success && config.skipSuccessfulRequests()) {
            return true;
        }
        if (!success && config.skipFailedRequests()) {
            return true;
        }
        RateLimitDecision decision = isAllowed(context, cost);
        if (!decision.allowed()) {
            try {
                limitListener.onLimitReached(decision.key(), decision.retryAfterMs());
            } catch (RuntimeException e) {
                log.error("Limit listener failed for {}", decision.key(), e);
            }
        }
        return decision.allowed();
    }

    public void reset(C context) {
        String key = keyFor(context);
        entries.remove(key);
        if (config.distributed() && distributedStore != null) {
            try {
                distributedStore.reset(key);
            } catch (Exception e) {
                log.error("Failed to reset distributed rate limit key {}", key, e);
            }
        }
    }

    public RateLimitMetrics metrics() {
        long now = clock.millis();
        int blocked = 0;
        for (RateLimitEntry entry : entries.values()) {
            synchronized (entry) {
                if (entry.blocked && now < entry.blockUntilMs) {
                    blocked++;
                }
            }
        }
        return new RateLimitMetrics(
                totalRequests.get(),
                allowedRequests.get(),
                blockedRequests.get(),
                blocked,
                entries.size(),
                distributedFallbacks.get()
        );
    }

    /**
     * Evicts keys idle for more than two windows that are not blocked.
     */
    public int sweep() {
        long now = clock.millis();
        long expiredBefore = now - config.windowMs() * 2L;
        int[] removed = {0};
        entries.entrySet().removeIf(e -> {
            RateLimitEntry entry = e.getValue();
            synchronized (entry) {
                if (config.strategy() == RateLimitStrategy.SLIDING_WINDOW) {
                    pruneRequests(entry, now);
                }
                boolean stillBlocked = entry.blocked && now < entry.blockUntilMs;
                boolean idle = entry.lastSeenMs < expiredBefore && entry.requests.isEmpty() && !stillBlocked;
                if (idle) {
                    removed[0]++;
                }
                return idle;
            }
        });
        return removed[0];
    }

    public synchronized void start(ScheduledExecutorService scheduler) {
        if (sweepTask != null) {
            return;
        }
        sweepTask = scheduler.scheduleWithFixedDelay(this::sweep, SWEEP_INTERVAL_MS, SWEEP_INTERVAL_MS, TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void close() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
        entries.clear();
    }

    private String keyFor(C context) {
        String key = keyGenerator.apply(context);
        return key == null || key.isBlank() ? DEFAULT_KEY : key;
    }

    private RateLimitDecision checkDistributed(String key, int cost) {
        try {
            DistributedAdmissionStore.Admission admission = distributedStore.tryAcquire(
                    name + ":" + key, cost, config.maxRequests(), config.windowMs(), clock.millis());
            if (admission.allowed()) {
                return RateLimitDecision.allow(key);
            }
            long retryAfter = admission.retryAfterMs() > 0L ? admission.retryAfterMs() : config.windowMs();
            return RateLimitDecision.reject(key, retryAfter);
        } catch (Exception e) {
            distributedFallbacks.incrementAndGet();
            log.warn("Distributed rate limit check failed for {}, falling back to local state: {}", key, e.toString());
            return checkLocal(key, cost);
        }
    }

    private RateLimitDecision checkLocal(String key, int cost) {
        long now = clock.millis();
        RateLimitEntry entry = entries.computeIfAbsent(key, k -> newEntry(now));
        long blockedUntil;
        RateLimitDecision decision;
        synchronized (entry) {
            entry.lastSeenMs = now;
            if (entry.blocked && now < entry.blockUntilMs) {
                return RateLimitDecision.reject(key, entry.blockUntilMs - now);
            }
            if (entry.blocked) {
                entry.blocked = false;
                entry.blockUntilMs = 0L;
            }
            long retryAfter = applyStrategy(entry, now, cost);
            if (retryAfter < 0L) {
                return RateLimitDecision.allow(key);
            }
            if (config.blockDurationMs() > 0L) {
                entry.blocked = true;
                entry.blockUntilMs = now + config.blockDurationMs();
                retryAfter = Math.max(retryAfter, config.blockDurationMs());
            }
            blockedUntil = entry.blockUntilMs;
            decision = RateLimitDecision.reject(key, retryAfter);
        }
        log.info("Rate limit {} reached for key {}; retry after {}ms", name, key, decision.retryAfterMs());
        journal.record(JournalEvent.of(
                "ratelimit.block",
                "ratelimit/" + name,
                "blocked",
                Map.of("limiter_key", key, "retry_after_ms", decision.retryAfterMs(), "block_until_ms", blockedUntil)
        ));
        return decision;
    }

    private RateLimitEntry newEntry(long now) {
        double initial = config.strategy() == RateLimitStrategy.TOKEN_BUCKET ? config.maxRequests() : 0.0;
        return new RateLimitEntry(initial, now);
    }

    // Returns -1 when admitted, otherwise the wait in milliseconds.
    private long applyStrategy(RateLimitEntry entry, long now, int cost) {
        return switch (config.strategy()) {
            case TOKEN_BUCKET -> tokenBucket(entry, now, cost);
            case SLIDING_WINDOW -> slidingWindow(entry, now, cost);
            case FIXED_WINDOW -> fixedWindow(entry, now, cost);
            case LEAKY_BUCKET -> leakyBucket(entry, now, cost);
        };
    }

    private long tokenBucket(RateLimitEntry entry, long now, int cost) {
        double max = config.maxRequests();
        long elapsed = Math.max(0L, now - entry.lastRefillMs);
        entry.level = Math.min(max, entry.level + elapsed * max / config.windowMs());
        entry.lastRefillMs = now;
        if (entry.level >= cost) {
            entry.level -= cost;
            return -1L;
        }
        double needed = cost - entry.level;
        return (long) Math.ceil(needed * config.windowMs() / max);
    }

    private long slidingWindow(RateLimitEntry entry, long now, int cost) {
        pruneRequests(entry, now);
        if (entry.requests.size() + cost <= config.maxRequests()) {
            for (int i = 0; i < cost; i++) {
                entry.requests.addLast(now);
            }
            return -1L;
        }
        Long oldest = entry.requests.peekFirst();
        if (oldest == null) {
            return config.windowMs();
        }
        return Math.max(1L, oldest + config.windowMs() - now);
    }

    private long fixedWindow(RateLimitEntry entry, long now, int cost) {
        if (now - entry.lastRefillMs >= config.windowMs()) {
            entry.level = 0.0;
            entry.lastRefillMs = now;
        }
        if (entry.level + cost <= config.maxRequests()) {
            entry.level += cost;
            return -1L;
        }
        return Math.max(1L, config.windowMs() - (now - entry.lastRefillMs));
    }

    private long leakyBucket(RateLimitEntry entry, long now, int cost) {
        double max = config.maxRequests();
        long elapsed = Math.max(0L, now - entry.lastRefillMs);
        entry.level = Math.max(0.0, entry.level - elapsed * max / config.windowMs());
        entry.lastRefillMs = now;
        if (entry.level + cost <= max) {
            entry.level += cost;
            return -1L;
        }
        double overflow = entry.level + cost - max;
        return (long) Math.ceil(overflow * config.windowMs() / max);
    }

    private void pruneRequests(RateLimitEntry entry, long now) {
        long windowStart = now - config.windowMs();
        while (!entry.requests.isEmpty() && entry.requests.peekFirst() <= windowStart) {
            entry.requests.removeFirst();
        }
    }
}
