package io.agentguard.dlq;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentguard.observability.EventJournal;
import io.agentguard.observability.JournalEvent;
import io.agentguard.observability.Notification;
import io.agentguard.observability.Notifier;
import io.agentguard.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Durable holding area for operations that exhausted their retries. Messages are
 * replayed through the processor registered for their source until they either
 * succeed or reach {@code maxRetries} failed replays, at which point they expire.
 *
 * <p>One processing cycle runs at a time, and a message is never replayed by two
 * threads at once: a per-message in-flight set is shared by the scheduled cycle
 * and {@link #retryMessage(String)}. A message being added is in flight until it
 * has been written to the store.
 *
 * <p>Store writes only happen while the message is still indexed, and deletes only
 * after it left the index, both under {@code storeLock}, so a recovered, expired or
 * discarded message never reappears in the store.
 */
public final class DeadLetterQueue implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DeadLetterQueue.class);
    private static final int MAX_STACK_CHARS = 8_192;

    private final String name;
    private final DeadLetterConfig config;
    private final DeadLetterStore store;
    private final Clock clock;
    private final Notifier notifier;
    private final EventJournal journal;
    private final Map<String, MessageProcessor> processors = new ConcurrentHashMap<>();
    private final Map<String, DeadLetterMessage> messages = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final List<DeadLetterListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean processing = new AtomicBoolean(false);
    private final Object capacityLock = new Object();
    private final Object storeLock = new Object();
    private final AtomicLong totalMessages = new AtomicLong(0L);
    private final AtomicLong processedMessages = new AtomicLong(0L);
    private final AtomicLong recoveredMessages = new AtomicLong(0L);
    private final AtomicLong expiredMessages = new AtomicLong(0L);
    private final AtomicLong evictedMessages = new AtomicLong(0L);
    private ScheduledFuture<?> processTask;

    public DeadLetterQueue(String name, DeadLetterConfig config, DeadLetterStore store) {
        this(name, config, store, Clock.systemUTC(), Notifier.NOOP, EventJournal.NOOP);
    }

    public DeadLetterQueue(
            String name,
            DeadLetterConfig config,
            DeadLetterStore store,
            Clock clock,
            Notifier notifier,
            EventJournal journal
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("queue name cannot be empty");
        }
        this.name = name;
        this.config = config;
        this.store = config.persist() && store != null ? store : DeadLetterStore.NOOP;
        this.clock = clock;
        this.notifier = notifier == null ? Notifier.NOOP : notifier;
        this.journal = journal == null ? EventJournal.NOOP : journal;
    }

    public String name() {
        return name;
    }

    public DeadLetterConfig config() {
        return config;
    }

    public void addListener(DeadLetterListener listener) {
        listeners.add(listener);
    }

    public void registerProcessor(String source, MessageProcessor processor) {
        processors.put(source, processor);
        log.info("DLQ {} registered processor for source {}", name, source);
    }

    public DeadLetterMessage addMessage(JsonNode payload, Throwable error, String source, Map<String, Object> metadata) {
        return addMessage(payload, describe(error), stackTrace(error), source, metadata);
    }

    /**
     * Queues a failed payload. Never throws for persistence problems; those are
     * logged and the message stays queued in memory.
     */
    public DeadLetterMessage addMessage(JsonNode payload, String error, String errorStack, String source, Map<String, Object> metadata) {
        long now = clock.millis();
        DeadLetterMessage message = new DeadLetterMessage(
                newId(now),
                payload == null ? Jsons.mapper().nullNode() : payload,
                error == null ? "unknown error" : error,
                errorStack,
                0,
                now,
                now,
                source,
                metadata,
                null
        );
        DeadLetterMessage evicted = null;
        inFlight.add(message.id());
        try {
            synchronized (capacityLock) {
                if (messages.size() >= config.maxQueueSize()) {
                    evicted = oldest();
                    if (evicted != null) {
                        messages.remove(evicted.id());
                    }
                }
                messages.put(message.id(), message);
            }
            persistIfIndexed(message);
        } finally {
            inFlight.remove(message.id());
        }
        totalMessages.incrementAndGet();
        if (evicted != null) {
            evictedMessages.incrementAndGet();
            log.error("DLQ {} is full ({}); evicted oldest message {}", name, config.maxQueueSize(), evicted.id());
            deleteQuietly(evicted.id());
            journal.record(JournalEvent.of("dlq.evict", "dlq/" + name, "evicted",
                    Map.of("message_id", evicted.id(), "source", String.valueOf(evicted.source()))));
            for (DeadLetterListener listener : listeners) {
                try {
                    listener.onQueueFull(evicted);
                } catch (RuntimeException e) {
                    log.error("DLQ {} queue-full listener failed", name, e);
                }
            }
        }
        log.warn("DLQ {} added message {} from {}: {}", name, message.id(), source, message.error());
        journal.record(JournalEvent.of("dlq.enqueue", "dlq/" + name, "queued",
                Map.of("message_id", message.id(), "source", String.valueOf(source), "error", message.error())));
        if (message.critical()) {
            notifier.notify(Notification.warning("Critical message failed: " + message.error(), "View DLQ"));
        }
        return message;
    }

    /**
     * Replays every due message once. Returns the number of messages replayed;
     * returns 0 without doing anything when another cycle is still running.
     */
    public int processDueMessages() {
        if (!processing.compareAndSet(false, true)) {
            log.debug("DLQ {} processing cycle already running", name);
            return 0;
        }
        try {
            long now = clock.millis();
            List<DeadLetterMessage> due = new ArrayList<>();
            for (DeadLetterMessage message : messages.values()) {
                if (message.dueAt(now)) {
                    due.add(message);
                }
            }
            due.sort(Comparator.comparingLong(DeadLetterMessage::firstFailureTime));
            int replayed = 0;
            for (DeadLetterMessage message : due) {
                ProcessOutcome outcome = process(message.id());
                if (outcome != ProcessOutcome.SKIPPED) {
                    replayed++;
                }
            }
            if (!due.isEmpty()) {
                log.debug("DLQ {} processed {} of {} due messages", name, replayed, due.size());
            }
            return replayed;
        } finally {
            processing.set(false);
        }
    }

    /**
     * Replays one message now, ignoring its schedule.
     *
     * @throws IllegalArgumentException when no message has this id
     */
    public ProcessOutcome retryMessage(String id) {
        if (!messages.containsKey(id)) {
            throw new IllegalArgumentException("Message " + id + " not found in DLQ " + name);
        }
        return process(id);
    }

    /**
     * Loads persisted messages. Messages that already used their retry budget
     * expire immediately.
     */
    public int restore() {
        List<DeadLetterMessage> loaded;
        try {
            loaded = store.loadAll(name);
        } catch (IOException e) {
            log.error("DLQ {} failed to load persisted messages", name, e);
            return 0;
        }
        int restored = 0;
        List<String> evicted = new ArrayList<>();
        for (DeadLetterMessage message : loaded) {
            if (message.attempts() >= config.maxRetries()) {
                messages.remove(message.id());
                expire(message);
                continue;
            }
            synchronized (capacityLock) {
                messages.put(message.id(), message);
                while (messages.size() > config.maxQueueSize()) {
                    DeadLetterMessage oldest = oldest();
                    if (oldest == null) {
                        break;
                    }
                    messages.remove(oldest.id());
                    evictedMessages.incrementAndGet();
                    evicted.add(oldest.id());
                }
            }
            restored++;
        }
        for (String id : evicted) {
            deleteQuietly(id);
        }
        if (restored > 0) {
            log.info("DLQ {} loaded {} persisted messages", name, restored);
        }
        return restored;
    }

    /**
     * Schedules processing cycles. Persisted messages are not loaded here; call
     * {@link #restore()} first.
     */
    public synchronized void start(ScheduledExecutorService scheduler) {
        if (processTask != null) {
            return;
        }
        processTask = scheduler.scheduleWithFixedDelay(() -> {
            try {
                processDueMessages();
            } catch (RuntimeException e) {
                log.error("DLQ {} processing cycle failed", name, e);
            }
        }, config.processIntervalMs(), config.processIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("DLQ {} started processing (interval: {}ms)", name, config.processIntervalMs());
    }

    public synchronized void stop() {
        if (processTask != null) {
            processTask.cancel(false);
            processTask = null;
            log.info("DLQ {} stopped processing", name);
        }
    }

    @Override
    public void close() {
        stop();
    }

    public List<DeadLetterMessage> messages() {
        List<DeadLetterMessage> out = new ArrayList<>(messages.values());
        out.sort(Comparator.comparingLong(DeadLetterMessage::firstFailureTime));
        return out;
    }

    public Optional<DeadLetterMessage> message(String id) {
        return Optional.ofNullable(messages.get(id));
    }

    public int size() {
        return messages.size();
    }

    /**
     * Removes a message without replaying it. Returns false when the message is
     * unknown or is being added or replayed right now.
     */
    public boolean discard(String id) {
        if (!inFlight.add(id)) {
            log.warn("DLQ {} message {} is in flight; not discarded", name, id);
            return false;
        }
        try {
            DeadLetterMessage removed = messages.remove(id);
            if (removed == null) {
                return false;
            }
            deleteQuietly(id);
        } finally {
            inFlight.remove(id);
        }
        journal.record(JournalEvent.of("dlq.discard", "dlq/" + name, "discarded", Map.of("message_id", id)));
        return true;
    }

    /**
     * Drops every message that is not in flight. The store is wiped only when
     * nothing was in flight; otherwise the dropped messages are deleted one by one.
     */
    public int clear() {
        List<String> dropped = new ArrayList<>();
        boolean skipped = false;
        synchronized (storeLock) {
            synchronized (capacityLock) {
                for (String id : new ArrayList<>(messages.keySet())) {
                    if (inFlight.contains(id)) {
                        skipped = true;
                    } else if (messages.remove(id) != null) {
                        dropped.add(id);
                    }
                }
            }
            try {
                if (skipped) {
                    for (String id : dropped) {
                        store.delete(name, id);
                    }
                } else {
                    store.clear(name);
                }
            } catch (IOException e) {
                log.error("DLQ {} failed to clear persisted messages", name, e);
            }
        }
        int cleared = dropped.size();
        log.info("DLQ {} cleared {} messages", name, cleared);
        return cleared;
    }

    public DeadLetterMetrics metrics() {
        long now = clock.millis();
        long totalRetries = 0L;
        long oldest = Long.MAX_VALUE;
        int size = 0;
        for (DeadLetterMessage message : messages.values()) {
            totalRetries += message.attempts();
            oldest = Math.min(oldest, message.firstFailureTime());
            size++;
        }
        return new DeadLetterMetrics(
                totalMessages.get(),
                processedMessages.get(),
                recoveredMessages.get(),
                expiredMessages.get(),
                evictedMessages.get(),
                size,
                size == 0 ? 0.0 : (double) totalRetries / size,
                size == 0 ? 0L : Math.max(0L, now - oldest)
        );
    }

    public String exportState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("name", name);
        state.put("exportedAt", clock.instant().toString());
        state.put("metrics", metrics());
        state.put("messages", messages());
        return Jsons.toJson(state);
    }

    private ProcessOutcome process(String id) {
        if (!inFlight.add(id)) {
            return ProcessOutcome.SKIPPED;
        }
        try {
            DeadLetterMessage message = messages.get(id);
            if (message == null) {
                return ProcessOutcome.SKIPPED;
            }
            MessageProcessor processor = processors.get(message.source());
            if (processor == null) {
                log.debug("DLQ {} has no processor for source {}", name, message.source());
                return ProcessOutcome.SKIPPED;
            }
            if (message.attempts() >= config.maxRetries()) {
                if (messages.remove(id, message)) {
                    expire(message);
                }
                return ProcessOutcome.EXPIRED;
            }
            log.debug("DLQ {} replaying message {} (attempt {})", name, id, message.attempts() + 1);
            try {
                processor.process(message.payload());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("DLQ {} replay of {} interrupted", name, id);
                return ProcessOutcome.SKIPPED;
            } catch (Exception e) {
                processedMessages.incrementAndGet();
                return recordFailure(message, e);
            }
            processedMessages.incrementAndGet();
            recover(message);
            return ProcessOutcome.RECOVERED;
        } finally {
            inFlight.remove(id);
        }
    }

    private ProcessOutcome recordFailure(DeadLetterMessage message, Exception error) {
        long now = clock.millis();
        int attempts = message.attempts() + 1;
        DeadLetterMessage updated = message.withFailure(describe(error), stackTrace(error), now, now + config.backoffMs(attempts));
        if (updated.attempts() >= config.maxRetries()) {
            if (messages.remove(message.id(), message)) {
                expire(updated);
            }
            return ProcessOutcome.EXPIRED;
        }
        if (messages.replace(message.id(), message, updated)) {
            log.warn("DLQ {} message {} failed again (attempt {}), next replay at {}",
                    name, message.id(), updated.attempts(), updated.retryAfter());
            persistIfIndexed(updated);
        }
        return ProcessOutcome.RETRY_SCHEDULED;
    }

    private void recover(DeadLetterMessage message) {
        messages.remove(message.id());
        deleteQuietly(message.id());
        recoveredMessages.incrementAndGet();
        log.info("DLQ {} recovered message {}", name, message.id());
        journal.record(JournalEvent.of("dlq.recover", "dlq/" + name, "recovered",
                Map.of("message_id", message.id(), "source", String.valueOf(message.source()), "attempts", message.attempts())));
        for (DeadLetterListener listener : listeners) {
            try {
                listener.onMessageRecovered(message);
            } catch (RuntimeException e) {
                log.error("DLQ {} recovered listener failed", name, e);
            }
        }
    }

    // Caller has already taken the message out of the index.
    private void expire(DeadLetterMessage message) {
        deleteQuietly(message.id());
        expiredMessages.incrementAndGet();
        log.error("DLQ {} message {} exceeded max retries ({}/{})",
                name, message.id(), message.attempts(), config.maxRetries());
        journal.record(JournalEvent.of("dlq.expire", "dlq/" + name, "expired",
                Map.of("message_id", message.id(), "source", String.valueOf(message.source()),
                        "attempts", message.attempts(), "error", String.valueOf(message.error()))));
        notifier.notify(Notification.error("Dead letter " + message.id() + " from " + message.source()
                + " permanently failed after " + message.attempts() + " replays: " + message.error()));
        for (DeadLetterListener listener : listeners) {
            try {
                listener.onMessageExpired(message);
            } catch (RuntimeException e) {
                log.error("DLQ {} expired listener failed", name, e);
            }
        }
    }

    private DeadLetterMessage oldest() {
        DeadLetterMessage oldest = null;
        for (DeadLetterMessage message : messages.values()) {
            if (oldest == null || message.firstFailureTime() < oldest.firstFailureTime()) {
                oldest = message;
            }
        }
        return oldest;
    }

    private void persistIfIndexed(DeadLetterMessage message) {
        synchronized (storeLock) {
            if (messages.get(message.id()) != message) {
                log.debug("DLQ {} message {} left the queue before it was persisted", name, message.id());
                return;
            }
            try {
                store.save(name, message);
            } catch (IOException | RuntimeException e) {
                log.error("DLQ {} failed to persist message {}", name, message.id(), e);
            }
        }
    }

    // Caller has already taken the message out of the index.
    private void deleteQuietly(String id) {
        synchronized (storeLock) {
            try {
                store.delete(name, id);
            } catch (IOException | RuntimeException e) {
                log.error("DLQ {} failed to delete persisted message {}", name, id, e);
            }
        }
    }

    private static String newId(long now) {
        return now + "-" + Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() == null ? error.getClass().getName() : error.getMessage();
    }

    private static String stackTrace(Throwable error) {
        if (error == null) {
            return null;
        }
        StringWriter sw = new StringWriter();
        error.printStackTrace(new PrintWriter(sw));
        String trace = sw.toString();
        return trace.length() <= MAX_STACK_CHARS ? trace : trace.substring(0, MAX_STACK_CHARS);
    }
}
