package io.agentguard.observability;

/**
 * Append-only sink for reliability events: circuit transitions, dead-letter
 * lifecycle, health changes and admission blocks.
 */
public interface EventJournal {
    EventJournal NOOP = event -> {
    };

    void record(JournalEvent event);
}
