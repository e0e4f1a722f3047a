package io.agentguard.observability;

/**
 * User-facing alert channel. Only conditions a person should act on go here;
 * everything else is logged.
 */
public interface Notifier {
    Notifier NOOP = notification -> {
    };

    void notify(Notification notification);
}
