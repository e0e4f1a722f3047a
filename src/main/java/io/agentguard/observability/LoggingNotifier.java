package io.agentguard.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger("io.agentguard.alerts");

    @Override
    public void notify(Notification notification) {
        String actions = notification.actions().isEmpty() ? "" : " " + notification.actions();
        switch (notification.level()) {
            case ERROR -> log.error("{}{}", notification.message(), actions);
            case WARNING -> log.warn("{}{}", notification.message(), actions);
            default -> log.info("{}{}", notification.message(), actions);
        }
    }
}
