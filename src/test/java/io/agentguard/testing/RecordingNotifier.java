package io.agentguard.testing;

import io.agentguard.observability.Notification;
import io.agentguard.observability.Notifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class RecordingNotifier implements Notifier {
    private final List<Notification> received = new CopyOnWriteArrayList<>();

    @Override
    public void notify(Notification notification) {
        received.add(notification);
    }

    public List<Notification> received() {
        return List.copyOf(received);
    }
}
