package org.civicroute.engine.support;

import org.civicroute.engine.api.NotificationSink;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Keeps every notification for later inspection.
 */
public final class RecordingNotificationSink implements NotificationSink {

    public static final class Sent {
        public final String userId;
        public final String type;
        public final String title;
        public final String message;
        public final Map<String, Object> data;

        Sent(String userId, String type, String title, String message, Map<String, Object> data) {
            this.userId = userId;
            this.type = type;
            this.title = title;
            this.message = message;
            this.data = data;
        }
    }

    private final List<Sent> sent = new CopyOnWriteArrayList<>();

    @Override
    public void notify(String userId, String type, String title, String message, Map<String, Object> data) {
        sent.add(new Sent(userId, type, title, message, data));
    }

    public List<Sent> all() {
        return sent;
    }

    public List<Sent> to(String userId) {
        return sent.stream().filter(s -> s.userId.equals(userId)).collect(Collectors.toList());
    }
}
