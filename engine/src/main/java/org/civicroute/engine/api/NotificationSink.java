package org.civicroute.engine.api;

import java.util.Map;

/**
 * Fire-and-forget user notifications. Failures are logged by implementations, not thrown.
 */
public interface NotificationSink {

    void notify(String userId, String type, String title, String message, Map<String, Object> data);
}
