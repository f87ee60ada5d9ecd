package org.civicroute.engine.api;

import java.util.Map;

/**
 * Best-effort publication of real-time events for dashboards and observers.
 */
public interface EventPublisher {

    void publish(String eventName, Map<String, Object> payload);
}
