package org.civicroute.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Request body for POST /events, relayed by the API to socket subscribers.
 */
public final class EventDto {

    @JsonProperty("event")
    private final String event;

    @JsonProperty("payload")
    private final Map<String, Object> payload;

    public EventDto(String event, Map<String, Object> payload) {
        this.event = event;
        this.payload = payload;
    }

    public String getEvent() {
        return event;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }
}
