package org.civicroute.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Request body for POST /notifications.
 */
public final class NotificationDto {

    @JsonProperty("recipient")
    private final String recipient;

    @JsonProperty("type")
    private final String type;

    @JsonProperty("title")
    private final String title;

    @JsonProperty("message")
    private final String message;

    @JsonProperty("data")
    private final Map<String, Object> data;

    public NotificationDto(String recipient, String type, String title, String message, Map<String, Object> data) {
        this.recipient = recipient;
        this.type = type;
        this.title = title;
        this.message = message;
        this.data = data;
    }

    public String getRecipient() {
        return recipient;
    }

    public String getType() {
        return type;
    }

    public String getTitle() {
        return title;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getData() {
        return data;
    }
}
