package org.civicroute.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.civicroute.engine.domain.model.TimelineEntry;

/**
 * Timeline line sent along with assignment writes.
 */
public final class TimelineEntryDto {

    @JsonProperty("status")
    private final String status;

    @JsonProperty("description")
    private final String description;

    @JsonProperty("updatedBy")
    private final String updatedBy;

    @JsonProperty("updatedAt")
    private final String updatedAt;

    private TimelineEntryDto(String status, String description, String updatedBy, String updatedAt) {
        this.status = status;
        this.description = description;
        this.updatedBy = updatedBy;
        this.updatedAt = updatedAt;
    }

    public static TimelineEntryDto from(TimelineEntry entry) {
        return new TimelineEntryDto(entry.getStatus().code(), entry.getDescription(),
                entry.getUpdatedBy(), entry.getCreatedAt().toString());
    }

    public String getStatus() {
        return status;
    }

    public String getDescription() {
        return description;
    }

    public String getUpdatedBy() {
        return updatedBy;
    }

    public String getUpdatedAt() {
        return updatedAt;
    }
}
