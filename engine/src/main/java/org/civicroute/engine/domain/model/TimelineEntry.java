package org.civicroute.engine.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Audit line appended to a work item's timeline.
 * A null {@code updatedBy} marks a system-originated entry.
 */
public final class TimelineEntry {

    private final ItemStatus status;
    private final String description;
    private final String updatedBy;
    private final Instant createdAt;

    public TimelineEntry(ItemStatus status, String description, String updatedBy, Instant createdAt) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.description = Objects.requireNonNull(description, "description must not be null");
        this.updatedBy = updatedBy;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    public static TimelineEntry system(ItemStatus status, String description, Instant createdAt) {
        return new TimelineEntry(status, description, null, createdAt);
    }

    public ItemStatus getStatus() {
        return status;
    }

    public String getDescription() {
        return description;
    }

    public String getUpdatedBy() {
        return updatedBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "TimelineEntry{status=" + status + ", description='" + description + "'}";
    }
}
