package org.civicroute.engine.domain.model;

import java.util.Objects;

/**
 * Immutable view of a reported civic issue as read from the item store.
 */
public final class WorkItem {

    private final String id;
    private final String title;
    private final String category;
    private final GeoPoint location;
    private final Priority priority;
    private final ItemStatus status;
    private final String reporterId;
    private final Assignment assignment;

    private WorkItem(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.title = builder.title != null ? builder.title : "";
        this.category = Objects.requireNonNull(builder.category, "category must not be null");
        this.location = builder.location;
        this.priority = builder.priority != null ? builder.priority : Priority.MEDIUM;
        this.status = builder.status != null ? builder.status : ItemStatus.NEW;
        this.reporterId = builder.reporterId;
        this.assignment = builder.assignment;
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getCategory() {
        return category;
    }

    public GeoPoint getLocation() {
        return location;
    }

    public Priority getPriority() {
        return priority;
    }

    public ItemStatus getStatus() {
        return status;
    }

    public String getReporterId() {
        return reporterId;
    }

    /**
     * Current assignment, or null while unassigned.
     */
    public Assignment getAssignment() {
        return assignment;
    }

    public boolean isAssigned() {
        return assignment != null;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .title(title)
                .category(category)
                .location(location)
                .priority(priority)
                .status(status)
                .reporterId(reporterId)
                .assignment(assignment);
    }

    @Override
    public String toString() {
        return "WorkItem{" +
                "id='" + id + '\'' +
                ", category='" + category + '\'' +
                ", priority=" + priority +
                ", status=" + status +
                ", assigned=" + isAssigned() +
                '}';
    }

    /**
     * Builder for WorkItem.
     */
    public static final class Builder {
        private String id;
        private String title;
        private String category;
        private GeoPoint location;
        private Priority priority;
        private ItemStatus status;
        private String reporterId;
        private Assignment assignment;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder location(GeoPoint location) {
            this.location = location;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder status(ItemStatus status) {
            this.status = status;
            return this;
        }

        public Builder reporterId(String reporterId) {
            this.reporterId = reporterId;
            return this;
        }

        public Builder assignment(Assignment assignment) {
            this.assignment = assignment;
            return this;
        }

        public WorkItem build() {
            return new WorkItem(this);
        }
    }
}
