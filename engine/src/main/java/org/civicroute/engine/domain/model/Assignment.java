package org.civicroute.engine.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Current binding of a work item to a handling unit and, optionally, a staff member.
 */
public final class Assignment {

    private final String itemId;
    private final String unitId;
    private final String unitName;
    private final String staffId;
    private final Instant assignedAt;
    private final boolean autoAssigned;

    private Assignment(Builder builder) {
        this.itemId = Objects.requireNonNull(builder.itemId, "itemId must not be null");
        this.unitId = Objects.requireNonNull(builder.unitId, "unitId must not be null");
        this.unitName = builder.unitName != null ? builder.unitName : builder.unitId;
        this.staffId = builder.staffId;
        this.assignedAt = Objects.requireNonNull(builder.assignedAt, "assignedAt must not be null");
        this.autoAssigned = builder.autoAssigned;
    }

    public String getItemId() {
        return itemId;
    }

    public String getUnitId() {
        return unitId;
    }

    public String getUnitName() {
        return unitName;
    }

    /**
     * Null when no active staff member was available (unit-only assignment).
     */
    public String getStaffId() {
        return staffId;
    }

    public boolean hasStaff() {
        return staffId != null;
    }

    public Instant getAssignedAt() {
        return assignedAt;
    }

    public boolean isAutoAssigned() {
        return autoAssigned;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Assignment)) {
            return false;
        }
        Assignment that = (Assignment) o;
        return autoAssigned == that.autoAssigned
                && itemId.equals(that.itemId)
                && unitId.equals(that.unitId)
                && Objects.equals(staffId, that.staffId)
                && assignedAt.equals(that.assignedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(itemId, unitId, staffId, assignedAt, autoAssigned);
    }

    @Override
    public String toString() {
        return "Assignment{" +
                "itemId='" + itemId + '\'' +
                ", unitId='" + unitId + '\'' +
                ", staffId='" + staffId + '\'' +
                ", assignedAt=" + assignedAt +
                ", autoAssigned=" + autoAssigned +
                '}';
    }

    /**
     * Builder for Assignment.
     */
    public static final class Builder {
        private String itemId;
        private String unitId;
        private String unitName;
        private String staffId;
        private Instant assignedAt;
        private boolean autoAssigned = true;

        public Builder itemId(String itemId) {
            this.itemId = itemId;
            return this;
        }

        public Builder unitId(String unitId) {
            this.unitId = unitId;
            return this;
        }

        public Builder unitName(String unitName) {
            this.unitName = unitName;
            return this;
        }

        public Builder staffId(String staffId) {
            this.staffId = staffId;
            return this;
        }

        public Builder assignedAt(Instant assignedAt) {
            this.assignedAt = assignedAt;
            return this;
        }

        public Builder autoAssigned(boolean autoAssigned) {
            this.autoAssigned = autoAssigned;
            return this;
        }

        public Assignment build() {
            return new Assignment(this);
        }
    }
}
