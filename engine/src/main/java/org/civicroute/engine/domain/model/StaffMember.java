package org.civicroute.engine.domain.model;

import java.util.Objects;

/**
 * Field worker or officer belonging to a handling unit.
 */
public final class StaffMember {

    private final String id;
    private final String unitId;
    private final String name;
    private final boolean active;

    public StaffMember(String id, String unitId, String name, boolean active) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.unitId = Objects.requireNonNull(unitId, "unitId must not be null");
        this.name = name != null ? name : id;
        this.active = active;
    }

    public String getId() {
        return id;
    }

    public String getUnitId() {
        return unitId;
    }

    public String getName() {
        return name;
    }

    public boolean isActive() {
        return active;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StaffMember)) {
            return false;
        }
        StaffMember that = (StaffMember) o;
        return active == that.active && id.equals(that.id) && unitId.equals(that.unitId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, unitId, active);
    }

    @Override
    public String toString() {
        return "StaffMember{id='" + id + "', unitId='" + unitId + "', active=" + active + "}";
    }
}
