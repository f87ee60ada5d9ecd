package org.civicroute.engine.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable department definition as loaded from the unit store.
 * The engine only reads units; it never writes them back.
 */
public final class HandlingUnit {

    private final String id;
    private final String name;
    private final boolean active;
    private final Set<String> categories;
    private final CoverageArea coverage;
    private final UnitSettings settings;
    private final UnitStats stats;
    private final List<StaffMember> staff;

    private HandlingUnit(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.name = builder.name != null ? builder.name : builder.id;
        this.active = builder.active;
        this.categories = Collections.unmodifiableSet(new LinkedHashSet<>(builder.categories));
        this.coverage = builder.coverage;
        this.settings = builder.settings != null ? builder.settings : UnitSettings.defaults();
        this.stats = builder.stats != null ? builder.stats : UnitStats.empty();
        this.staff = Collections.unmodifiableList(new ArrayList<>(builder.staff));
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public boolean isActive() {
        return active;
    }

    public Set<String> getCategories() {
        return categories;
    }

    public boolean handlesCategory(String category) {
        return category != null && categories.contains(category);
    }

    /**
     * Null when the unit has no defined coverage area.
     */
    public CoverageArea getCoverage() {
        return coverage;
    }

    public boolean covers(GeoPoint point) {
        return coverage != null && point != null && coverage.contains(point);
    }

    public UnitSettings getSettings() {
        return settings;
    }

    public UnitStats getStats() {
        return stats;
    }

    /**
     * Staff in the order the unit store lists them. Staff selection relies on this order for ties.
     */
    public List<StaffMember> getStaff() {
        return staff;
    }

    @Override
    public String toString() {
        return "HandlingUnit{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", active=" + active +
                ", categories=" + categories +
                ", staff=" + staff.size() +
                '}';
    }

    /**
     * Builder for HandlingUnit.
     */
    public static final class Builder {
        private String id;
        private String name;
        private boolean active = true;
        private final Set<String> categories = new LinkedHashSet<>();
        private CoverageArea coverage;
        private UnitSettings settings;
        private UnitStats stats;
        private final List<StaffMember> staff = new ArrayList<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder categories(Collection<String> categories) {
            this.categories.clear();
            if (categories != null) {
                this.categories.addAll(categories);
            }
            return this;
        }

        public Builder category(String category) {
            this.categories.add(Objects.requireNonNull(category, "category must not be null"));
            return this;
        }

        public Builder coverage(CoverageArea coverage) {
            this.coverage = coverage;
            return this;
        }

        public Builder settings(UnitSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder stats(UnitStats stats) {
            this.stats = stats;
            return this;
        }

        public Builder staff(Collection<StaffMember> staff) {
            this.staff.clear();
            if (staff != null) {
                this.staff.addAll(staff);
            }
            return this;
        }

        public Builder staffMember(StaffMember member) {
            this.staff.add(Objects.requireNonNull(member, "member must not be null"));
            return this;
        }

        public HandlingUnit build() {
            return new HandlingUnit(this);
        }
    }
}
