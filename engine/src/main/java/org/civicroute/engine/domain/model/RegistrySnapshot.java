package org.civicroute.engine.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable point-in-time copy of the active handling units.
 * Swapped as a whole on refresh, so readers never see a half-loaded registry.
 */
public final class RegistrySnapshot {

    private static final RegistrySnapshot EMPTY = new RegistrySnapshot(Collections.emptyList(), Instant.EPOCH);

    private final List<HandlingUnit> units;
    private final Map<String, HandlingUnit> unitsById;
    private final Instant loadedAt;

    public RegistrySnapshot(Collection<HandlingUnit> units, Instant loadedAt) {
        Objects.requireNonNull(units, "units must not be null");
        this.loadedAt = Objects.requireNonNull(loadedAt, "loadedAt must not be null");
        Map<String, HandlingUnit> byId = new LinkedHashMap<>();
        for (HandlingUnit unit : units) {
            byId.put(unit.getId(), unit);
        }
        this.units = Collections.unmodifiableList(new ArrayList<>(byId.values()));
        this.unitsById = Collections.unmodifiableMap(byId);
    }

    public static RegistrySnapshot empty() {
        return EMPTY;
    }

    public List<HandlingUnit> getUnits() {
        return units;
    }

    public Optional<HandlingUnit> findUnit(String unitId) {
        return Optional.ofNullable(unitsById.get(unitId));
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    public int size() {
        return units.size();
    }

    public boolean isEmpty() {
        return units.isEmpty();
    }

    @Override
    public String toString() {
        return "RegistrySnapshot{units=" + units.size() + ", loadedAt=" + loadedAt + "}";
    }
}
