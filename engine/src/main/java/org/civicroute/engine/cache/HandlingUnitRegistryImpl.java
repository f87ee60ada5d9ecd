package org.civicroute.engine.cache;

import org.civicroute.engine.api.ExternalCallExecutor;
import org.civicroute.engine.api.HandlingUnitRepository;
import org.civicroute.engine.domain.model.HandlingUnit;
import org.civicroute.engine.domain.model.RegistrySnapshot;
import org.civicroute.engine.exception.RegistryLoadException;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Copy-on-refresh registry. Readers take the current snapshot reference without locking;
 * refresh builds a complete new snapshot and publishes it in one atomic swap.
 */
public final class HandlingUnitRegistryImpl implements HandlingUnitRegistry {

    private static final Logger LOG = Logger.getLogger(HandlingUnitRegistryImpl.class.getName());

    private final HandlingUnitRepository unitRepository;
    private final ExternalCallExecutor calls;
    private final Clock clock;
    private final AtomicReference<RegistrySnapshot> current = new AtomicReference<>(RegistrySnapshot.empty());

    private volatile boolean initialized = false;

    public HandlingUnitRegistryImpl(HandlingUnitRepository unitRepository, ExternalCallExecutor calls, Clock clock) {
        this.unitRepository = Objects.requireNonNull(unitRepository, "unitRepository must not be null");
        this.calls = Objects.requireNonNull(calls, "calls must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public boolean refresh() {
        LOG.info("Refreshing handling unit registry...");

        try {
            List<HandlingUnit> loaded = calls.call("Load active handling units",
                    unitRepository::findAllActive, RegistryLoadException::new);
            if (loaded == null) {
                throw new RegistryLoadException("Unit store returned no unit list");
            }

            // inactive units never enter a snapshot, whatever the store returned
            List<HandlingUnit> active = loaded.stream()
                    .filter(Objects::nonNull)
                    .filter(HandlingUnit::isActive)
                    .collect(Collectors.toList());

            RegistrySnapshot next = new RegistrySnapshot(active, clock.instant());
            RegistrySnapshot previous = current.getAndSet(next);
            initialized = true;

            LOG.info(() -> String.format("Registry refresh complete: %d active units (previously %d)",
                    next.size(), previous.size()));
            return true;

        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, e, () -> "Failed to refresh handling unit registry, keeping snapshot from "
                    + current.get().getLoadedAt());
            return false;
        }
    }

    @Override
    public RegistrySnapshot snapshot() {
        return current.get();
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }
}
