package org.civicroute.engine.cache;

import org.civicroute.engine.domain.model.RegistrySnapshot;

/**
 * Holds the latest known set of active handling units.
 */
public interface HandlingUnitRegistry {

    /**
     * Load active units from the store and swap them in.
     * On failure the previous snapshot stays in place.
     *
     * @return true if a new snapshot was installed
     */
    boolean refresh();

    /**
     * Current snapshot. Never blocks on I/O.
     */
    RegistrySnapshot snapshot();

    /**
     * Check if at least one refresh has succeeded.
     */
    boolean isInitialized();
}
