package org.civicroute.engine.api;

import org.civicroute.engine.domain.model.HandlingUnit;

import java.util.List;

/**
 * Read access to the handling unit store.
 */
public interface HandlingUnitRepository {

    /**
     * Load every active unit together with its staff listing.
     */
    List<HandlingUnit> findAllActive();
}
