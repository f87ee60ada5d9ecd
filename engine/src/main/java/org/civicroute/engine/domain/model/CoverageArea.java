package org.civicroute.engine.domain.model;

/**
 * Geographic area served by a handling unit.
 */
public interface CoverageArea {

    /**
     * Check whether the given point lies inside this area.
     */
    boolean contains(GeoPoint point);
}
