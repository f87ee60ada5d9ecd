package org.civicroute.engine.domain.model;

import java.util.Objects;

/**
 * Coverage defined by a center point and a radius.
 */
public final class CircleCoverage implements CoverageArea {

    private final GeoPoint center;
    private final double radiusMeters;

    public CircleCoverage(GeoPoint center, double radiusMeters) {
        this.center = Objects.requireNonNull(center, "center must not be null");
        if (radiusMeters < 0) {
            throw new IllegalArgumentException("radiusMeters must not be negative");
        }
        this.radiusMeters = radiusMeters;
    }

    @Override
    public boolean contains(GeoPoint point) {
        if (point == null) {
            return false;
        }
        return center.distanceMetersTo(point) <= radiusMeters;
    }

    public GeoPoint getCenter() {
        return center;
    }

    public double getRadiusMeters() {
        return radiusMeters;
    }

    @Override
    public String toString() {
        return String.format("CircleCoverage{center=%s, radius=%.0fm}", center, radiusMeters);
    }
}
