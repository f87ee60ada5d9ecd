package org.civicroute.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Coverage defined by a simple polygon. Containment uses ray casting on
 * raw lat/lon, which is accurate enough for city-sized districts.
 */
public final class PolygonCoverage implements CoverageArea {

    private final List<GeoPoint> vertices;

    public PolygonCoverage(List<GeoPoint> vertices) {
        Objects.requireNonNull(vertices, "vertices must not be null");
        if (vertices.size() < 3) {
            throw new IllegalArgumentException("polygon needs at least 3 vertices, got " + vertices.size());
        }
        this.vertices = Collections.unmodifiableList(new ArrayList<>(vertices));
    }

    @Override
    public boolean contains(GeoPoint point) {
        if (point == null) {
            return false;
        }
        double x = point.getLongitude();
        double y = point.getLatitude();
        boolean inside = false;
        for (int i = 0, j = vertices.size() - 1; i < vertices.size(); j = i++) {
            double xi = vertices.get(i).getLongitude();
            double yi = vertices.get(i).getLatitude();
            double xj = vertices.get(j).getLongitude();
            double yj = vertices.get(j).getLatitude();
            boolean crosses = (yi > y) != (yj > y)
                    && x < (xj - xi) * (y - yi) / (yj - yi) + xi;
            if (crosses) {
                inside = !inside;
            }
        }
        return inside;
    }

    public List<GeoPoint> getVertices() {
        return vertices;
    }

    @Override
    public String toString() {
        return "PolygonCoverage{vertices=" + vertices.size() + "}";
    }
}
