package org.civicroute.engine.domain.model;

import java.util.Objects;

/**
 * Read-only diagnostic view of a unit's current load.
 */
public final class WorkloadReport {

    private final String unitId;
    private final int openCount;
    private final int maxConcurrentItems;
    private final double workloadRatio;

    public WorkloadReport(String unitId, int openCount, int maxConcurrentItems, double workloadRatio) {
        this.unitId = Objects.requireNonNull(unitId, "unitId must not be null");
        this.openCount = openCount;
        this.maxConcurrentItems = maxConcurrentItems;
        this.workloadRatio = workloadRatio;
    }

    public String getUnitId() {
        return unitId;
    }

    public int getOpenCount() {
        return openCount;
    }

    public int getMaxConcurrentItems() {
        return maxConcurrentItems;
    }

    public double getWorkloadRatio() {
        return workloadRatio;
    }

    public boolean isOverCapacity() {
        return workloadRatio >= 1.0;
    }

    @Override
    public String toString() {
        return String.format("WorkloadReport{unit='%s', open=%d/%d}", unitId, openCount, maxConcurrentItems);
    }
}
