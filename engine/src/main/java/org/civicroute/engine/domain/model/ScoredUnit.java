package org.civicroute.engine.domain.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A handling unit with its computed routing score and the workload it was scored against.
 */
public final class ScoredUnit implements Comparable<ScoredUnit> {

    /**
     * Ranking order: higher score first, then lower open count, then lower unit id.
     */
    public static final Comparator<ScoredUnit> RANKING_ORDER = Comparator
            .comparingDouble(ScoredUnit::getScore).reversed()
            .thenComparingInt(ScoredUnit::getOpenCount)
            .thenComparing(su -> su.getUnit().getId());

    private final HandlingUnit unit;
    private final double score;
    private final int openCount;
    private final double workloadRatio;

    public ScoredUnit(HandlingUnit unit, double score, int openCount, double workloadRatio) {
        this.unit = Objects.requireNonNull(unit, "unit must not be null");
        this.score = score;
        this.openCount = openCount;
        this.workloadRatio = workloadRatio;
    }

    public HandlingUnit getUnit() {
        return unit;
    }

    public double getScore() {
        return score;
    }

    public int getOpenCount() {
        return openCount;
    }

    public double getWorkloadRatio() {
        return workloadRatio;
    }

    @Override
    public int compareTo(ScoredUnit other) {
        return RANKING_ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScoredUnit)) {
            return false;
        }
        ScoredUnit that = (ScoredUnit) o;
        return Double.compare(score, that.score) == 0
                && openCount == that.openCount
                && unit.getId().equals(that.unit.getId());
    }

    @Override
    public int hashCode() {
        return Objects.hash(unit.getId(), score, openCount);
    }

    @Override
    public String toString() {
        return String.format("ScoredUnit{unit='%s', score=%.2f, open=%d, ratio=%.2f}",
                unit.getId(), score, openCount, workloadRatio);
    }
}
