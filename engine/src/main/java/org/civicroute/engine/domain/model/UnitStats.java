package org.civicroute.engine.domain.model;

/**
 * Historical performance figures of a handling unit, maintained by the item store.
 */
public final class UnitStats {

    /** Response time assumed for units without history. */
    public static final double DEFAULT_AVG_RESPONSE_TIME_HOURS = 24.0;

    private final double resolutionRatePercent;
    private final double avgResponseTimeHours;

    public UnitStats(double resolutionRatePercent, double avgResponseTimeHours) {
        this.resolutionRatePercent = resolutionRatePercent;
        this.avgResponseTimeHours = avgResponseTimeHours;
    }

    public static UnitStats empty() {
        return new UnitStats(0.0, DEFAULT_AVG_RESPONSE_TIME_HOURS);
    }

    public double getResolutionRatePercent() {
        return resolutionRatePercent;
    }

    public double getAvgResponseTimeHours() {
        return avgResponseTimeHours;
    }

    @Override
    public String toString() {
        return String.format("UnitStats{resolutionRate=%.1f%%, avgResponse=%.1fh}",
                resolutionRatePercent, avgResponseTimeHours);
    }
}
