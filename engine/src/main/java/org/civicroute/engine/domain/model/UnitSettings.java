package org.civicroute.engine.domain.model;

/**
 * Routing-relevant settings of a handling unit.
 */
public final class UnitSettings {

    public static final int DEFAULT_MAX_CONCURRENT_ITEMS = 10;
    public static final double DEFAULT_RESPONSE_TIME_TARGET_HOURS = 24.0;

    private final boolean autoAssign;
    private final int maxConcurrentItems;
    private final double responseTimeTargetHours;

    public UnitSettings(boolean autoAssign, int maxConcurrentItems, double responseTimeTargetHours) {
        if (maxConcurrentItems < 0) {
            throw new IllegalArgumentException("maxConcurrentItems must not be negative");
        }
        this.autoAssign = autoAssign;
        this.maxConcurrentItems = maxConcurrentItems;
        this.responseTimeTargetHours = responseTimeTargetHours;
    }

    public static UnitSettings defaults() {
        return new UnitSettings(true, DEFAULT_MAX_CONCURRENT_ITEMS, DEFAULT_RESPONSE_TIME_TARGET_HOURS);
    }

    public boolean isAutoAssign() {
        return autoAssign;
    }

    /**
     * Soft capacity. Exceeding it is penalised by scoring, never rejected.
     */
    public int getMaxConcurrentItems() {
        return maxConcurrentItems;
    }

    public double getResponseTimeTargetHours() {
        return responseTimeTargetHours;
    }

    @Override
    public String toString() {
        return "UnitSettings{autoAssign=" + autoAssign + ", maxConcurrentItems=" + maxConcurrentItems + "}";
    }
}
