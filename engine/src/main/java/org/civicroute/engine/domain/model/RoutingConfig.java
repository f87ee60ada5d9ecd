package org.civicroute.engine.domain.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Immutable configuration for routing score weights and thresholds.
 * Unknown keys are kept but ignored; missing keys fall back to defaults.
 */
public final class RoutingConfig {

    private static final Logger LOG = Logger.getLogger(RoutingConfig.class.getName());

    /** Environment prefix for weight overrides, e.g. ROUTING_COVERAGE_MATCH_SCORE. */
    public static final String ENV_PREFIX = "ROUTING_";

    // Score keys
    public static final String CATEGORY_MATCH_SCORE = "category_match_score";
    public static final String COVERAGE_MATCH_SCORE = "coverage_match_score";
    public static final String URGENT_CAPABILITY_SCORE = "urgent_capability_score";
    public static final String RESOLUTION_RATE_WEIGHT = "resolution_rate_weight";
    public static final String FAST_RESPONSE_SCORE = "fast_response_score";
    public static final String MODERATE_RESPONSE_SCORE = "moderate_response_score";
    public static final String LOW_WORKLOAD_SCORE = "low_workload_score";
    public static final String MODERATE_WORKLOAD_SCORE = "moderate_workload_score";
    public static final String OVERLOAD_PENALTY = "overload_penalty";

    // Threshold keys
    public static final String URGENT_CAPACITY_THRESHOLD = "urgent_capacity_threshold";
    public static final String FAST_RESPONSE_HOURS = "fast_response_hours";
    public static final String MODERATE_RESPONSE_HOURS = "moderate_response_hours";
    public static final String LOW_WORKLOAD_RATIO = "low_workload_ratio";
    public static final String MODERATE_WORKLOAD_RATIO = "moderate_workload_ratio";
    public static final String OVERLOAD_RATIO = "overload_ratio";

    private static final Map<String, Double> DEFAULTS;

    static {
        Map<String, Double> defaults = new HashMap<>();
        defaults.put(CATEGORY_MATCH_SCORE, 100.0);
        defaults.put(COVERAGE_MATCH_SCORE, 50.0);
        defaults.put(URGENT_CAPABILITY_SCORE, 30.0);
        defaults.put(RESOLUTION_RATE_WEIGHT, 0.2);
        defaults.put(FAST_RESPONSE_SCORE, 20.0);
        defaults.put(MODERATE_RESPONSE_SCORE, 10.0);
        defaults.put(LOW_WORKLOAD_SCORE, 25.0);
        defaults.put(MODERATE_WORKLOAD_SCORE, 15.0);
        defaults.put(OVERLOAD_PENALTY, -50.0);
        defaults.put(URGENT_CAPACITY_THRESHOLD, 5.0);
        defaults.put(FAST_RESPONSE_HOURS, 12.0);
        defaults.put(MODERATE_RESPONSE_HOURS, 24.0);
        defaults.put(LOW_WORKLOAD_RATIO, 0.5);
        defaults.put(MODERATE_WORKLOAD_RATIO, 0.8);
        defaults.put(OVERLOAD_RATIO, 1.0);
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private final Map<String, Double> values;

    private RoutingConfig(Map<String, Double> values) {
        validate(values);
        this.values = Collections.unmodifiableMap(new HashMap<>(values));
    }

    // workload points must not grow as a unit gets busier
    private static void validate(Map<String, Double> values) {
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            if (entry.getValue() == null || !Double.isFinite(entry.getValue())) {
                throw new IllegalArgumentException(entry.getKey() + " must be a finite number");
            }
        }
        double low = values.get(LOW_WORKLOAD_SCORE);
        double moderate = values.get(MODERATE_WORKLOAD_SCORE);
        double penalty = values.get(OVERLOAD_PENALTY);
        if (low < moderate || moderate < 0 || penalty > 0) {
            throw new IllegalArgumentException(String.format(
                    "workload scores must satisfy %s >= %s >= 0 >= %s, got %s, %s, %s",
                    LOW_WORKLOAD_SCORE, MODERATE_WORKLOAD_SCORE, OVERLOAD_PENALTY, low, moderate, penalty));
        }
        double lowRatio = values.get(LOW_WORKLOAD_RATIO);
        double moderateRatio = values.get(MODERATE_WORKLOAD_RATIO);
        double overloadRatio = values.get(OVERLOAD_RATIO);
        if (lowRatio > moderateRatio || moderateRatio > overloadRatio) {
            throw new IllegalArgumentException(String.format(
                    "workload ratios must satisfy %s <= %s <= %s, got %s, %s, %s",
                    LOW_WORKLOAD_RATIO, MODERATE_WORKLOAD_RATIO, OVERLOAD_RATIO, lowRatio, moderateRatio, overloadRatio));
        }
    }

    /**
     * Creates a RoutingConfig from a map of key-value pairs layered over the defaults.
     *
     * @throws IllegalArgumentException if the merged workload scores or ratios are out of order
     */
    public static RoutingConfig fromMap(Map<String, Double> overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");
        Map<String, Double> merged = new HashMap<>(DEFAULTS);
        merged.putAll(overrides);
        return new RoutingConfig(merged);
    }

    public static RoutingConfig defaults() {
        return new RoutingConfig(DEFAULTS);
    }

    /**
     * Collects {@code ROUTING_*} entries from a flat key/value source. Values that do not parse are skipped.
     */
    public static Map<String, Double> overridesFrom(Map<String, String> source) {
        Map<String, Double> overrides = new HashMap<>();
        for (Map.Entry<String, String> entry : source.entrySet()) {
            String key = entry.getKey();
            if (key == null || !key.startsWith(ENV_PREFIX) || entry.getValue() == null) {
                continue;
            }
            String configKey = key.substring(ENV_PREFIX.length()).toLowerCase(Locale.ROOT);
            if (!DEFAULTS.containsKey(configKey)) {
                continue;
            }
            try {
                overrides.put(configKey, Double.parseDouble(entry.getValue().trim()));
            } catch (NumberFormatException e) {
                LOG.warning(() -> String.format("Invalid number for %s: %s, keeping default", key, entry.getValue()));
            }
        }
        return overrides;
    }

    public double get(String key) {
        Double value = values.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Unknown config key: " + key);
        }
        return value;
    }

    public double getOrDefault(String key, double defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    public double getCategoryMatchScore() {
        return get(CATEGORY_MATCH_SCORE);
    }

    public double getCoverageMatchScore() {
        return get(COVERAGE_MATCH_SCORE);
    }

    public double getUrgentCapabilityScore() {
        return get(URGENT_CAPABILITY_SCORE);
    }

    public double getResolutionRateWeight() {
        return get(RESOLUTION_RATE_WEIGHT);
    }

    public double getFastResponseScore() {
        return get(FAST_RESPONSE_SCORE);
    }

    public double getModerateResponseScore() {
        return get(MODERATE_RESPONSE_SCORE);
    }

    public double getLowWorkloadScore() {
        return get(LOW_WORKLOAD_SCORE);
    }

    public double getModerateWorkloadScore() {
        return get(MODERATE_WORKLOAD_SCORE);
    }

    public double getOverloadPenalty() {
        return get(OVERLOAD_PENALTY);
    }

    public double getUrgentCapacityThreshold() {
        return get(URGENT_CAPACITY_THRESHOLD);
    }

    public double getFastResponseHours() {
        return get(FAST_RESPONSE_HOURS);
    }

    public double getModerateResponseHours() {
        return get(MODERATE_RESPONSE_HOURS);
    }

    public double getLowWorkloadRatio() {
        return get(LOW_WORKLOAD_RATIO);
    }

    public double getModerateWorkloadRatio() {
        return get(MODERATE_WORKLOAD_RATIO);
    }

    public double getOverloadRatio() {
        return get(OVERLOAD_RATIO);
    }

    @Override
    public String toString() {
        return "RoutingConfig" + values;
    }
}
