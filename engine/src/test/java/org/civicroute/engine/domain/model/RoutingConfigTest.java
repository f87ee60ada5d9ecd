package org.civicroute.engine.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for RoutingConfig.
 */
class RoutingConfigTest {

    @Test
    @DisplayName("Should expose the documented default weights")
    void shouldExposeDefaults() {
        RoutingConfig config = RoutingConfig.defaults();

        assertThat(config.getCategoryMatchScore()).isEqualTo(100.0);
        assertThat(config.getCoverageMatchScore()).isEqualTo(50.0);
        assertThat(config.getUrgentCapabilityScore()).isEqualTo(30.0);
        assertThat(config.getResolutionRateWeight()).isEqualTo(0.2);
        assertThat(config.getFastResponseHours()).isEqualTo(12.0);
        assertThat(config.getModerateResponseHours()).isEqualTo(24.0);
        assertThat(config.getOverloadPenalty()).isEqualTo(-50.0);
        assertThat(config.getUrgentCapacityThreshold()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Should layer overrides over the defaults")
    void shouldLayerOverrides() {
        RoutingConfig config = RoutingConfig.fromMap(
                Collections.singletonMap(RoutingConfig.OVERLOAD_PENALTY, -80.0));

        assertThat(config.getOverloadPenalty()).isEqualTo(-80.0);
        assertThat(config.getCategoryMatchScore()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("Should pick up ROUTING_ entries and skip the rest")
    void shouldReadPrefixedOverrides() {
        Map<String, String> source = new HashMap<>();
        source.put("ROUTING_COVERAGE_MATCH_SCORE", " 75 ");
        source.put("ROUTING_FAST_RESPONSE_HOURS", "not-a-number");
        source.put("ROUTING_SOMETHING_ELSE", "1");
        source.put("COVERAGE_MATCH_SCORE", "999");

        Map<String, Double> overrides = RoutingConfig.overridesFrom(source);

        assertThat(overrides).containsOnlyKeys(RoutingConfig.COVERAGE_MATCH_SCORE);
        assertThat(overrides.get(RoutingConfig.COVERAGE_MATCH_SCORE)).isEqualTo(75.0);
    }

    @Test
    @DisplayName("Should reject workload scores that reward a busier unit")
    void shouldRejectOutOfOrderWorkloadScores() {
        assertThatThrownBy(() -> RoutingConfig.fromMap(
                Collections.singletonMap(RoutingConfig.MODERATE_WORKLOAD_SCORE, 40.0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(RoutingConfig.MODERATE_WORKLOAD_SCORE);
        assertThatThrownBy(() -> RoutingConfig.fromMap(
                Collections.singletonMap(RoutingConfig.MODERATE_WORKLOAD_SCORE, -5.0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RoutingConfig.fromMap(
                Collections.singletonMap(RoutingConfig.OVERLOAD_PENALTY, 10.0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(RoutingConfig.OVERLOAD_PENALTY);
    }

    @Test
    @DisplayName("Should reject descending workload ratio thresholds")
    void shouldRejectDescendingRatios() {
        Map<String, Double> overrides = new HashMap<>();
        overrides.put(RoutingConfig.LOW_WORKLOAD_RATIO, 0.9);
        overrides.put(RoutingConfig.MODERATE_WORKLOAD_RATIO, 0.6);

        assertThatThrownBy(() -> RoutingConfig.fromMap(overrides))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(RoutingConfig.LOW_WORKLOAD_RATIO);
        assertThatThrownBy(() -> RoutingConfig.fromMap(
                Collections.singletonMap(RoutingConfig.OVERLOAD_RATIO, 0.7)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should accept equal neighbouring thresholds")
    void shouldAcceptEqualThresholds() {
        Map<String, Double> overrides = new HashMap<>();
        overrides.put(RoutingConfig.MODERATE_WORKLOAD_SCORE, 25.0);
        overrides.put(RoutingConfig.OVERLOAD_PENALTY, 0.0);
        overrides.put(RoutingConfig.MODERATE_WORKLOAD_RATIO, 1.0);

        RoutingConfig config = RoutingConfig.fromMap(overrides);

        assertThat(config.getModerateWorkloadScore()).isEqualTo(25.0);
        assertThat(config.getModerateWorkloadRatio()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should keep a fractional urgent capacity threshold")
    void shouldKeepFractionalThreshold() {
        RoutingConfig config = RoutingConfig.fromMap(
                Collections.singletonMap(RoutingConfig.URGENT_CAPACITY_THRESHOLD, 5.5));

        assertThat(config.getUrgentCapacityThreshold()).isEqualTo(5.5);
    }

    @Test
    @DisplayName("Should reject lookups of unknown keys")
    void shouldRejectUnknownKey() {
        RoutingConfig config = RoutingConfig.defaults();

        assertThatThrownBy(() -> config.get("nope")).isInstanceOf(IllegalArgumentException.class);
        assertThat(config.getOrDefault("nope", 1.5)).isEqualTo(1.5);
    }
}
