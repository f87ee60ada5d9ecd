package org.civicroute.engine.domain.service;

import org.civicroute.engine.domain.model.HandlingUnit;
import org.civicroute.engine.domain.model.Priority;
import org.civicroute.engine.domain.model.RoutingConfig;
import org.civicroute.engine.domain.model.ScoredUnit;
import org.civicroute.engine.domain.model.WorkItem;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Implementation of ScoringService using additive weighted terms.
 *
 * Score formula (higher = better):
 *   score = category_match                      (ineligible units are never scored)
 *         + coverage_match                      if the unit's area contains the item
 *         + urgent_capability                   if urgent and capacity above threshold
 *         + resolution_rate_weight * resolution_rate_percent
 *         + response_term                       fast / moderate / none
 *         + workload_term                       low / moderate / none / overload penalty
 *
 * Ties are broken by lower open count, then by lower unit id.
 */
public final class ScoringServiceImpl implements ScoringService {

    private static final Logger LOG = Logger.getLogger(ScoringServiceImpl.class.getName());

    private final RoutingConfig config;

    public ScoringServiceImpl(RoutingConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public boolean isEligible(HandlingUnit unit, WorkItem item) {
        return unit.isActive()
                && unit.getSettings().isAutoAssign()
                && unit.handlesCategory(item.getCategory());
    }

    @Override
    public double score(HandlingUnit unit, WorkItem item, double workloadRatio) {
        double score = calculateCategoryScore(unit, item);
        score += calculateCoverageScore(unit, item);
        score += calculateUrgencyScore(unit, item);
        score += calculatePerformanceScore(unit);
        score += calculateResponsivenessScore(unit);
        score += calculateWorkloadScore(workloadRatio);
        return score;
    }

    @Override
    public List<ScoredUnit> rank(List<HandlingUnit> units, WorkItem item, Map<String, Integer> openCounts) {
        Objects.requireNonNull(units, "units must not be null");
        Objects.requireNonNull(item, "item must not be null");
        Objects.requireNonNull(openCounts, "openCounts must not be null");

        return units.stream()
                .filter(unit -> isEligible(unit, item))
                .map(unit -> scoreUnit(unit, item, openCounts))
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * Open items divided by capacity. A unit without capacity counts as overloaded.
     */
    public static double workloadRatio(int openCount, int maxConcurrentItems) {
        if (maxConcurrentItems <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return (double) openCount / maxConcurrentItems;
    }

    private ScoredUnit scoreUnit(HandlingUnit unit, WorkItem item, Map<String, Integer> openCounts) {
        Integer openCount = openCounts.get(unit.getId());
        if (openCount == null) {
            throw new IllegalArgumentException("No open count supplied for unit " + unit.getId());
        }
        double ratio = workloadRatio(openCount, unit.getSettings().getMaxConcurrentItems());
        double score = score(unit, item, ratio);

        LOG.fine(() -> String.format("Scored %s for item %s: open=%d, ratio=%.2f, total=%.2f",
                unit.getId(), item.getId(), openCount, ratio, score));

        return new ScoredUnit(unit, score, openCount, ratio);
    }

    private double calculateCategoryScore(HandlingUnit unit, WorkItem item) {
        return unit.handlesCategory(item.getCategory()) ? config.getCategoryMatchScore() : 0.0;
    }

    private double calculateCoverageScore(HandlingUnit unit, WorkItem item) {
        return unit.covers(item.getLocation()) ? config.getCoverageMatchScore() : 0.0;
    }

    /**
     * Bonus for units large enough to absorb urgent work.
     */
    private double calculateUrgencyScore(HandlingUnit unit, WorkItem item) {
        if (item.getPriority() == Priority.URGENT
                && unit.getSettings().getMaxConcurrentItems() > config.getUrgentCapacityThreshold()) {
            return config.getUrgentCapabilityScore();
        }
        return 0.0;
    }

    private double calculatePerformanceScore(HandlingUnit unit) {
        return unit.getStats().getResolutionRatePercent() * config.getResolutionRateWeight();
    }

    private double calculateResponsivenessScore(HandlingUnit unit) {
        double avgResponse = unit.getStats().getAvgResponseTimeHours();
        if (avgResponse < config.getFastResponseHours()) {
            return config.getFastResponseScore();
        }
        if (avgResponse < config.getModerateResponseHours()) {
            return config.getModerateResponseScore();
        }
        return 0.0;
    }

    /**
     * Workload term. Ratios between the moderate and overload thresholds earn nothing.
     */
    private double calculateWorkloadScore(double workloadRatio) {
        if (workloadRatio < config.getLowWorkloadRatio()) {
            return config.getLowWorkloadScore();
        }
        if (workloadRatio < config.getModerateWorkloadRatio()) {
            return config.getModerateWorkloadScore();
        }
        if (workloadRatio >= config.getOverloadRatio()) {
            return config.getOverloadPenalty();
        }
        return 0.0;
    }
}
