package org.civicroute.engine.domain.service;

import org.civicroute.engine.domain.model.HandlingUnit;
import org.civicroute.engine.domain.model.ScoredUnit;
import org.civicroute.engine.domain.model.WorkItem;

import java.util.List;
import java.util.Map;

/**
 * Ranks handling units for a work item. Higher score = better unit.
 * Implementations are pure: the same inputs always produce the same result.
 */
public interface ScoringService {

    /**
     * Check whether a unit may take the item at all (active, auto-assign enabled, handles the category).
     */
    boolean isEligible(HandlingUnit unit, WorkItem item);

    /**
     * Calculate the score of one unit for one item.
     *
     * @param workloadRatio open items divided by the unit's capacity
     */
    double score(HandlingUnit unit, WorkItem item, double workloadRatio);

    /**
     * Rank eligible units, best first. Ineligible units are left out entirely.
     *
     * @param openCounts open item count per unit id; every eligible unit must have an entry
     */
    List<ScoredUnit> rank(List<HandlingUnit> units, WorkItem item, Map<String, Integer> openCounts);
}
