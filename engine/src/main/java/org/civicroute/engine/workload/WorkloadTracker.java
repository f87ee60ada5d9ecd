package org.civicroute.engine.workload;

import org.civicroute.engine.domain.model.HandlingUnit;
import org.civicroute.engine.domain.model.StaffMember;

import java.util.Collection;
import java.util.Map;

/**
 * Answers how many open items a unit or staff member currently holds.
 * Counts are read fresh on every call; nothing is cached.
 */
public interface WorkloadTracker {

    /**
     * Open item count for one unit. Always fail-closed.
     *
     * @throws org.civicroute.engine.exception.WorkloadQueryException if the count cannot be read
     */
    int openCountForUnit(String unitId);

    /**
     * Open item count for one staff member. Always fail-closed.
     *
     * @throws org.civicroute.engine.exception.WorkloadQueryException if the count cannot be read
     */
    int openCountForStaff(String staffId);

    /**
     * Open item counts for several units, queried concurrently and joined before returning.
     * Failures are handled according to the configured {@link WorkloadFailurePolicy}.
     */
    Map<String, Integer> openCountsForUnits(Collection<HandlingUnit> units);

    /**
     * Open item counts for several staff members, queried concurrently and joined before returning.
     * Failures are handled according to the configured {@link WorkloadFailurePolicy}.
     */
    Map<String, Integer> openCountsForStaff(Collection<StaffMember> staff);
}
