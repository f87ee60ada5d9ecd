package org.civicroute.engine.domain.service;

import org.civicroute.engine.domain.model.HandlingUnit;
import org.civicroute.engine.domain.model.StaffMember;
import org.civicroute.engine.workload.WorkloadTracker;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Selects the active staff member with the fewest open items.
 * Ties go to whoever appears first in the unit's staff listing.
 */
public final class LeastLoadedStaffSelector implements StaffSelector {

    private static final Logger LOG = Logger.getLogger(LeastLoadedStaffSelector.class.getName());

    private final WorkloadTracker workloadTracker;

    public LeastLoadedStaffSelector(WorkloadTracker workloadTracker) {
        this.workloadTracker = Objects.requireNonNull(workloadTracker, "workloadTracker must not be null");
    }

    @Override
    public Optional<StaffMember> select(HandlingUnit unit) {
        List<StaffMember> available = unit.getStaff().stream()
                .filter(StaffMember::isActive)
                .collect(Collectors.toList());

        if (available.isEmpty()) {
            LOG.info(() -> "No active staff in unit " + unit.getName() + ", assigning to unit only");
            return Optional.empty();
        }

        Map<String, Integer> loads = workloadTracker.openCountsForStaff(available);

        StaffMember leastBusy = available.get(0);
        int minLoad = loads.get(leastBusy.getId());
        for (int i = 1; i < available.size(); i++) {
            StaffMember candidate = available.get(i);
            int load = loads.get(candidate.getId());
            if (load < minLoad) {
                minLoad = load;
                leastBusy = candidate;
            }
        }

        final StaffMember selected = leastBusy;
        final int selectedLoad = minLoad;
        LOG.fine(() -> String.format("Selected %s in unit %s with %d open items",
                selected.getId(), unit.getId(), selectedLoad));
        return Optional.of(selected);
    }
}
