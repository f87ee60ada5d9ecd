package org.civicroute.engine.workload;

import org.civicroute.engine.api.ExternalCallExecutor;
import org.civicroute.engine.api.ItemRepository;
import org.civicroute.engine.domain.model.HandlingUnit;
import org.civicroute.engine.domain.model.StaffMember;
import org.civicroute.engine.exception.WorkloadQueryException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * WorkloadTracker backed by count queries against the item store.
 */
public final class RepositoryWorkloadTracker implements WorkloadTracker {

    private static final Logger LOG = Logger.getLogger(RepositoryWorkloadTracker.class.getName());

    /** Load substituted for a staff member whose count is unknown under FAIL_OPEN. */
    static final int UNKNOWN_STAFF_LOAD = Integer.MAX_VALUE;

    private final ItemRepository itemRepository;
    private final ExternalCallExecutor calls;
    private final WorkloadFailurePolicy failurePolicy;

    public RepositoryWorkloadTracker(ItemRepository itemRepository, ExternalCallExecutor calls,
                                     WorkloadFailurePolicy failurePolicy) {
        this.itemRepository = Objects.requireNonNull(itemRepository, "itemRepository must not be null");
        this.calls = Objects.requireNonNull(calls, "calls must not be null");
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy must not be null");
    }

    @Override
    public int openCountForUnit(String unitId) {
        return calls.call("Open count for unit " + unitId,
                () -> itemRepository.countOpenByUnit(unitId), WorkloadQueryException::new);
    }

    @Override
    public int openCountForStaff(String staffId) {
        return calls.call("Open count for staff " + staffId,
                () -> itemRepository.countOpenByStaff(staffId), WorkloadQueryException::new);
    }

    @Override
    public Map<String, Integer> openCountsForUnits(Collection<HandlingUnit> units) {
        return countAll(units, HandlingUnit::getId, "unit",
                unit -> itemRepository.countOpenByUnit(unit.getId()),
                unit -> unit.getSettings().getMaxConcurrentItems());
    }

    @Override
    public Map<String, Integer> openCountsForStaff(Collection<StaffMember> staff) {
        return countAll(staff, StaffMember::getId, "staff",
                member -> itemRepository.countOpenByStaff(member.getId()),
                member -> UNKNOWN_STAFF_LOAD);
    }

    public WorkloadFailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    private <T> Map<String, Integer> countAll(Collection<T> targets, Function<T, String> idOf, String kind,
                                              Function<T, Integer> query, Function<T, Integer> fallback) {
        Map<String, Future<Integer>> pending = new LinkedHashMap<>();
        for (T target : targets) {
            pending.put(idOf.apply(target), calls.submit(() -> query.apply(target)));
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        try {
            for (T target : targets) {
                String id = idOf.apply(target);
                counts.put(id, awaitCount(kind, id, pending.get(id), () -> fallback.apply(target)));
            }
        } finally {
            // fail-closed aborts mid-way; do not leave the remaining queries running
            for (Future<Integer> future : pending.values()) {
                future.cancel(true);
            }
        }
        return counts;
    }

    private int awaitCount(String kind, String id, Future<Integer> future,
                           Supplier<Integer> fallback) {
        try {
            Integer count = calls.await("Open count for " + kind + " " + id, future, WorkloadQueryException::new);
            if (count == null) {
                throw new WorkloadQueryException("Open count for " + kind + " " + id + " returned nothing");
            }
            return count;
        } catch (WorkloadQueryException e) {
            if (failurePolicy == WorkloadFailurePolicy.FAIL_CLOSED) {
                throw e;
            }
            int substitute = fallback.get();
            LOG.log(Level.WARNING, e, () -> String.format(
                    "Workload for %s %s unavailable, proceeding fail-open with load %d", kind, id, substitute));
            return substitute;
        }
    }
}
