package org.civicroute.engine.domain.service;

import org.civicroute.engine.api.EventPublisher;
import org.civicroute.engine.api.ExternalCallExecutor;
import org.civicroute.engine.api.ItemRepository;
import org.civicroute.engine.api.NotificationSink;
import org.civicroute.engine.cache.HandlingUnitRegistry;
import org.civicroute.engine.domain.model.Assignment;
import org.civicroute.engine.domain.model.HandlingUnit;
import org.civicroute.engine.domain.model.ItemStatus;
import org.civicroute.engine.domain.model.ScoredUnit;
import org.civicroute.engine.domain.model.StaffMember;
import org.civicroute.engine.domain.model.TimelineEntry;
import org.civicroute.engine.domain.model.WorkItem;
import org.civicroute.engine.domain.model.WorkloadReport;
import org.civicroute.engine.exception.InvalidItemStateException;
import org.civicroute.engine.exception.NotFoundException;
import org.civicroute.engine.exception.PersistenceException;
import org.civicroute.engine.exception.RegistryLoadException;
import org.civicroute.engine.workload.WorkloadTracker;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Implementation of AssignmentCoordinator.
 *
 * Pipeline: load item, take the registry snapshot, read unit workloads, rank, then under the
 * chosen unit's lock re-check its open count, pick staff and commit. Notifications and events
 * are emitted only after the commit succeeded and never affect the outcome.
 */
public final class AssignmentCoordinatorImpl implements AssignmentCoordinator {

    private static final Logger LOG = Logger.getLogger(AssignmentCoordinatorImpl.class.getName());

    public static final String EVENT_ASSIGNED = "issue-assigned";
    public static final String EVENT_REASSIGNED = "issue-reassigned";
    public static final String EVENT_UNASSIGNED = "issue-unassigned";

    public static final String NOTIFY_ACKNOWLEDGED = "issue_acknowledged";
    public static final String NOTIFY_ASSIGNED = "issue_assigned";
    public static final String NOTIFY_REASSIGNED = "issue_reassigned";

    private final ItemRepository itemRepository;
    private final HandlingUnitRegistry registry;
    private final WorkloadTracker workloadTracker;
    private final ScoringService scoringService;
    private final StaffSelector staffSelector;
    private final NotificationSink notificationSink;
    private final EventPublisher eventPublisher;
    private final ExternalCallExecutor calls;
    private final UnitSlotGuard slotGuard;
    private final Clock clock;
    private final int conflictRetries;

    private AssignmentCoordinatorImpl(Builder builder) {
        this.itemRepository = Objects.requireNonNull(builder.itemRepository, "itemRepository must not be null");
        this.registry = Objects.requireNonNull(builder.registry, "registry must not be null");
        this.workloadTracker = Objects.requireNonNull(builder.workloadTracker, "workloadTracker must not be null");
        this.scoringService = Objects.requireNonNull(builder.scoringService, "scoringService must not be null");
        this.staffSelector = Objects.requireNonNull(builder.staffSelector, "staffSelector must not be null");
        this.notificationSink = Objects.requireNonNull(builder.notificationSink, "notificationSink must not be null");
        this.eventPublisher = Objects.requireNonNull(builder.eventPublisher, "eventPublisher must not be null");
        this.calls = Objects.requireNonNull(builder.calls, "calls must not be null");
        this.slotGuard = builder.slotGuard != null ? builder.slotGuard : new UnitSlotGuard();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.conflictRetries = builder.conflictRetries;
    }

    @Override
    public Assignment assignItem(String itemId) {
        return route(itemId, false);
    }

    @Override
    public Assignment forceReassign(String itemId) {
        return route(itemId, true);
    }

    @Override
    public boolean unassignItem(String itemId) {
        WorkItem item = loadItem(itemId);
        Assignment previous = item.getAssignment();
        if (previous == null) {
            LOG.info(() -> "Item " + itemId + " has no assignment to clear");
            return false;
        }

        TimelineEntry entry = TimelineEntry.system(item.getStatus(),
                "Issue unassigned from " + previous.getUnitName(), clock.instant());
        calls.call("Clear assignment for item " + itemId, () -> {
            itemRepository.clearAssignment(itemId, entry);
            return null;
        }, PersistenceException::new);

        LOG.info(() -> String.format("Unassigned item %s from unit %s", itemId, previous.getUnitId()));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("issueId", itemId);
        payload.put("departmentId", previous.getUnitId());
        payload.put("workerId", previous.getStaffId());
        payload.put("status", item.getStatus().code());
        publishSafely(EVENT_UNASSIGNED, payload);
        return true;
    }

    @Override
    public boolean refreshRegistry() {
        return registry.refresh();
    }

    @Override
    public WorkloadReport getWorkload(String unitId) {
        HandlingUnit unit = registry.snapshot().findUnit(unitId)
                .orElseThrow(() -> NotFoundException.unit(unitId));
        int openCount = workloadTracker.openCountForUnit(unitId);
        int capacity = unit.getSettings().getMaxConcurrentItems();
        return new WorkloadReport(unitId, openCount, capacity, ScoringServiceImpl.workloadRatio(openCount, capacity));
    }

    private Assignment route(String itemId, boolean forced) {
        WorkItem item = loadItem(itemId);
        if (item.getStatus().isTerminal()) {
            throw new InvalidItemStateException(itemId, item.getStatus());
        }
        if (!registry.isInitialized()) {
            throw new RegistryLoadException("Handling unit registry not loaded, cannot route item " + itemId);
        }

        LOG.info(() -> String.format("%s item %s (category=%s, priority=%s)",
                forced ? "Reassigning" : "Routing", itemId, item.getCategory(), item.getPriority().code()));

        for (int attempt = 0; ; attempt++) {
            List<HandlingUnit> candidates = registry.snapshot().getUnits().stream()
                    .filter(unit -> scoringService.isEligible(unit, item))
                    .collect(Collectors.toList());

            if (candidates.isEmpty()) {
                LOG.info(() -> "No active unit handles category '" + item.getCategory() + "', item "
                        + itemId + " stays unassigned");
                return null;
            }

            Map<String, Integer> openCounts = workloadTracker.openCountsForUnits(candidates);
            List<ScoredUnit> ranked = scoringService.rank(candidates, item, openCounts);
            ScoredUnit best = ranked.get(0);
            boolean lastAttempt = attempt >= conflictRetries;

            Assignment committed = slotGuard.withUnitLock(best.getUnit().getId(),
                    () -> commitIfSlotUnchanged(item, best, forced, lastAttempt));
            if (committed != null) {
                afterCommit(item, committed, best, forced);
                return committed;
            }

            final int retry = attempt + 1;
            LOG.info(() -> String.format("Unit %s took new work while item %s was being ranked, re-ranking (%d/%d)",
                    best.getUnit().getId(), itemId, retry, conflictRetries));
        }
    }

    /**
     * Runs under the unit lock. Returns null when the unit's open count grew since ranking.
     */
    private Assignment commitIfSlotUnchanged(WorkItem item, ScoredUnit best, boolean forced, boolean lastAttempt) {
        HandlingUnit unit = best.getUnit();
        int current = workloadTracker.openCountsForUnits(Collections.singletonList(unit)).get(unit.getId());

        if (current > best.getOpenCount()) {
            if (!lastAttempt) {
                return null;
            }
            LOG.warning(() -> String.format("Unit %s open count moved %d -> %d, committing anyway (capacity is soft)",
                    unit.getId(), best.getOpenCount(), current));
        }

        Optional<StaffMember> staff = staffSelector.select(unit);
        Instant now = clock.instant();

        Assignment assignment = new Assignment.Builder()
                .itemId(item.getId())
                .unitId(unit.getId())
                .unitName(unit.getName())
                .staffId(staff.map(StaffMember::getId).orElse(null))
                .assignedAt(now)
                .autoAssigned(true)
                .build();
        ItemStatus status = statusAfter(item, assignment);
        TimelineEntry entry = TimelineEntry.system(status, describe(item, unit, staff, forced), now);

        calls.call("Commit assignment for item " + item.getId(), () -> {
            itemRepository.updateAssignment(item.getId(), assignment, status, entry);
            return null;
        }, PersistenceException::new);

        return assignment;
    }

    private void afterCommit(WorkItem item, Assignment assignment, ScoredUnit best, boolean forced) {
        LOG.info(() -> String.format("Assigned item %s to unit %s%s (score=%.2f, unit open=%d)",
                item.getId(), assignment.getUnitName(),
                assignment.hasStaff() ? " / staff " + assignment.getStaffId() : " without staff",
                best.getScore(), best.getOpenCount()));

        Map<String, Object> data = Collections.singletonMap("issueId", item.getId());

        if (item.getReporterId() != null) {
            notifySafely(item.getReporterId(), NOTIFY_ACKNOWLEDGED, "Issue Assigned",
                    String.format("Your issue \"%s\" has been automatically assigned to %s",
                            item.getTitle(), assignment.getUnitName()),
                    data);
        }

        if (assignment.hasStaff()) {
            notifySafely(assignment.getStaffId(), NOTIFY_ASSIGNED, "New Issue Assigned",
                    String.format("You have been assigned a new issue: \"%s\"", item.getTitle()),
                    data);
        }

        Assignment previous = item.getAssignment();
        if (forced && previous != null && previous.hasStaff()
                && !previous.getStaffId().equals(assignment.getStaffId())) {
            notifySafely(previous.getStaffId(), NOTIFY_REASSIGNED, "Issue Reassigned",
                    String.format("Issue \"%s\" has been reassigned to %s", item.getTitle(), assignment.getUnitName()),
                    data);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("issueId", item.getId());
        payload.put("title", item.getTitle());
        payload.put("category", item.getCategory());
        payload.put("departmentId", assignment.getUnitId());
        payload.put("departmentName", assignment.getUnitName());
        payload.put("workerId", assignment.getStaffId());
        payload.put("status", statusAfter(item, assignment).code());
        payload.put("autoAssigned", assignment.isAutoAssigned());
        payload.put("assignedAt", assignment.getAssignedAt().toString());
        if (forced && previous != null) {
            payload.put("previousDepartmentId", previous.getUnitId());
        }
        publishSafely(forced ? EVENT_REASSIGNED : EVENT_ASSIGNED, payload);
    }

    /**
     * A new item moves to in_progress only once a person holds it.
     */
    private static ItemStatus statusAfter(WorkItem item, Assignment assignment) {
        if (assignment.hasStaff() && item.getStatus() == ItemStatus.NEW) {
            return ItemStatus.IN_PROGRESS;
        }
        return item.getStatus();
    }

    private static String describe(WorkItem item, HandlingUnit unit, Optional<StaffMember> staff, boolean forced) {
        String target = unit.getName() + staff.map(s -> " and " + s.getName()).orElse("");
        Assignment previous = item.getAssignment();
        if (forced && previous != null) {
            return "Issue reassigned from " + previous.getUnitName() + " to " + target;
        }
        return "Issue automatically assigned to " + target;
    }

    private WorkItem loadItem(String itemId) {
        if (itemId == null || itemId.trim().isEmpty()) {
            throw new IllegalArgumentException("itemId must not be blank");
        }
        Optional<WorkItem> found = calls.call("Load work item " + itemId,
                () -> itemRepository.find(itemId), PersistenceException::new);
        if (found == null || !found.isPresent()) {
            throw NotFoundException.item(itemId);
        }
        return found.get();
    }

    private void notifySafely(String userId, String type, String title, String message, Map<String, Object> data) {
        try {
            notificationSink.notify(userId, type, title, message, data);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, e, () -> "Failed to notify " + userId + " (" + type + ")");
        }
    }

    private void publishSafely(String eventName, Map<String, Object> payload) {
        try {
            eventPublisher.publish(eventName, payload);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, e, () -> "Failed to publish " + eventName);
        }
    }

    /**
     * Builder for AssignmentCoordinatorImpl.
     */
    public static final class Builder {
        private ItemRepository itemRepository;
        private HandlingUnitRegistry registry;
        private WorkloadTracker workloadTracker;
        private ScoringService scoringService;
        private StaffSelector staffSelector;
        private NotificationSink notificationSink;
        private EventPublisher eventPublisher;
        private ExternalCallExecutor calls;
        private UnitSlotGuard slotGuard;
        private Clock clock;
        private int conflictRetries = 3;

        public Builder itemRepository(ItemRepository itemRepository) {
            this.itemRepository = itemRepository;
            return this;
        }

        public Builder registry(HandlingUnitRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder workloadTracker(WorkloadTracker workloadTracker) {
            this.workloadTracker = workloadTracker;
            return this;
        }

        public Builder scoringService(ScoringService scoringService) {
            this.scoringService = scoringService;
            return this;
        }

        public Builder staffSelector(StaffSelector staffSelector) {
            this.staffSelector = staffSelector;
            return this;
        }

        public Builder notificationSink(NotificationSink notificationSink) {
            this.notificationSink = notificationSink;
            return this;
        }

        public Builder eventPublisher(EventPublisher eventPublisher) {
            this.eventPublisher = eventPublisher;
            return this;
        }

        public Builder calls(ExternalCallExecutor calls) {
            this.calls = calls;
            return this;
        }

        public Builder slotGuard(UnitSlotGuard slotGuard) {
            this.slotGuard = slotGuard;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder conflictRetries(int conflictRetries) {
            if (conflictRetries < 0) {
                throw new IllegalArgumentException("conflictRetries must not be negative");
            }
            this.conflictRetries = conflictRetries;
            return this;
        }

        public AssignmentCoordinatorImpl build() {
            return new AssignmentCoordinatorImpl(this);
        }
    }
}
