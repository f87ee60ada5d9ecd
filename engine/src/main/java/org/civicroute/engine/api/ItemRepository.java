package org.civicroute.engine.api;

import org.civicroute.engine.domain.model.Assignment;
import org.civicroute.engine.domain.model.ItemStatus;
import org.civicroute.engine.domain.model.TimelineEntry;
import org.civicroute.engine.domain.model.WorkItem;

import java.util.Optional;

/**
 * Access to the work item store.
 * Implementations must apply each write atomically: either every field changes or none does.
 */
public interface ItemRepository {

    /**
     * Load a work item by id.
     */
    Optional<WorkItem> find(String itemId);

    /**
     * Count items in status new or in_progress assigned to the given unit.
     */
    int countOpenByUnit(String unitId);

    /**
     * Count items in status new or in_progress assigned to the given staff member.
     */
    int countOpenByStaff(String staffId);

    /**
     * Replace the item's current assignment, set its status and append a timeline entry.
     */
    void updateAssignment(String itemId, Assignment assignment, ItemStatus status, TimelineEntry entry);

    /**
     * Remove the item's current assignment and append a timeline entry. Status is left as is.
     */
    void clearAssignment(String itemId, TimelineEntry entry);
}
