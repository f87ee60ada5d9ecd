package org.civicroute.engine.domain.service;

import org.civicroute.engine.domain.model.Assignment;
import org.civicroute.engine.domain.model.WorkloadReport;

/**
 * Public entry point of the routing engine.
 */
public interface AssignmentCoordinator {

    /**
     * Route a work item to the best handling unit and, when possible, a staff member.
     * Any existing assignment is superseded.
     *
     * @param itemId the item to route
     * @return the committed assignment, or null if no active unit handles the item's category
     * @throws org.civicroute.engine.exception.NotFoundException if the item does not exist
     * @throws org.civicroute.engine.exception.RegistryLoadException if no unit snapshot has ever been loaded
     * @throws org.civicroute.engine.exception.WorkloadQueryException if workload could not be evaluated
     * @throws org.civicroute.engine.exception.PersistenceException if the item could not be read or written
     */
    Assignment assignItem(String itemId);

    /**
     * Same pipeline as {@link #assignItem(String)}, used when an operator explicitly asks for re-routing.
     * The previous assignment is replaced, never merged, and its staff member is told about the move.
     */
    Assignment forceReassign(String itemId);

    /**
     * Remove the item's current assignment.
     *
     * @return false if the item had no assignment
     */
    boolean unassignItem(String itemId);

    /**
     * Manual registry refresh in addition to the timer.
     *
     * @return true if a new snapshot was installed
     */
    boolean refreshRegistry();

    /**
     * Read-only diagnostic of a unit's current load.
     *
     * @throws org.civicroute.engine.exception.NotFoundException if the unit is not in the current snapshot
     */
    WorkloadReport getWorkload(String unitId);
}
