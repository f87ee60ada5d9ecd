package org.civicroute.engine.domain.service;

import org.civicroute.engine.domain.model.HandlingUnit;
import org.civicroute.engine.domain.model.StaffMember;

import java.util.Optional;

/**
 * Picks the staff member inside a unit who should receive a new item.
 */
public interface StaffSelector {

    /**
     * @return the least-loaded active staff member, or empty when the unit has none (unit-only assignment)
     */
    Optional<StaffMember> select(HandlingUnit unit);
}
