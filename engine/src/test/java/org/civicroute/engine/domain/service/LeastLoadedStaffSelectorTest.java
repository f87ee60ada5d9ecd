package org.civicroute.engine.domain.service;

import org.civicroute.engine.domain.model.HandlingUnit;
import org.civicroute.engine.domain.model.StaffMember;
import org.civicroute.engine.workload.WorkloadTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.civicroute.engine.support.Fixtures.WATER;
import static org.civicroute.engine.support.Fixtures.staff;
import static org.civicroute.engine.support.Fixtures.unit;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for LeastLoadedStaffSelector.
 */
@ExtendWith(MockitoExtension.class)
class LeastLoadedStaffSelectorTest {

    @Mock
    private WorkloadTracker workloadTracker;

    private LeastLoadedStaffSelector selector;

    @BeforeEach
    void setUp() {
        selector = new LeastLoadedStaffSelector(workloadTracker);
    }

    @Test
    @DisplayName("Should pick the active member with the fewest open items")
    void shouldPickLeastLoaded() {
        HandlingUnit unit = unit("A", WATER)
                .staffMember(staff("w1", "A", true))
                .staffMember(staff("w2", "A", true))
                .staffMember(staff("w3", "A", true))
                .build();
        when(workloadTracker.openCountsForStaff(anyCollection())).thenReturn(loads("w1", 4, "w2", 1, "w3", 2));

        Optional<StaffMember> selected = selector.select(unit);

        assertThat(selected).map(StaffMember::getId).hasValue("w2");
    }

    @Test
    @DisplayName("Should keep listing order when loads are equal")
    void shouldKeepListingOrderOnTie() {
        HandlingUnit unit = unit("A", WATER)
                .staffMember(staff("w9", "A", true))
                .staffMember(staff("w1", "A", true))
                .build();
        when(workloadTracker.openCountsForStaff(anyCollection())).thenReturn(loads("w9", 3, "w1", 3));

        assertThat(selector.select(unit)).map(StaffMember::getId).hasValue("w9");
    }

    @Test
    @DisplayName("Should ignore inactive members even when they are idle")
    void shouldIgnoreInactiveMembers() {
        StaffMember idle = staff("w1", "A", false);
        StaffMember busy = staff("w2", "A", true);
        HandlingUnit unit = unit("A", WATER).staff(Arrays.asList(idle, busy)).build();
        when(workloadTracker.openCountsForStaff(anyCollection())).thenReturn(loads("w2", 7));

        assertThat(selector.select(unit)).hasValue(busy);
    }

    @Test
    @DisplayName("Should return empty without querying when no member is active")
    void shouldReturnEmptyWithoutActiveStaff() {
        HandlingUnit unit = unit("A", WATER).staffMember(staff("w1", "A", false)).build();

        assertThat(selector.select(unit)).isEmpty();
        assertThat(selector.select(unit("B", WATER).build())).isEmpty();
        verify(workloadTracker, never()).openCountsForStaff(any());
    }

    private static Map<String, Integer> loads(Object... pairs) {
        Map<String, Integer> loads = new HashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            loads.put((String) pairs[i], (Integer) pairs[i + 1]);
        }
        return loads;
    }
}
