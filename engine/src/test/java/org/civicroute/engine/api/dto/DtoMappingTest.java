package org.civicroute.engine.api.dto;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.civicroute.engine.domain.model.Assignment;
import org.civicroute.engine.domain.model.CircleCoverage;
import org.civicroute.engine.domain.model.GeoPoint;
import org.civicroute.engine.domain.model.HandlingUnit;
import org.civicroute.engine.domain.model.ItemStatus;
import org.civicroute.engine.domain.model.PolygonCoverage;
import org.civicroute.engine.domain.model.Priority;
import org.civicroute.engine.domain.model.StaffMember;
import org.civicroute.engine.domain.model.TimelineEntry;
import org.civicroute.engine.domain.model.UnitSettings;
import org.civicroute.engine.domain.model.UnitStats;
import org.civicroute.engine.domain.model.WorkItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for mapping API payloads to and from the domain model.
 */
class DtoMappingTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Test
    @DisplayName("Should map an issue payload to a work item")
    void shouldMapIssue() throws IOException {
        WorkItem item = read("/fixtures/issue.json", new TypeReference<WorkItemDto>() { }).toDomain();

        assertThat(item.getId()).isEqualTo("665f1c2e9b1d4a0012ab34cd");
        assertThat(item.getCategory()).isEqualTo("Water Supply");
        assertThat(item.getPriority()).isEqualTo(Priority.URGENT);
        assertThat(item.getStatus()).isEqualTo(ItemStatus.IN_PROGRESS);
        assertThat(item.getReporterId()).isEqualTo("user-42");
        assertThat(item.getLocation()).isEqualTo(new GeoPoint(23.3441, 85.3096));

        Assignment assignment = item.getAssignment();
        assertThat(assignment.getUnitId()).isEqualTo("dept-water");
        assertThat(assignment.getUnitName()).isEqualTo("Water Works");
        assertThat(assignment.getStaffId()).isEqualTo("worker-7");
        assertThat(assignment.getAssignedAt()).isEqualTo(Instant.parse("2026-03-01T09:30:00Z"));
        assertThat(assignment.isAutoAssigned()).isTrue();
    }

    @Test
    @DisplayName("Should treat a missing or empty assignment block as unassigned")
    void shouldMapUnassignedIssue() throws IOException {
        WorkItemDto bare = mapper.readValue(
                "{\"id\":\"i1\",\"category\":\"Drainage\",\"assignedTo\":{\"worker\":null}}", WorkItemDto.class);

        WorkItem item = bare.toDomain();

        assertThat(item.isAssigned()).isFalse();
        assertThat(item.getLocation()).isNull();
        assertThat(item.getStatus()).isEqualTo(ItemStatus.NEW);
        assertThat(item.getPriority()).isEqualTo(Priority.MEDIUM);
    }

    @Test
    @DisplayName("Should map departments with their coverage, settings, stats and staff")
    void shouldMapDepartments() throws IOException {
        List<HandlingUnitDto> dtos = read("/fixtures/departments.json", new TypeReference<List<HandlingUnitDto>>() { });

        HandlingUnit water = dtos.get(0).toDomain();
        assertThat(water.getId()).isEqualTo("dept-water");
        assertThat(water.getCategories()).containsExactly("Water Supply", "Drainage");
        assertThat(water.getCoverage()).isInstanceOf(CircleCoverage.class);
        assertThat(water.covers(new GeoPoint(23.35, 85.31))).isTrue();
        assertThat(water.getSettings().getMaxConcurrentItems()).isEqualTo(25);
        assertThat(water.getStats().getResolutionRatePercent()).isEqualTo(82.5);
        assertThat(water.getStats().getAvgResponseTimeHours()).isEqualTo(9.5);
        assertThat(water.getStaff()).extracting(StaffMember::getId).containsExactly("worker-7", "worker-9");
        assertThat(water.getStaff()).extracting(StaffMember::isActive).containsExactly(true, false);
        assertThat(water.getStaff().get(0).getUnitId()).isEqualTo("dept-water");

        HandlingUnit roads = dtos.get(1).toDomain();
        assertThat(roads.isActive()).isTrue();
        assertThat(roads.getCoverage()).isInstanceOf(PolygonCoverage.class);
        assertThat(roads.covers(new GeoPoint(23.35, 85.35))).isTrue();
        assertThat(roads.getSettings().isAutoAssign()).isTrue();
        assertThat(roads.getSettings().getMaxConcurrentItems()).isEqualTo(UnitSettings.DEFAULT_MAX_CONCURRENT_ITEMS);
        assertThat(roads.getStats().getResolutionRatePercent()).isZero();
        assertThat(roads.getStats().getAvgResponseTimeHours()).isEqualTo(UnitStats.DEFAULT_AVG_RESPONSE_TIME_HOURS);
        assertThat(roads.getStaff()).isEmpty();
    }

    @Test
    @DisplayName("Should write one combined assignment update")
    void shouldWriteAssignmentUpdate() {
        Instant at = Instant.parse("2026-03-02T10:15:00Z");
        Assignment assignment = new Assignment.Builder()
                .itemId("i1").unitId("dept-water").unitName("Water Works").staffId("worker-7")
                .assignedAt(at).autoAssigned(true).build();
        TimelineEntry entry = TimelineEntry.system(ItemStatus.IN_PROGRESS,
                "Issue automatically assigned to Water Works and Asha", at);

        JsonNode json = mapper.valueToTree(AssignmentUpdateDto.of(assignment, ItemStatus.IN_PROGRESS, entry));

        assertThat(json.get("status").asText()).isEqualTo("in_progress");
        assertThat(json.at("/assignedTo/department").asText()).isEqualTo("dept-water");
        assertThat(json.at("/assignedTo/worker").asText()).isEqualTo("worker-7");
        assertThat(json.at("/assignedTo/assignedAt").asText()).isEqualTo("2026-03-02T10:15:00Z");
        assertThat(json.at("/assignedTo/autoAssigned").asBoolean()).isTrue();
        assertThat(json.at("/timelineEntry/description").asText())
                .isEqualTo("Issue automatically assigned to Water Works and Asha");
        assertThat(json.at("/timelineEntry/updatedBy").isNull()).isTrue();
    }

    private <T> T read(String resource, TypeReference<T> type) throws IOException {
        try (InputStream in = getClass().getResourceAsStream(resource)) {
            assertThat(in).as(resource).isNotNull();
            return mapper.readValue(in, type);
        }
    }
}
