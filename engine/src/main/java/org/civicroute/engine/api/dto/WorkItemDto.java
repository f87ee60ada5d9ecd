package org.civicroute.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.civicroute.engine.domain.model.Assignment;
import org.civicroute.engine.domain.model.GeoPoint;
import org.civicroute.engine.domain.model.ItemStatus;
import org.civicroute.engine.domain.model.Priority;
import org.civicroute.engine.domain.model.WorkItem;

import java.time.Instant;
import java.util.List;

/**
 * DTO for an issue as returned by GET /issues/{id}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class WorkItemDto {

    @JsonProperty("id")
    @JsonAlias("_id")
    private String id;

    @JsonProperty("title")
    private String title;

    @JsonProperty("category")
    private String category;

    @JsonProperty("priority")
    private String priority;

    @JsonProperty("status")
    private String status;

    @JsonProperty("reporter")
    private String reporter;

    @JsonProperty("location")
    private LocationDto location;

    @JsonProperty("assignedTo")
    private AssignedToDto assignedTo;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public String getPriority() {
        return priority;
    }

    public void setPriority(String priority) {
        this.priority = priority;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getReporter() {
        return reporter;
    }

    public void setReporter(String reporter) {
        this.reporter = reporter;
    }

    public LocationDto getLocation() {
        return location;
    }

    public void setLocation(LocationDto location) {
        this.location = location;
    }

    public AssignedToDto getAssignedTo() {
        return assignedTo;
    }

    public void setAssignedTo(AssignedToDto assignedTo) {
        this.assignedTo = assignedTo;
    }

    /**
     * Convert to the domain model. An assignedTo block without a department counts as unassigned.
     */
    public WorkItem toDomain() {
        Assignment assignment = null;
        if (assignedTo != null && assignedTo.getDepartment() != null) {
            assignment = new Assignment.Builder()
                    .itemId(id)
                    .unitId(assignedTo.getDepartment())
                    .unitName(assignedTo.getDepartmentName())
                    .staffId(assignedTo.getWorker())
                    .assignedAt(assignedTo.getAssignedAt() != null
                            ? Instant.parse(assignedTo.getAssignedAt()) : Instant.EPOCH)
                    .autoAssigned(assignedTo.isAutoAssigned())
                    .build();
        }

        return new WorkItem.Builder()
                .id(id)
                .title(title)
                .category(category)
                .priority(Priority.fromCode(priority))
                .status(ItemStatus.fromCode(status))
                .reporterId(reporter)
                .location(location != null ? location.toGeoPoint() : null)
                .assignment(assignment)
                .build();
    }

    /**
     * GeoJSON point; coordinates are [longitude, latitude].
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class LocationDto {

        @JsonProperty("coordinates")
        private List<Double> coordinates;

        public List<Double> getCoordinates() {
            return coordinates;
        }

        public void setCoordinates(List<Double> coordinates) {
            this.coordinates = coordinates;
        }

        GeoPoint toGeoPoint() {
            if (coordinates == null || coordinates.size() < 2) {
                return null;
            }
            return new GeoPoint(coordinates.get(1), coordinates.get(0));
        }
    }

    /**
     * Current assignment block of an issue.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class AssignedToDto {

        @JsonProperty("department")
        private String department;

        @JsonProperty("departmentName")
        private String departmentName;

        @JsonProperty("worker")
        private String worker;

        @JsonProperty("assignedAt")
        private String assignedAt;

        @JsonProperty("autoAssigned")
        private boolean autoAssigned;

        public String getDepartment() {
            return department;
        }

        public void setDepartment(String department) {
            this.department = department;
        }

        public String getDepartmentName() {
            return departmentName;
        }

        public void setDepartmentName(String departmentName) {
            this.departmentName = departmentName;
        }

        public String getWorker() {
            return worker;
        }

        public void setWorker(String worker) {
            this.worker = worker;
        }

        public String getAssignedAt() {
            return assignedAt;
        }

        public void setAssignedAt(String assignedAt) {
            this.assignedAt = assignedAt;
        }

        public boolean isAutoAssigned() {
            return autoAssigned;
        }

        public void setAutoAssigned(boolean autoAssigned) {
            this.autoAssigned = autoAssigned;
        }

        public static AssignedToDto from(Assignment assignment) {
            AssignedToDto dto = new AssignedToDto();
            dto.setDepartment(assignment.getUnitId());
            dto.setDepartmentName(assignment.getUnitName());
            dto.setWorker(assignment.getStaffId());
            dto.setAssignedAt(assignment.getAssignedAt().toString());
            dto.setAutoAssigned(assignment.isAutoAssigned());
            return dto;
        }
    }
}
