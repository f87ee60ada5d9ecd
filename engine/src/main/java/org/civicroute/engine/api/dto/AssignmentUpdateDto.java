package org.civicroute.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.civicroute.engine.domain.model.Assignment;
import org.civicroute.engine.domain.model.ItemStatus;
import org.civicroute.engine.domain.model.TimelineEntry;

/**
 * Request body for PUT /issues/{id}/assignment. The store applies all three parts in one write.
 */
public final class AssignmentUpdateDto {

    @JsonProperty("assignedTo")
    private final WorkItemDto.AssignedToDto assignedTo;

    @JsonProperty("status")
    private final String status;

    @JsonProperty("timelineEntry")
    private final TimelineEntryDto timelineEntry;

    private AssignmentUpdateDto(WorkItemDto.AssignedToDto assignedTo, String status, TimelineEntryDto timelineEntry) {
        this.assignedTo = assignedTo;
        this.status = status;
        this.timelineEntry = timelineEntry;
    }

    public static AssignmentUpdateDto of(Assignment assignment, ItemStatus status, TimelineEntry entry) {
        return new AssignmentUpdateDto(WorkItemDto.AssignedToDto.from(assignment), status.code(),
                TimelineEntryDto.from(entry));
    }

    public WorkItemDto.AssignedToDto getAssignedTo() {
        return assignedTo;
    }

    public String getStatus() {
        return status;
    }

    public TimelineEntryDto getTimelineEntry() {
        return timelineEntry;
    }
}
