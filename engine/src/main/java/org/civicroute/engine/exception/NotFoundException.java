package org.civicroute.engine.exception;

/**
 * Thrown when a work item or handling unit does not exist.
 * No state is changed when this is raised.
 */
public class NotFoundException extends RoutingException {

    private final String resourceType;
    private final String resourceId;

    public NotFoundException(String resourceType, String resourceId) {
        super(resourceType + " not found: " + resourceId);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public static NotFoundException item(String itemId) {
        return new NotFoundException("Work item", itemId);
    }

    public static NotFoundException unit(String unitId) {
        return new NotFoundException("Handling unit", unitId);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
