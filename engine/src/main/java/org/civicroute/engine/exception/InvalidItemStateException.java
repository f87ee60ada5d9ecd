package org.civicroute.engine.exception;

import org.civicroute.engine.domain.model.ItemStatus;

/**
 * Thrown when routing is requested for an item that is already resolved, closed or rejected.
 */
public class InvalidItemStateException extends RoutingException {

    private final ItemStatus status;

    public InvalidItemStateException(String itemId, ItemStatus status) {
        super("Work item " + itemId + " cannot be routed in status " + status.code());
        this.status = status;
    }

    public ItemStatus getStatus() {
        return status;
    }
}
