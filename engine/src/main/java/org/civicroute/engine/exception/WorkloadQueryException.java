package org.civicroute.engine.exception;

/**
 * Thrown when an open-item count could not be obtained (failure or timeout).
 * Distinguishes "could not evaluate workload" from "no unit matched".
 */
public class WorkloadQueryException extends RoutingException {

    public WorkloadQueryException(String message) {
        super(message);
    }

    public WorkloadQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
