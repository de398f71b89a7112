package org.carball.querylens.plan;

/**
 * Raised when an execution plan cannot be obtained or understood: connection errors,
 * timeouts and malformed plan documents.
 */
public class PlanFetchException extends Exception {

    public PlanFetchException(String message) {
        super(message);
    }

    public PlanFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
