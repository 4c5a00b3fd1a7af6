package org.neuralchilli.actionflow.planner;

/**
 * Thrown when a proposed plan cannot be used as-is: a dependency cycle or a malformed document.
 * Plan building recovers from cycles by linearizing the plan.
 */
public class PlanValidationException extends RuntimeException {

    public PlanValidationException(String message) {
        super(message);
    }

    public PlanValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
