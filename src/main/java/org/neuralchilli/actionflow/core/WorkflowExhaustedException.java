package org.neuralchilli.actionflow.core;

/**
 * A step used up all of its attempts. Halts the run; the message becomes the workflow error.
 */
public class WorkflowExhaustedException extends RuntimeException {

    private final String stepId;
    private final int attempts;

    public WorkflowExhaustedException(String stepId, String action, int attempts, String lastError) {
        super(String.format("Step '%s' (%s) failed after %d attempt(s): %s", stepId, action, attempts, lastError));
        this.stepId = stepId;
        this.attempts = attempts;
    }

    public String stepId() {
        return stepId;
    }

    public int attempts() {
        return attempts;
    }
}
