package org.neuralchilli.actionflow.worker;

/**
 * A step attempt did not finish within its timeout.
 */
public class StepTimeoutException extends StepExecutionException {

    public static final String KIND = "timeout";

    public StepTimeoutException(String stepId, int timeoutSeconds) {
        super(KIND, 504, "Step '" + stepId + "' timed out after " + timeoutSeconds + " seconds");
    }
}
