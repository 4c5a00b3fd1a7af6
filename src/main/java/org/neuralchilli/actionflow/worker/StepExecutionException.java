package org.neuralchilli.actionflow.worker;

/**
 * A step attempt failed: the action threw, returned an error result, or could not be resolved.
 */
public class StepExecutionException extends RuntimeException {

    private final String errorKind;
    private final int httpStatus;

    public StepExecutionException(String errorKind, int httpStatus, String message) {
        super(message);
        this.errorKind = errorKind;
        this.httpStatus = httpStatus;
    }

    public StepExecutionException(String errorKind, int httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
        this.httpStatus = httpStatus;
    }

    public String errorKind() {
        return errorKind;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
