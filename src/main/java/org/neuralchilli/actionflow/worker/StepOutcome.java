package org.neuralchilli.actionflow.worker;

/**
 * Result of one step attempt.
 */
public record StepOutcome(
        boolean success,
        Object data,
        String error,
        String errorKind,
        Integer httpStatus,
        long durationMillis,
        boolean cached
) {
    public static StepOutcome success(Object data, long durationMillis) {
        return new StepOutcome(true, data, null, null, 200, durationMillis, false);
    }

    public static StepOutcome cached(Object data) {
        return new StepOutcome(true, data, null, null, 200, 0, true);
    }

    public static StepOutcome failure(String errorKind, int httpStatus, String error, long durationMillis) {
        return new StepOutcome(false, null, error, errorKind, httpStatus, durationMillis, false);
    }

    public boolean isTimeout() {
        return StepTimeoutException.KIND.equals(errorKind);
    }
}
