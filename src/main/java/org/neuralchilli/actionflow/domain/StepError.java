package org.neuralchilli.actionflow.domain;

import java.time.Instant;

/**
 * One entry of a workflow's accumulated error log.
 */
public record StepError(
        String stepId,
        int attempt,
        String errorKind,
        String message,
        Instant timestamp
) {
    public StepError {
        if (stepId == null) {
            throw new IllegalArgumentException("Step id cannot be null");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static StepError of(String stepId, int attempt, String errorKind, String message) {
        return new StepError(stepId, attempt, errorKind, message, Instant.now());
    }
}
