package org.neuralchilli.actionflow.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Execution state of one step inside a workflow run.
 */
public record StepState(
        String stepId,
        String action,
        StepStatus status,
        int attempts,
        Object result,
        String error,
        String errorKind,
        Integer httpStatus,
        Instant startedAt,
        Instant completedAt,
        Long durationMillis
) {
    public StepState {
        if (stepId == null || stepId.isBlank()) {
            throw new IllegalArgumentException("Step id cannot be null or empty");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("Step action cannot be null or empty");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("Attempts cannot be negative");
        }
    }

    /**
     * Create a pending step
     */
    public static StepState pending(DAGNode node) {
        return new StepState(node.id(), node.action(), StepStatus.PENDING, 0,
                null, null, null, null, null, null, null);
    }

    /**
     * Mark as running and count the attempt
     */
    public StepState start() {
        return new StepState(stepId, action, StepStatus.RUNNING, attempts + 1,
                null, error, errorKind, httpStatus, Instant.now(), null, null);
    }

    /**
     * Mark as completed
     */
    public StepState complete(Object stepResult) {
        Instant now = Instant.now();
        return new StepState(stepId, action, StepStatus.COMPLETED, attempts,
                stepResult, null, null, null, startedAt, now, elapsed(now));
    }

    /**
     * Record a failed attempt that will be retried
     */
    public StepState retry(String errorMessage, String kind, Integer code) {
        Instant now = Instant.now();
        return new StepState(stepId, action, StepStatus.RETRY, attempts,
                null, errorMessage, kind, code, startedAt, now, elapsed(now));
    }

    /**
     * Mark as failed, attempts exhausted
     */
    public StepState fail(String errorMessage, String kind, Integer code) {
        Instant now = Instant.now();
        return new StepState(stepId, action, StepStatus.FAILED, attempts,
                null, errorMessage, kind, code, startedAt, now, elapsed(now));
    }

    /**
     * Mark as skipped
     */
    public StepState skip(String reason) {
        return new StepState(stepId, action, StepStatus.SKIPPED, attempts,
                null, reason, null, null, startedAt, Instant.now(), null);
    }

    public Duration getDuration() {
        return durationMillis != null ? Duration.ofMillis(durationMillis) : Duration.ZERO;
    }

    private Long elapsed(Instant now) {
        return startedAt != null ? Duration.between(startedAt, now).toMillis() : null;
    }
}
