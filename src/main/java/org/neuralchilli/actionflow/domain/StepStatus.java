package org.neuralchilli.actionflow.domain;

/**
 * Lifecycle status of a single workflow step.
 */
public enum StepStatus {
    /**
     * Step created, waiting for its turn
     */
    PENDING,

    /**
     * Action is currently executing
     */
    RUNNING,

    /**
     * Action returned a success result
     */
    COMPLETED,

    /**
     * Attempts exhausted
     */
    FAILED,

    /**
     * Step skipped because a dependency did not complete
     */
    SKIPPED,

    /**
     * Previous attempt failed, another attempt is scheduled
     */
    RETRY;

    /**
     * Check if this is a terminal state (step finished)
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    /**
     * Check if step is in progress
     */
    public boolean isInProgress() {
        return this == RUNNING || this == RETRY;
    }

    /**
     * Lowercase name used in event payloads
     */
    public String wireName() {
        return name().toLowerCase();
    }
}
