package org.neuralchilli.actionflow.domain;

/**
 * Caller-selected execution mode. The only gate on irreversible side effects.
 */
public enum ExecutionMode {
    /**
     * Build and return the plan without running any step
     */
    PLAN_ONLY,

    /**
     * Run the plan to a terminal state
     */
    EXECUTE
}
