package org.neuralchilli.actionflow.domain;

/**
 * What a learned pattern is about.
 */
public enum LearningCategory {
    WORKFLOW_OPTIMIZATION,
    ACTION_SEQUENCING,
    PARAMETER_PATTERNS,
    ERROR_PREVENTION,
    PERFORMANCE_TUNING;

    public String wireName() {
        return name().toLowerCase();
    }
}
