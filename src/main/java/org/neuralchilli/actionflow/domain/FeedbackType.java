package org.neuralchilli.actionflow.domain;

/**
 * Source of a learning feedback record.
 */
public enum FeedbackType {
    SUCCESS,
    FAILURE,
    USER_CORRECTION,
    PERFORMANCE_ISSUE,
    IMPROVEMENT_SUGGESTION;

    public String wireName() {
        return name().toLowerCase();
    }
}
