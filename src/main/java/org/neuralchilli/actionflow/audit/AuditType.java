package org.neuralchilli.actionflow.audit;

public enum AuditType {
    ACTION_SUCCESS,
    ACTION_ERROR,
    ACTION_WARNING,
    LARGE_RESPONSE_SAVED;

    public String wireName() {
        return name().toLowerCase();
    }
}
