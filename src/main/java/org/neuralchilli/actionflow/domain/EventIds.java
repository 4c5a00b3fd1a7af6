package org.neuralchilli.actionflow.domain;

/**
 * Optional identifiers attached to an event.
 */
public record EventIds(String correlationId, String userId, String sessionId) {

    public static EventIds none() {
        return new EventIds(null, null, null);
    }

    public static EventIds correlation(String correlationId) {
        return new EventIds(correlationId, null, null);
    }
}
