package org.neuralchilli.actionflow.action;

import java.util.Map;

/**
 * Authenticated identity on whose behalf actions run.
 * Credential acquisition happens upstream; attributes carry whatever the caller resolved.
 */
public record Caller(String userId, String sessionId, Map<String, Object> attributes) {

    public Caller {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id cannot be null or empty");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static Caller of(String userId) {
        return new Caller(userId, null, Map.of());
    }

    public static Caller system() {
        return new Caller("system", null, Map.of());
    }
}
