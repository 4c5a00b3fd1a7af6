package org.neuralchilli.actionflow.domain;

import java.time.Instant;
import java.util.Map;

/**
 * A resource created by an action, registered by type and id.
 */
public record ResourceRecord(String type, String id, Map<String, Object> metadata, Instant createdAt) {

    public ResourceRecord {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Resource type cannot be null or empty");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Resource id cannot be null or empty");
        }
        metadata = metadata == null ? Map.of() : metadata;
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
