package org.neuralchilli.actionflow.domain;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Lifecycle notification broadcast on the event bus.
 * The channel an event travels on is its name.
 */
public final class Event implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String id;
    private final String name;
    private final String source;
    private final Instant timestamp;
    private final Map<String, Object> payload;
    private final String correlationId;
    private final String userId;
    private final String sessionId;

    public Event(
            String id,
            String name,
            String source,
            Instant timestamp,
            Map<String, Object> payload,
            String correlationId,
            String userId,
            String sessionId
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Event name cannot be null or empty");
        }
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Event source cannot be null or empty");
        }
        this.id = id != null ? id : name + "-" + UUID.randomUUID();
        this.name = name;
        this.source = source;
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        this.payload = payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
                : Map.of();
        this.correlationId = correlationId;
        this.userId = userId;
        this.sessionId = sessionId;
    }

    /**
     * Stamp a new event with id and timestamp
     */
    public static Event of(String name, String source, Map<String, Object> payload, EventIds ids) {
        EventIds effective = ids != null ? ids : EventIds.none();
        return new Event(null, name, source, Instant.now(), payload,
                effective.correlationId(), effective.userId(), effective.sessionId());
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String source() {
        return source;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public Map<String, Object> payload() {
        return payload;
    }

    public String correlationId() {
        return correlationId;
    }

    public String userId() {
        return userId;
    }

    public String sessionId() {
        return sessionId;
    }

    @Override
    public String toString() {
        return "Event[id=" + id + ", name=" + name + ", source=" + source + ", correlationId=" + correlationId + "]";
    }
}
