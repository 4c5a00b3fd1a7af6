package org.neuralchilli.actionflow.state;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Durable keyed storage with per-entry TTL. Values are JSON strings.
 * Implementations throw {@link TransientBackendException} when unreachable.
 */
public interface KeyValueBackend {

    /**
     * Backend identity reported by health checks
     */
    String name();

    /**
     * Store a value. A null or zero ttl keeps it until deleted.
     */
    void put(String key, String value, Duration ttl);

    Optional<String> get(String key);

    /**
     * @return true if a value was removed
     */
    boolean remove(String key);

    Set<String> keysWithPrefix(String prefix);

    /**
     * Round-trip to the backend, throwing if it is unreachable
     */
    void ping();
}
