package org.neuralchilli.actionflow.state;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

/**
 * State backend on a Hazelcast map with per-entry TTL.
 */
@ApplicationScoped
public class HazelcastKeyValueBackend implements KeyValueBackend {

    private static final Logger log = LoggerFactory.getLogger(HazelcastKeyValueBackend.class);

    static final String MAP_NAME = "state-store";

    private final HazelcastInstance hazelcast;

    @Inject
    public HazelcastKeyValueBackend(HazelcastInstance hazelcast) {
        this.hazelcast = hazelcast;
    }

    @Override
    public String name() {
        return "hazelcast";
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        try {
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                map().set(key, value);
            } else {
                map().set(key, value, ttl.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (RuntimeException e) {
            throw unavailable("put", key, e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(map().get(key));
        } catch (RuntimeException e) {
            throw unavailable("get", key, e);
        }
    }

    @Override
    public boolean remove(String key) {
        try {
            return map().remove(key) != null;
        } catch (RuntimeException e) {
            throw unavailable("remove", key, e);
        }
    }

    @Override
    public Set<String> keysWithPrefix(String prefix) {
        try {
            return new TreeSet<>(map().keySet(new KeyPrefixPredicate(prefix)));
        } catch (RuntimeException e) {
            throw unavailable("scan", prefix, e);
        }
    }

    @Override
    public void ping() {
        if (hazelcast == null || !hazelcast.getLifecycleService().isRunning()) {
            throw new TransientBackendException("Hazelcast instance is not running");
        }
        try {
            map().size();
        } catch (RuntimeException e) {
            throw unavailable("ping", MAP_NAME, e);
        }
    }

    private IMap<String, String> map() {
        return hazelcast.getMap(MAP_NAME);
    }

    private TransientBackendException unavailable(String operation, String key, RuntimeException cause) {
        log.debug("Hazelcast {} failed for '{}': {}", operation, key, cause.getMessage());
        return new TransientBackendException("Hazelcast " + operation + " failed for '" + key + "'", cause);
    }
}
