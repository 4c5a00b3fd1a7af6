package org.neuralchilli.actionflow.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local fallback used when the durable backend is unavailable.
 * Entries expire lazily on read and on {@link #purgeExpired()}.
 */
public class LocalKeyValueBackend implements KeyValueBackend {

    private static final Logger log = LoggerFactory.getLogger(LocalKeyValueBackend.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public LocalKeyValueBackend() {
        this(Clock.systemUTC());
    }

    public LocalKeyValueBackend(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return "in-memory";
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        Instant expiresAt = ttl == null || ttl.isZero() || ttl.isNegative()
                ? null
                : clock.instant().plus(ttl);
        entries.put(key, new Entry(value, expiresAt));
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public boolean remove(String key) {
        Entry removed = entries.remove(key);
        return removed != null && !removed.isExpired(clock.instant());
    }

    @Override
    public Set<String> keysWithPrefix(String prefix) {
        Instant now = clock.instant();
        Set<String> keys = new TreeSet<>();
        entries.forEach((key, entry) -> {
            if (key.startsWith(prefix) && !entry.isExpired(now)) {
                keys.add(key);
            }
        });
        return keys;
    }

    @Override
    public void ping() {
        // always reachable
    }

    /**
     * Drop every expired entry.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("Purged {} expired entries", removed);
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    private record Entry(String value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
