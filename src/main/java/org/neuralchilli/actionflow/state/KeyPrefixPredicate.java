package org.neuralchilli.actionflow.state;

import com.hazelcast.query.Predicate;

import java.io.Serial;
import java.util.Map;

/**
 * Matches map entries whose key starts with a literal prefix.
 */
public class KeyPrefixPredicate implements Predicate<String, String> {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String prefix;

    public KeyPrefixPredicate(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public boolean apply(Map.Entry<String, String> entry) {
        return entry.getKey().startsWith(prefix);
    }
}
