package org.neuralchilli.actionflow.audit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.actionflow.config.OrchestratorConfig;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Masks bulky or sensitive parameter values before they are logged or audited.
 */
@ApplicationScoped
public class ParameterRedactor {

    private final Set<String> redactedKeys;

    @Inject
    public ParameterRedactor(OrchestratorConfig config) {
        this(config.audit().redactedKeys());
    }

    public ParameterRedactor(Collection<String> keys) {
        this.redactedKeys = keys.stream()
                .map(key -> key.trim().toLowerCase(Locale.ROOT))
                .filter(key -> !key.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Copy of the parameters with every redacted key's value replaced by {@code [redacted:<type>]},
     * at any depth.
     */
    public Map<String, Object> redact(Map<String, ?> params) {
        if (params == null) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        params.forEach((key, value) -> {
            if (key != null && redactedKeys.contains(key.toLowerCase(Locale.ROOT))) {
                result.put(key, "[redacted:" + typeName(value) + "]");
            } else {
                result.put(key, walk(value));
            }
        });
        return result;
    }

    @SuppressWarnings("unchecked")
    private Object walk(Object value) {
        if (value instanceof Map<?, ?> map) {
            return redact((Map<String, ?>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(walk(item)));
            return copy;
        }
        return value;
    }

    static String typeName(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence) {
            return "string";
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        if (value instanceof Collection<?> || value.getClass().isArray()) {
            return "array";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        return value.getClass().getSimpleName();
    }
}
