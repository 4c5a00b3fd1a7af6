package org.neuralchilli.actionflow.core;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces placeholder leaves in step parameters with values from the workflow context.
 *
 * Only a string leaf that is exactly <code>${path}</code> is replaced, and only when the
 * first path segment is a context key. The replacement keeps the resolved value's type.
 * Strings that merely contain placeholder syntax are left as they are.
 */
@ApplicationScoped
public class ContextSubstitutor {

    private static final Logger log = LoggerFactory.getLogger(ContextSubstitutor.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("^\\$\\{([A-Za-z_]\\w*)((?:\\.\\w+)*)}$");

    private final ExpressionEvaluator evaluator;

    @Inject
    public ContextSubstitutor(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Substitute every recognized placeholder leaf in a parameter tree.
     * The input is not modified.
     */
    public Map<String, Object> substitute(Map<String, Object> params, Map<String, Object> context) {
        if (params == null || params.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        params.forEach((key, value) -> result.put(key, walk(value, context)));
        return result;
    }

    @SuppressWarnings("unchecked")
    private Object walk(Object value, Map<String, Object> context) {
        if (value instanceof String text) {
            return resolve(text, context);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<String, Object>) map).forEach((k, v) -> copy.put(k, walk(v, context)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(walk(item, context)));
            return copy;
        }
        return value;
    }

    private Object resolve(String text, Map<String, Object> context) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        if (!matcher.matches()) {
            return text;
        }

        String root = matcher.group(1);
        if (!context.containsKey(root)) {
            return text;
        }
        if (matcher.group(2).isEmpty()) {
            return context.get(root);
        }

        try {
            Object resolved = evaluator.evaluate(root + matcher.group(2), context);
            return resolved != null ? resolved : text;
        } catch (ExpressionException e) {
            log.debug("Leaving placeholder {} unresolved: {}", text, e.getMessage());
            return text;
        }
    }
}
