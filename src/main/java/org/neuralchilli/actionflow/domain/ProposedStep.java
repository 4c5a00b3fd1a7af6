package org.neuralchilli.actionflow.domain;

import java.util.List;
import java.util.Map;

/**
 * A step as proposed by the planning collaborator, before validation.
 * Numeric fields use 0 for "not specified".
 */
public record ProposedStep(
        String id,
        String action,
        Map<String, Object> params,
        List<String> dependencies,
        String parallelGroup,
        int estimatedDurationSeconds,
        int priority,
        int timeoutSeconds,
        Integer maxRetries
) {
    public ProposedStep {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Step id cannot be null or empty");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("Step action cannot be null or empty");
        }
        params = params == null ? Map.of() : params;
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public static ProposedStep of(String id, String action, Map<String, Object> params, String... dependencies) {
        return new ProposedStep(id, action, params, List.of(dependencies), null, 0, 0, 0, null);
    }

    public ProposedStep inGroup(String group) {
        return new ProposedStep(id, action, params, dependencies, group, estimatedDurationSeconds,
                priority, timeoutSeconds, maxRetries);
    }

    public ProposedStep withDuration(int seconds) {
        return new ProposedStep(id, action, params, dependencies, parallelGroup, seconds,
                priority, timeoutSeconds, maxRetries);
    }

    public ProposedStep withMaxRetries(int retries) {
        return new ProposedStep(id, action, params, dependencies, parallelGroup, estimatedDurationSeconds,
                priority, timeoutSeconds, retries);
    }

    public ProposedStep withTimeout(int seconds) {
        return new ProposedStep(id, action, params, dependencies, parallelGroup, estimatedDurationSeconds,
                priority, seconds, maxRetries);
    }
}
