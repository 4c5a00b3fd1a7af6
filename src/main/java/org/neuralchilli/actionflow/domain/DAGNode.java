package org.neuralchilli.actionflow.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One step of a workflow plan: a registered action invoked with concrete parameters.
 */
public record DAGNode(
        String id,
        String action,
        Map<String, Object> params,
        Set<String> dependencies,
        String parallelGroup,  // advisory, never executed concurrently
        int timeoutSeconds,
        int maxRetries,
        int priority,          // 1 = high, 5 = low
        int estimatedDurationSeconds,
        Set<String> blockedBy  // dropped upstream nodes this step depended on
) {
    public static final int DEFAULT_TIMEOUT_SECONDS = 300;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_PRIORITY = 1;
    public static final int DEFAULT_DURATION_SECONDS = 60;

    public DAGNode {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id cannot be null or empty");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("Node action cannot be null or empty");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries cannot be negative");
        }
        if (priority < 1 || priority > 5) {
            throw new IllegalArgumentException("Priority must be between 1 and 5, got: " + priority);
        }

        // Defaults
        params = params == null ? Map.of() : unmodifiableCopy(params);
        dependencies = dependencies == null ? Set.of() : orderedCopy(dependencies);
        blockedBy = blockedBy == null ? Set.of() : orderedCopy(blockedBy);
        if (parallelGroup != null && parallelGroup.isBlank()) {
            parallelGroup = null;
        }
        if (timeoutSeconds <= 0) {
            timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        }
        if (estimatedDurationSeconds <= 0) {
            estimatedDurationSeconds = DEFAULT_DURATION_SECONDS;
        }
    }

    public static Builder builder(String id, String action) {
        return new Builder(id, action);
    }

    /**
     * Replace the dependency set
     */
    public DAGNode withDependencies(Set<String> newDependencies) {
        return new DAGNode(id, action, params, newDependencies, parallelGroup, timeoutSeconds,
                maxRetries, priority, estimatedDurationSeconds, blockedBy);
    }

    /**
     * Replace dependencies and blocked-by set in one go
     */
    public DAGNode withDependencies(Set<String> newDependencies, Set<String> newBlockedBy) {
        return new DAGNode(id, action, params, newDependencies, parallelGroup, timeoutSeconds,
                maxRetries, priority, estimatedDurationSeconds, newBlockedBy);
    }

    public DAGNode withParallelGroup(String group) {
        return new DAGNode(id, action, params, dependencies, group, timeoutSeconds,
                maxRetries, priority, estimatedDurationSeconds, blockedBy);
    }

    public boolean isParallel() {
        return parallelGroup != null;
    }

    public boolean isBlocked() {
        return !blockedBy.isEmpty();
    }

    private static Set<String> orderedCopy(Set<String> source) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(source));
    }

    private static Map<String, Object> unmodifiableCopy(Map<String, Object> source) {
        // null parameter values are allowed
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static class Builder {
        private final String id;
        private final String action;
        private Map<String, Object> params = Map.of();
        private Set<String> dependencies = new LinkedHashSet<>();
        private String parallelGroup;
        private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private int priority = DEFAULT_PRIORITY;
        private int estimatedDurationSeconds = DEFAULT_DURATION_SECONDS;

        private Builder(String id, String action) {
            this.id = id;
            this.action = action;
        }

        public Builder params(Map<String, Object> params) {
            this.params = params;
            return this;
        }

        public Builder dependsOn(String... ids) {
            this.dependencies.addAll(List.of(ids));
            return this;
        }

        public Builder dependencies(Set<String> dependencies) {
            this.dependencies = new LinkedHashSet<>(dependencies);
            return this;
        }

        public Builder parallelGroup(String parallelGroup) {
            this.parallelGroup = parallelGroup;
            return this;
        }

        public Builder timeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder estimatedDurationSeconds(int estimatedDurationSeconds) {
            this.estimatedDurationSeconds = estimatedDurationSeconds;
            return this;
        }

        public DAGNode build() {
            return new DAGNode(id, action, params, dependencies, parallelGroup, timeoutSeconds,
                    maxRetries, priority, estimatedDurationSeconds, Set.of());
        }
    }
}
