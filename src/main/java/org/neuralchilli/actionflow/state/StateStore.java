package org.neuralchilli.actionflow.state;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.actionflow.config.OrchestratorConfig;
import org.neuralchilli.actionflow.domain.ResourceRecord;
import org.neuralchilli.actionflow.domain.WorkflowDAG;
import org.neuralchilli.actionflow.domain.WorkflowExecutionState;
import org.neuralchilli.actionflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Namespaced, TTL'd key-value persistence.
 *
 * Every operation swallows backend failures: writes report a failed {@link OperationResult},
 * reads return empty or the supplied default. If the configured backend is unreachable at
 * startup the store runs on a process-local map and reports itself degraded.
 */
@ApplicationScoped
public class StateStore {

    private static final Logger log = LoggerFactory.getLogger(StateStore.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final KeyValueBackend backend;
    private final boolean degraded;
    private final OrchestratorConfig.State ttls;

    @Inject
    public StateStore(KeyValueBackend configured, OrchestratorConfig config) {
        this.ttls = config.state();
        KeyValueBackend selected = configured;
        boolean fallback = false;
        try {
            configured.ping();
            log.info("State store using backend: {}", configured.name());
        } catch (RuntimeException e) {
            log.warn("State backend '{}' unavailable, falling back to in-memory store: {}",
                    configured.name(), e.getMessage());
            selected = new LocalKeyValueBackend();
            fallback = true;
        }
        this.backend = selected;
        this.degraded = fallback;
    }

    // ---------------------------------------------------------------------
    // Generic operations
    // ---------------------------------------------------------------------

    /**
     * Store a JSON-serializable value. A null ttl keeps it until deleted.
     */
    public OperationResult set(String key, Object value, Duration ttl) {
        String json;
        try {
            json = Jsons.write(value);
        } catch (IllegalArgumentException e) {
            log.warn("Refusing to store non-serializable value under '{}': {}", key, e.getMessage());
            return OperationResult.failure(key, e);
        }
        try {
            backend.put(key, json, ttl);
            return OperationResult.success(key);
        } catch (RuntimeException e) {
            log.warn("Failed to set '{}': {}", key, e.getMessage());
            return OperationResult.failure(key, e);
        }
    }

    public OperationResult set(String key, Object value) {
        return set(key, value, null);
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        return read(key, json -> Jsons.read(json, type));
    }

    public <T> Optional<T> get(String key, TypeReference<T> type) {
        return read(key, json -> Jsons.read(json, type));
    }

    /**
     * Read a value, falling back to a default when missing, expired or unreadable
     */
    public <T> T get(String key, Class<T> type, T defaultValue) {
        return get(key, type).orElse(defaultValue);
    }

    public OperationResult delete(String key) {
        try {
            return backend.remove(key)
                    ? OperationResult.success(key)
                    : OperationResult.failure(key, "No such key");
        } catch (RuntimeException e) {
            log.warn("Failed to delete '{}': {}", key, e.getMessage());
            return OperationResult.failure(key, e);
        }
    }

    /**
     * Keys under a namespace prefix, empty when the backend is unreachable
     */
    public Set<String> keys(String prefix) {
        try {
            return backend.keysWithPrefix(prefix);
        } catch (RuntimeException e) {
            log.warn("Failed to scan prefix '{}': {}", prefix, e.getMessage());
            return Set.of();
        }
    }

    private <T> Optional<T> read(String key, Function<String, T> decoder) {
        Optional<String> json;
        try {
            json = backend.get(key);
        } catch (RuntimeException e) {
            log.warn("Failed to get '{}': {}", key, e.getMessage());
            return Optional.empty();
        }
        try {
            return json.map(decoder);
        } catch (IllegalArgumentException e) {
            log.warn("Discarding unreadable value under '{}': {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    // ---------------------------------------------------------------------
    // Workflow sessions
    // ---------------------------------------------------------------------

    public OperationResult createWorkflowSession(WorkflowExecutionState state) {
        log.debug("Creating workflow session: {}", state.workflowId());
        return set(StateKeys.workflow(state.workflowId()), state, ttls.sessionTtl());
    }

    public OperationResult updateWorkflowSession(WorkflowExecutionState state) {
        return set(StateKeys.workflow(state.workflowId()), state, ttls.sessionTtl());
    }

    /**
     * Persist a terminal state with the longer post-completion retention
     */
    public OperationResult completeWorkflowSession(WorkflowExecutionState state) {
        log.debug("Completing workflow session: {} ({})", state.workflowId(), state.status());
        return set(StateKeys.workflow(state.workflowId()), state, ttls.completedRetention());
    }

    public Optional<WorkflowExecutionState> getWorkflowState(String workflowId) {
        return get(StateKeys.workflow(workflowId), WorkflowExecutionState.class);
    }

    public List<WorkflowExecutionState> listWorkflowStates() {
        List<WorkflowExecutionState> states = new ArrayList<>();
        for (String key : keys(StateKeys.WORKFLOW)) {
            get(key, WorkflowExecutionState.class).ifPresent(states::add);
        }
        return states;
    }

    public OperationResult storeWorkflowDefinition(WorkflowDAG dag) {
        return set(StateKeys.workflowDefinition(dag.id()), dag, ttls.definitionTtl());
    }

    public Optional<WorkflowDAG> getWorkflowDefinition(String workflowId) {
        return get(StateKeys.workflowDefinition(workflowId), WorkflowDAG.class);
    }

    // ---------------------------------------------------------------------
    // Resource registry
    // ---------------------------------------------------------------------

    public OperationResult storeResource(String type, String id, Map<String, Object> metadata) {
        ResourceRecord record = new ResourceRecord(type, id, metadata, Instant.now());
        return set(StateKeys.resource(type, id), record, ttls.resourceTtl());
    }

    public Optional<ResourceRecord> getResource(String type, String id) {
        return get(StateKeys.resource(type, id), ResourceRecord.class);
    }

    public List<ResourceRecord> listResources(String type) {
        List<ResourceRecord> resources = new ArrayList<>();
        for (String key : keys(StateKeys.resourcePrefix(type))) {
            get(key, ResourceRecord.class).ifPresent(resources::add);
        }
        return resources;
    }

    // ---------------------------------------------------------------------
    // Conversation context
    // ---------------------------------------------------------------------

    public OperationResult setConversationContext(String userId, Map<String, Object> context) {
        Map<String, Object> stamped = new LinkedHashMap<>(context);
        stamped.put("updated_at", Instant.now().toString());
        return set(StateKeys.context(userId), stamped, ttls.contextTtl());
    }

    public Map<String, Object> getConversationContext(String userId) {
        return get(StateKeys.context(userId), MAP_TYPE).orElse(Map.of());
    }

    // ---------------------------------------------------------------------
    // Action result cache
    // ---------------------------------------------------------------------

    public OperationResult cacheActionResult(String action, String fingerprint, Object result) {
        return cacheActionResult(action, fingerprint, result, ttls.cacheTtl());
    }

    public OperationResult cacheActionResult(String action, String fingerprint, Object result, Duration ttl) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("action", action);
        entry.put("fingerprint", fingerprint);
        entry.put("result", result);
        entry.put("cached_at", Instant.now().toString());
        return set(StateKeys.actionCache(action, fingerprint), entry, ttl);
    }

    public Optional<Object> getCachedResult(String action, String fingerprint) {
        return get(StateKeys.actionCache(action, fingerprint), MAP_TYPE)
                .map(entry -> entry.get("result"));
    }

    // ---------------------------------------------------------------------
    // Health and maintenance
    // ---------------------------------------------------------------------

    public HealthReport health() {
        long start = System.nanoTime();
        try {
            backend.ping();
        } catch (RuntimeException e) {
            return HealthReport.unhealthy(backend.name(), e.getMessage());
        }
        Duration latency = Duration.ofNanos(System.nanoTime() - start);
        if (degraded) {
            return HealthReport.degraded(backend.name(), latency, "Durable backend unavailable, state is process-local");
        }
        return HealthReport.healthy(backend.name(), latency);
    }

    /**
     * Entry counts per namespace
     */
    public Map<String, Integer> stats() {
        Map<String, Integer> stats = new LinkedHashMap<>();
        stats.put("workflows", keys(StateKeys.WORKFLOW).size());
        stats.put("resources", keys(StateKeys.RESOURCE).size());
        stats.put("patterns", keys(StateKeys.PATTERN).size());
        stats.put("feedback", keys(StateKeys.FEEDBACK).size());
        return stats;
    }

    /**
     * Remove expired entries from the local fallback. The durable backend expires entries itself.
     */
    public int purgeExpired() {
        if (backend instanceof LocalKeyValueBackend local) {
            return local.purgeExpired();
        }
        return 0;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public String backendName() {
        return backend.name();
    }
}
