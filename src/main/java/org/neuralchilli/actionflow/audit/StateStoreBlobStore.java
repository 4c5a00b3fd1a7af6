package org.neuralchilli.actionflow.audit;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.actionflow.config.OrchestratorConfig;
import org.neuralchilli.actionflow.state.OperationResult;
import org.neuralchilli.actionflow.state.StateKeys;
import org.neuralchilli.actionflow.state.StateStore;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps offloaded bodies in the state store under {@code blob:{name}}.
 */
@DefaultBean
@ApplicationScoped
public class StateStoreBlobStore implements BlobStore {

    static final String REFERENCE_PREFIX = "state://blob/";

    private final StateStore stateStore;
    private final Duration retention;

    @Inject
    public StateStoreBlobStore(StateStore stateStore, OrchestratorConfig config) {
        this.stateStore = stateStore;
        this.retention = config.audit().recordRetention();
    }

    @Override
    public String store(String name, byte[] content) {
        Map<String, Object> blob = new LinkedHashMap<>();
        blob.put("file_name", name);
        blob.put("size_bytes", content.length);
        blob.put("content", new String(content, StandardCharsets.UTF_8));
        blob.put("saved_at", Instant.now());

        OperationResult result = stateStore.set(StateKeys.blob(name), blob, retention);
        if (!result.isSuccess()) {
            throw new BlobStoreException("Could not store blob " + name + ": " + result.error().orElse("unknown"));
        }
        return REFERENCE_PREFIX + name;
    }
}
