package org.neuralchilli.actionflow.state;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.actionflow.config.TestConfigs;
import org.neuralchilli.actionflow.domain.DAGNode;
import org.neuralchilli.actionflow.domain.ExecutionMode;
import org.neuralchilli.actionflow.domain.ResourceRecord;
import org.neuralchilli.actionflow.domain.StepStatus;
import org.neuralchilli.actionflow.domain.WorkflowDAG;
import org.neuralchilli.actionflow.domain.WorkflowExecutionState;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StateStoreTest {

    private MutableClock clock;
    private LocalKeyValueBackend backend;
    private StateStore store;

    @BeforeEach
    void setup() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        backend = new LocalKeyValueBackend(clock);
        store = new StateStore(backend, TestConfigs.defaults());
    }

    @Test
    void shouldExpireValueAfterTtl() {
        // Given
        store.set("custom:ttl", Map.of("v", 1), Duration.ofSeconds(1));
        assertThat(store.get("custom:ttl", Map.class)).isPresent();

        // When
        clock.advance(Duration.ofSeconds(2));

        // Then
        assertThat(store.get("custom:ttl", Map.class)).isEmpty();
        assertThat(store.keys("custom:")).isEmpty();
    }

    @Test
    void shouldKeepValueWithoutTtl() {
        store.set("custom:forever", "value");

        clock.advance(Duration.ofDays(365));

        assertThat(store.get("custom:forever", String.class)).contains("value");
    }

    @Test
    void shouldReturnDefaultForMissingKey() {
        assertThat(store.get("custom:missing", String.class, "fallback")).isEqualTo("fallback");
    }

    @Test
    void shouldReportDeleteOfMissingKeyAsFailure() {
        store.set("custom:a", 1);

        assertThat(store.delete("custom:a").isSuccess()).isTrue();
        OperationResult second = store.delete("custom:a");
        assertThat(second.isSuccess()).isFalse();
        assertThat(second.error()).contains("No such key");
    }

    @Test
    void shouldScanKeysByNamespace() {
        store.set("pattern:one", 1);
        store.set("pattern:two", 2);
        store.set("feedback:one", 3);

        assertThat(store.keys("pattern:")).containsExactly("pattern:one", "pattern:two");
    }

    @Test
    void shouldPersistAndReadWorkflowSessions() {
        // Given
        WorkflowDAG dag = WorkflowDAG.create("wf", "", List.of(
                DAGNode.builder("step_1", "onedrive_upload_file").params(Map.of("name", "a.txt")).build(),
                DAGNode.builder("step_2", "hubspot_create_contact").dependsOn("step_1").build()
        ), Map.of(), 120, List.of(), false);
        WorkflowExecutionState state = WorkflowExecutionState.create(dag, ExecutionMode.EXECUTE, "upload a.txt").start();

        // When
        store.createWorkflowSession(state);
        WorkflowExecutionState updated = state.withStep(state.step("step_1").start().complete(Map.of("id", "f1")));
        store.updateWorkflowSession(updated);
        store.storeWorkflowDefinition(dag);

        // Then
        WorkflowExecutionState read = store.getWorkflowState(dag.id()).orElseThrow();
        assertThat(read.step("step_1").status()).isEqualTo(StepStatus.COMPLETED);
        assertThat(read.step("step_1").result()).isEqualTo(Map.of("id", "f1"));
        assertThat(read.originalRequest()).isEqualTo("upload a.txt");
        assertThat(store.listWorkflowStates()).hasSize(1);

        WorkflowDAG definition = store.getWorkflowDefinition(dag.id()).orElseThrow();
        assertThat(definition.nodeIds()).containsExactly("step_1", "step_2");
        assertThat(definition.node("step_2").orElseThrow().dependencies()).containsExactly("step_1");
    }

    @Test
    void shouldKeepCompletedWorkflowsLongerThanRunningOnes() {
        WorkflowDAG dag = WorkflowDAG.create("wf", "", List.of(
                DAGNode.builder("step_1", "a").build()), Map.of(), 60, List.of(), false);
        WorkflowExecutionState state = WorkflowExecutionState.create(dag, ExecutionMode.EXECUTE, "r").start();

        store.completeWorkflowSession(state.complete());
        clock.advance(Duration.ofHours(2));

        assertThat(store.getWorkflowState(dag.id())).isPresent();

        clock.advance(Duration.ofHours(23));
        assertThat(store.getWorkflowState(dag.id())).isEmpty();
    }

    @Test
    void shouldRegisterResourcesByType() {
        store.storeResource("onedrive", "file-1", Map.of("name", "report.docx"));
        store.storeResource("onedrive", "file-2", Map.of("name", "notes.txt"));
        store.storeResource("hubspot", "contact-1", Map.of());

        ResourceRecord record = store.getResource("onedrive", "file-1").orElseThrow();
        assertThat(record.metadata()).containsEntry("name", "report.docx");
        assertThat(store.listResources("onedrive")).extracting(ResourceRecord::id)
                .containsExactlyInAnyOrder("file-1", "file-2");
    }

    @Test
    void shouldStampConversationContext() {
        store.setConversationContext("user-1", Map.of("last_workflow_id", "wf_1"));

        Map<String, Object> context = store.getConversationContext("user-1");

        assertThat(context).containsEntry("last_workflow_id", "wf_1").containsKey("updated_at");
        assertThat(store.getConversationContext("someone-else")).isEmpty();
    }

    @Test
    void shouldCacheActionResultsByFingerprint() {
        String fingerprint = Fingerprints.of("onedrive_list_files", Map.of("folder", "/docs"));

        store.cacheActionResult("onedrive_list_files", fingerprint, List.of("a", "b"));

        assertThat(store.getCachedResult("onedrive_list_files", fingerprint)).contains(List.of("a", "b"));
        assertThat(store.getCachedResult("onedrive_list_files", "other")).isEmpty();

        clock.advance(Duration.ofHours(2));
        assertThat(store.getCachedResult("onedrive_list_files", fingerprint)).isEmpty();
    }

    @Test
    void shouldPurgeExpiredEntriesFromLocalBackend() {
        store.set("custom:a", 1, Duration.ofSeconds(1));
        store.set("custom:b", 2);

        clock.advance(Duration.ofSeconds(5));

        assertThat(store.purgeExpired()).isEqualTo(1);
        assertThat(backend.size()).isEqualTo(1);
    }

    @Test
    void shouldFallBackToLocalBackendWhenDurableBackendIsDown() {
        // Given
        KeyValueBackend down = mock(KeyValueBackend.class);
        when(down.name()).thenReturn("hazelcast");
        doThrow(new TransientBackendException("connection refused")).when(down).ping();

        // When
        StateStore degraded = new StateStore(down, TestConfigs.defaults());

        // Then
        assertThat(degraded.isDegraded()).isTrue();
        assertThat(degraded.backendName()).isEqualTo("in-memory");
        assertThat(degraded.health().status()).isEqualTo(HealthReport.Status.DEGRADED);

        assertThat(degraded.set("custom:k", "v").isSuccess()).isTrue();
        assertThat(degraded.get("custom:k", String.class)).contains("v");
    }

    @Test
    void shouldTurnBackendFailuresIntoResults() {
        // Given a backend that answers pings but fails every operation
        KeyValueBackend flaky = mock(KeyValueBackend.class);
        when(flaky.name()).thenReturn("flaky");
        doThrow(new TransientBackendException("write failed")).when(flaky).put(anyString(), anyString(), any());
        when(flaky.get(anyString())).thenThrow(new TransientBackendException("read failed"));
        when(flaky.keysWithPrefix(anyString())).thenThrow(new TransientBackendException("scan failed"));
        StateStore store = new StateStore(flaky, TestConfigs.defaults());

        // When
        OperationResult write = store.set("custom:k", "v");

        // Then
        assertThat(write.isSuccess()).isFalse();
        assertThat(write.error()).contains("write failed");
        assertThat(store.get("custom:k", String.class)).isEmpty();
        assertThat(store.get("custom:k", String.class, "default")).isEqualTo("default");
        assertThat(store.keys("custom:")).isEmpty();
        assertThat(store.isDegraded()).isFalse();
    }

    @Test
    void shouldReportHealthyOnReachableBackend() {
        HealthReport health = store.health();

        assertThat(health.isHealthy()).isTrue();
        assertThat(health.backend()).isEqualTo("in-memory");
    }
}
