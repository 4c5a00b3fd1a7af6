package org.neuralchilli.actionflow.service;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import org.neuralchilli.actionflow.action.ActionRegistry;
import org.neuralchilli.actionflow.action.Caller;
import org.neuralchilli.actionflow.domain.ExecutionMode;
import org.neuralchilli.actionflow.domain.WorkflowStatus;
import org.neuralchilli.actionflow.state.StateStore;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@QuarkusTest
class OrchestrationServiceIntegrationTest {

    @Inject
    OrchestrationService service;

    @Inject
    ActionRegistry registry;

    @Inject
    StateStore stateStore;

    private final Caller caller = new Caller("it-user", "it-session", Map.of());

    @Test
    void shouldDiscoverActionBeans() {
        assertThat(registry.contains("assistant_generate_response")).isTrue();
        assertThat(registry.byCategory("assistant")).containsExactly("assistant_generate_response");
    }

    @Test
    void shouldHandleRequestThroughFallbackPlanner() {
        // When: no planning service is deployed
        BoundaryResponse response = service.handle(
                BoundaryRequest.naturalLanguage("draft a status update", ExecutionMode.EXECUTE, caller));

        // Then
        assertThat(response.httpStatus()).isEqualTo(200);
        assertThat(response.body()).containsEntry("status", "completed");

        String workflowId = (String) response.body().get("workflow_id");
        assertThat(service.status(workflowId))
                .hasValueSatisfying(state -> assertThat(state.status()).isEqualTo(WorkflowStatus.COMPLETED));
        assertThat(stateStore.getConversationContext("it-user"))
                .containsEntry("last_workflow_id", workflowId);
    }

    @Test
    void shouldRunDirectActionCall() {
        BoundaryResponse response = service.handle(BoundaryRequest.action("assistant_generate_response",
                Map.of("prompt", "hello"), ExecutionMode.EXECUTE, caller));

        assertThat(response.httpStatus()).isEqualTo(200);
        assertThat(response.body().get("data")).isEqualTo(Map.of("reply", "You asked: hello", "user", "it-user"));
    }

    @Test
    void shouldReportHealthyEngine() {
        Map<String, Object> health = service.health();

        assertThat(health).containsEntry("status", "healthy");
        assertThat(health.get("registered_actions")).isEqualTo(registry.size());
    }
}
