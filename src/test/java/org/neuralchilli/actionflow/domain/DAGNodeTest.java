package org.neuralchilli.actionflow.domain;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DAGNodeTest {

    @Test
    void shouldApplyDefaults() {
        DAGNode node = DAGNode.builder("step_1", "onedrive_list_files").build();

        assertThat(node.timeoutSeconds()).isEqualTo(300);
        assertThat(node.maxRetries()).isEqualTo(3);
        assertThat(node.priority()).isEqualTo(1);
        assertThat(node.estimatedDurationSeconds()).isEqualTo(60);
        assertThat(node.params()).isEmpty();
        assertThat(node.dependencies()).isEmpty();
        assertThat(node.isParallel()).isFalse();
        assertThat(node.isBlocked()).isFalse();
    }

    @Test
    void shouldKeepDependencyOrder() {
        DAGNode node = DAGNode.builder("step_4", "report")
                .dependsOn("step_3", "step_1", "step_2")
                .build();

        assertThat(node.dependencies()).containsExactly("step_3", "step_1", "step_2");
    }

    @Test
    void shouldAllowNullParameterValues() {
        Map<String, Object> params = new HashMap<>();
        params.put("folder", null);

        DAGNode node = DAGNode.builder("step_1", "onedrive_list_files").params(params).build();

        assertThat(node.params()).containsEntry("folder", null);
    }

    @Test
    void shouldRejectPriorityOutOfRange() {
        assertThatThrownBy(() -> DAGNode.builder("s", "a").priority(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Priority must be between 1 and 5");

        assertThatThrownBy(() -> DAGNode.builder("s", "a").priority(6).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectMissingIdentity() {
        assertThatThrownBy(() -> DAGNode.builder("", "a").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Node id");

        assertThatThrownBy(() -> DAGNode.builder("s", " ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Node action");
    }

    @Test
    void shouldTreatBlankGroupAsUngrouped() {
        DAGNode node = DAGNode.builder("s", "a").parallelGroup("  ").build();

        assertThat(node.parallelGroup()).isNull();
        assertThat(node.withParallelGroup("fetch").isParallel()).isTrue();
    }

    @Test
    void shouldReplaceDependenciesAndBlockers() {
        DAGNode node = DAGNode.builder("b", "a").dependsOn("x").build();

        DAGNode rewired = node.withDependencies(Set.of(), Set.of("dropped"));

        assertThat(rewired.dependencies()).isEmpty();
        assertThat(rewired.blockedBy()).containsExactly("dropped");
        assertThat(rewired.isBlocked()).isTrue();
        assertThat(node.dependencies()).containsExactly("x");
    }
}
