package org.neuralchilli.actionflow.planner;

import org.junit.jupiter.api.Test;
import org.neuralchilli.actionflow.domain.PlanProposal;
import org.neuralchilli.actionflow.domain.ProposedStep;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class PlanProposalParserTest {

    private final PlanProposalParser parser = new PlanProposalParser();

    @Test
    void shouldParseJsonDocument() {
        // Given
        String json = """
                {
                  "name": "Share quarterly report",
                  "description": "Find and share the report",
                  "nodes": [
                    {"id": "step_1", "action": "onedrive_search_files", "params": {"query": "Q3"},
                     "estimated_duration_seconds": 20},
                    {"id": "step_2", "action": "onedrive_share_file",
                     "params": {"file_id": "${step_1_result.id}"}, "dependencies": ["step_1"],
                     "parallel_group": "share", "priority": 2, "timeout_seconds": 45, "max_retries": 1}
                  ]
                }
                """;

        // When
        PlanProposal proposal = parser.parse(json);

        // Then
        assertThat(proposal.name()).isEqualTo("Share quarterly report");
        assertThat(proposal.description()).isEqualTo("Find and share the report");
        assertThat(proposal.steps()).hasSize(2);

        ProposedStep second = proposal.steps().get(1);
        assertThat(second.action()).isEqualTo("onedrive_share_file");
        assertThat(second.params()).containsEntry("file_id", "${step_1_result.id}");
        assertThat(second.dependencies()).containsExactly("step_1");
        assertThat(second.parallelGroup()).isEqualTo("share");
        assertThat(second.priority()).isEqualTo(2);
        assertThat(second.timeoutSeconds()).isEqualTo(45);
        assertThat(second.maxRetries()).isEqualTo(1);
        assertThat(proposal.steps().get(0).maxRetries()).isNull();
    }

    @Test
    void shouldParseYamlListWithGeneratedIds() {
        String yaml = """
                - action: hubspot_create_contact
                  params:
                    email: a@example.com
                - action: outlook_send_email
                  depends_on: [step_1]
                """;

        PlanProposal proposal = parser.parse(yaml);

        assertThat(proposal.name()).isEqualTo("workflow");
        assertThat(proposal.steps()).extracting(ProposedStep::id).containsExactly("step_1", "step_2");
        assertThat(proposal.steps().get(1).dependencies()).containsExactly("step_1");
    }

    @Test
    void shouldStripMarkdownCodeFence() {
        String fenced = """
                ```json
                {"name": "fenced", "steps": [{"action": "outlook_send_email"}]}
                ```
                """;

        PlanProposal proposal = parser.parse(fenced);

        assertThat(proposal.name()).isEqualTo("fenced");
        assertThat(proposal.steps()).singleElement()
                .extracting(ProposedStep::action).isEqualTo("outlook_send_email");
    }

    @Test
    void shouldRejectMalformedDocuments() {
        assertThatThrownBy(() -> parser.parse(""))
                .isInstanceOf(PlanValidationException.class)
                .hasMessageContaining("empty");

        assertThatThrownBy(() -> parser.parse("{\"name\": \"no nodes\"}"))
                .isInstanceOf(PlanValidationException.class)
                .hasMessageContaining("nodes");

        assertThatThrownBy(() -> parser.parse("{\"nodes\": [{\"id\": \"x\"}]}"))
                .isInstanceOf(PlanValidationException.class)
                .hasMessageContaining("action");

        assertThatThrownBy(() -> parser.parse("{\"nodes\": [{\"action\": \"a\", \"priority\": \"high\"}]}"))
                .isInstanceOf(PlanValidationException.class)
                .hasMessageContaining("priority");

        assertThatThrownBy(() -> parser.parse("just words"))
                .isInstanceOf(PlanValidationException.class);
    }

    @Test
    void shouldConvertProposalToStorableStructureAndBack() {
        // Given
        PlanProposal original = new PlanProposal("corrected", "user fix", List.of(
                ProposedStep.of("step_1", "onedrive_search_files", Map.of("query", "report")),
                ProposedStep.of("step_2", "onedrive_share_file", Map.of(), "step_1").withMaxRetries(0)
        ));

        // When
        Map<String, Object> stored = parser.toObject(original);
        PlanProposal restored = parser.fromObject(stored);

        // Then
        assertThat(stored).containsKeys("name", "description", "nodes");
        assertThat(restored.name()).isEqualTo("corrected");
        assertThat(restored.steps()).extracting(ProposedStep::action)
                .containsExactly("onedrive_search_files", "onedrive_share_file");
        assertThat(restored.steps().get(1).dependencies()).containsExactly("step_1");
        assertThat(restored.steps().get(1).maxRetries()).isZero();
    }
}
