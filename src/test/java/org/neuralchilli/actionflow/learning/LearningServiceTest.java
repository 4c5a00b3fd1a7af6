package org.neuralchilli.actionflow.learning;

import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.actionflow.action.ActionRegistry;
import org.neuralchilli.actionflow.action.ScriptedAction;
import org.neuralchilli.actionflow.config.OrchestratorConfig;
import org.neuralchilli.actionflow.config.TestConfigs;
import org.neuralchilli.actionflow.domain.DAGNode;
import org.neuralchilli.actionflow.domain.ExecutionMode;
import org.neuralchilli.actionflow.domain.FeedbackRecord;
import org.neuralchilli.actionflow.domain.FeedbackType;
import org.neuralchilli.actionflow.domain.LearningCategory;
import org.neuralchilli.actionflow.domain.LearningPattern;
import org.neuralchilli.actionflow.domain.PlanProposal;
import org.neuralchilli.actionflow.domain.ProposedStep;
import org.neuralchilli.actionflow.domain.WorkflowDAG;
import org.neuralchilli.actionflow.domain.WorkflowExecutionState;
import org.neuralchilli.actionflow.events.EventBus;
import org.neuralchilli.actionflow.events.EventNames;
import org.neuralchilli.actionflow.planner.PlanProposalParser;
import org.neuralchilli.actionflow.state.LocalKeyValueBackend;
import org.neuralchilli.actionflow.state.StateKeys;
import org.neuralchilli.actionflow.state.StateStore;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class LearningServiceTest {

    private static final String REQUEST = "share the quarterly report with finance";

    private StateStore stateStore;
    private EventBus eventBus;
    private LearningService learning;

    @BeforeEach
    void setup() {
        setupWith(TestConfigs.defaults());
    }

    @AfterEach
    void cleanup() {
        learning.shutdown();
    }

    private void setupWith(OrchestratorConfig config) {
        ActionRegistry registry = new ActionRegistry(List.of(
                ScriptedAction.echo("onedrive_search_files"),
                ScriptedAction.echo("onedrive_share_file"),
                ScriptedAction.echo("outlook_send_email")
        ));
        stateStore = new StateStore(new LocalKeyValueBackend(), config);
        eventBus = mock(EventBus.class);
        learning = new LearningService(stateStore, eventBus, registry, new PlanProposalParser(), config);
    }

    private static WorkflowExecutionState completedRun(String request) {
        WorkflowDAG dag = WorkflowDAG.create("share", "", List.of(
                DAGNode.builder("step_1", "onedrive_search_files").build(),
                DAGNode.builder("step_2", "onedrive_share_file").dependsOn("step_1").build()
        ), Map.of(), 0, List.of(), false);

        WorkflowExecutionState state = WorkflowExecutionState.create(dag, ExecutionMode.EXECUTE, request).start();
        state = state.withStep(state.step("step_1").start().complete(Map.of("id", "f-1")));
        state = state.withStep(state.step("step_2").start().complete(Map.of("shared", true)));
        return state.complete();
    }

    private static WorkflowExecutionState failedRun(String request) {
        WorkflowDAG dag = WorkflowDAG.create("email", "", List.of(
                DAGNode.builder("step_1", "outlook_send_email").build()
        ), Map.of(), 0, List.of(), false);

        WorkflowExecutionState state = WorkflowExecutionState.create(dag, ExecutionMode.EXECUTE, request).start();
        state = state.withStep(state.step("step_1").start().fail("mailbox full", "quota_exceeded", 507));
        return state.fail("Step 'step_1' (outlook_send_email) failed after 1 attempt(s): mailbox full");
    }

    @Test
    void shouldSeedSuccessPatternFromCompletedRun() {
        // When
        String feedbackId = learning.recordSuccess(completedRun(REQUEST));

        // Then
        assertThat(stateStore.get(StateKeys.feedback(feedbackId), FeedbackRecord.class)).isPresent();

        String patternId = LearningService.patternId("success",
                new TreeSet<>(List.of("finance", "quarterly", "report", "share")));
        Optional<LearningPattern> pattern = learning.pattern(patternId);
        assertThat(pattern).isPresent();
        assertThat(pattern.get().category()).isEqualTo(LearningCategory.WORKFLOW_OPTIMIZATION);
        assertThat(pattern.get().confidence()).isEqualTo(0.8);
        assertThat(pattern.get().successRate()).isEqualTo(1.0);
        assertThat(pattern.get().usageCount()).isEqualTo(1);
        assertThat(pattern.get().payload().get("successful_actions"))
                .isEqualTo(List.of("onedrive_search_files", "onedrive_share_file"));

        verify(eventBus).emit(eq(EventNames.LEARNING_FEEDBACK_RECORDED), eq("learning"), anyMap(), any());
    }

    @Test
    void shouldBuildStablePatternIds() {
        String id = LearningService.patternId("success", new TreeSet<>(List.of("report", "share")));

        assertThat(id).matches("success_[0-9a-f]{8}");
        assertThat(LearningService.patternId("success", new TreeSet<>(List.of("share", "report")))).isEqualTo(id);
        assertThat(LearningService.patternId("failure", new TreeSet<>(List.of("report", "share"))))
                .isNotEqualTo(id)
                .endsWith(id.substring("success_".length()));
    }

    @Test
    void shouldReinforceExistingPatternInsteadOfDuplicating() {
        learning.recordSuccess(completedRun(REQUEST));
        learning.recordSuccess(completedRun("Share quarterly REPORT with finance"));

        assertThat(stateStore.keys(StateKeys.PATTERN)).hasSize(1);
        assertThat(stateStore.keys(StateKeys.FEEDBACK)).hasSize(2);

        LearningPattern pattern = learning.findSimilarPatterns(REQUEST).get(0).pattern();
        assertThat(pattern.usageCount()).isEqualTo(2);
        assertThat(pattern.confidence()).isCloseTo(0.9, within(1e-9));
    }

    @Test
    void shouldSeedFailurePatternWithErrorDetails() {
        learning.recordFailure(failedRun("email the weekly newsletter"));

        List<ScoredPattern> similar = learning.findSimilarPatterns("email the weekly newsletter");
        assertThat(similar).singleElement().satisfies(scored -> {
            assertThat(scored.similarity()).isEqualTo(1.0);
            assertThat(scored.pattern().id()).startsWith("failure_");
            assertThat(scored.pattern().category()).isEqualTo(LearningCategory.ERROR_PREVENTION);
            assertThat(scored.pattern().successRate()).isZero();
            assertThat(scored.pattern().payload().get("error_details"))
                    .asInstanceOf(InstanceOfAssertFactories.MAP)
                    .containsEntry("failed_step", "step_1")
                    .containsEntry("error_kind", "quota_exceeded");
        });
    }

    @Test
    void shouldNotDerivePatternWithoutKeywords() {
        learning.recordSuccess(completedRun("do it"));

        assertThat(stateStore.keys(StateKeys.FEEDBACK)).hasSize(1);
        assertThat(stateStore.keys(StateKeys.PATTERN)).isEmpty();
    }

    @Test
    void shouldFilterSimilarPatternsByThreshold() {
        learning.recordSuccess(completedRun(REQUEST));

        assertThat(learning.findSimilarPatterns("share report finance")).hasSize(1);
        assertThat(learning.findSimilarPatterns("book meeting room tomorrow")).isEmpty();
        assertThat(learning.findSimilarPatterns("")).isEmpty();
    }

    @Test
    void shouldRankSuggestions() {
        learning.recordSuccess(completedRun(REQUEST));
        learning.recordFailure(failedRun(REQUEST));

        List<LearningSuggestion> suggestions = learning.suggestionsFor(REQUEST);

        assertThat(suggestions).hasSize(2);
        assertThat(suggestions.get(0).suggestion()).isEqualTo("Follow this successful pattern");
        assertThat(suggestions.get(1).suggestion()).isEqualTo("Avoid this pattern");
    }

    @Test
    void shouldApplyUserCorrectionToSimilarRequest() {
        // Given
        PlanProposal original = PlanProposal.of("share",
                ProposedStep.of("step_1", "outlook_send_email", Map.of("body", "report attached")));
        PlanProposal corrected = PlanProposal.of("share properly",
                ProposedStep.of("step_1", "onedrive_search_files", Map.of("query", "quarterly report")),
                ProposedStep.of("step_2", "onedrive_share_file", Map.of("file_id", "${step_1_result.id}"), "step_1"));
        learning.recordUserCorrection("wf_1", REQUEST, original, corrected, "user-1");

        // When
        PlanImprovement improvement = learning.improvePlan(original, "Share quarterly report with finance");

        // Then
        assertThat(improvement.isImproved()).isTrue();
        assertThat(improvement.appliedPatterns()).singleElement().asString().startsWith("correction_");
        assertThat(improvement.proposal().steps()).extracting(ProposedStep::action)
                .containsExactly("onedrive_search_files", "onedrive_share_file");
        assertThat(improvement.proposal().steps().get(1).dependencies()).containsExactly("step_1");
    }

    @Test
    void shouldIgnoreCorrectionForDissimilarRequest() {
        PlanProposal original = PlanProposal.of("share",
                ProposedStep.of("step_1", "outlook_send_email", Map.of()));
        PlanProposal corrected = PlanProposal.of("fixed",
                ProposedStep.of("step_1", "onedrive_share_file", Map.of()));
        learning.recordUserCorrection("wf_1", REQUEST, original, corrected, "user-1");

        PlanImprovement improvement = learning.improvePlan(original, "share holiday photos");

        assertThat(improvement.isImproved()).isFalse();
        assertThat(improvement.proposal()).isEqualTo(original);
    }

    @Test
    void shouldSkipCorrectionReferencingUnregisteredActions() {
        PlanProposal original = PlanProposal.of("share",
                ProposedStep.of("step_1", "outlook_send_email", Map.of()));
        PlanProposal corrected = PlanProposal.of("fixed",
                ProposedStep.of("step_1", "dropbox_share_file", Map.of()));
        learning.recordUserCorrection("wf_1", REQUEST, original, corrected, "user-1");

        PlanImprovement improvement = learning.improvePlan(original, REQUEST);

        assertThat(improvement.isImproved()).isFalse();
        assertThat(improvement.notes()).singleElement().asString().contains("dropbox_share_file");
    }

    @Test
    void shouldFoldOutcomesIntoPattern() {
        learning.recordSuccess(completedRun(REQUEST));
        String patternId = learning.findSimilarPatterns(REQUEST).get(0).pattern().id();

        Optional<LearningPattern> updated = learning.recordPatternOutcome(patternId, false);

        assertThat(updated).isPresent();
        assertThat(updated.get().successRate()).isCloseTo(0.5, within(1e-9));
        assertThat(updated.get().usageCount()).isEqualTo(2);
        assertThat(learning.recordPatternOutcome("success_deadbeef", true)).isEmpty();
    }

    @Test
    void shouldSummarizeMetrics() {
        learning.recordSuccess(completedRun(REQUEST));
        learning.recordFailure(failedRun("email the weekly newsletter"));

        LearningMetrics metrics = learning.metrics();

        assertThat(metrics.totalPatterns()).isEqualTo(2);
        assertThat(metrics.patternsByCategory())
                .containsEntry("workflow_optimization", 1)
                .containsEntry("error_prevention", 1);
        assertThat(metrics.averageConfidence()).isCloseTo(0.75, within(1e-9));
        assertThat(metrics.averageSuccessRate()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void shouldSubmitOnlyTerminalOutcomes() throws Exception {
        Optional<CompletableFuture<String>> success = learning.submitOutcome(completedRun(REQUEST));
        assertThat(success).isPresent();
        assertThat(success.get().get(5, TimeUnit.SECONDS)).startsWith("fb_");

        WorkflowExecutionState cancelled = completedRun(REQUEST).cancel();
        assertThat(learning.submitOutcome(cancelled)).isEmpty();
    }

    @Test
    void shouldIgnoreFeedbackWhenDisabled() {
        learning.shutdown();
        setupWith(TestConfigs.with(Map.of("orchestrator.learning.enabled", "false")));

        FeedbackRecord feedback = FeedbackRecord.builder(FeedbackType.SUCCESS, LearningCategory.WORKFLOW_OPTIMIZATION)
                .originalRequest(REQUEST)
                .build();
        String id = learning.recordFeedback(feedback);

        assertThat(id).isEqualTo(feedback.id());
        assertThat(stateStore.keys(StateKeys.FEEDBACK)).isEmpty();
        verify(eventBus, never()).emit(anyString(), anyString(), anyMap(), any());
        verify(eventBus, times(0)).publish(any());
    }
}
