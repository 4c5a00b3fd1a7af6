package org.neuralchilli.actionflow.learning;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.actionflow.action.ActionRegistry;
import org.neuralchilli.actionflow.config.OrchestratorConfig;
import org.neuralchilli.actionflow.domain.EventIds;
import org.neuralchilli.actionflow.domain.FeedbackRecord;
import org.neuralchilli.actionflow.domain.FeedbackType;
import org.neuralchilli.actionflow.domain.LearningCategory;
import org.neuralchilli.actionflow.domain.LearningPattern;
import org.neuralchilli.actionflow.domain.PlanProposal;
import org.neuralchilli.actionflow.domain.ProposedStep;
import org.neuralchilli.actionflow.domain.StepState;
import org.neuralchilli.actionflow.domain.StepStatus;
import org.neuralchilli.actionflow.domain.WorkflowExecutionState;
import org.neuralchilli.actionflow.domain.WorkflowStatus;
import org.neuralchilli.actionflow.events.EventBus;
import org.neuralchilli.actionflow.events.EventNames;
import org.neuralchilli.actionflow.planner.PlanProposalParser;
import org.neuralchilli.actionflow.state.StateKeys;
import org.neuralchilli.actionflow.state.StateStore;
import org.neuralchilli.actionflow.worker.WorkerThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Records execution feedback, mines keyword-triggered patterns from it and feeds them back
 * into planning.
 *
 * Patterns are keyed by feedback kind plus a hash of the request keywords, so repeated
 * requests with the same keywords reinforce a single pattern instead of piling up new ones.
 */
@ApplicationScoped
public class LearningService {

    private static final Logger log = LoggerFactory.getLogger(LearningService.class);
    private static final String SOURCE = "learning";
    private static final int MAX_SIMILAR = 10;
    private static final int MAX_SUGGESTIONS = 5;

    private final StateStore stateStore;
    private final EventBus eventBus;
    private final ActionRegistry registry;
    private final PlanProposalParser parser;
    private final OrchestratorConfig.Learning settings;
    private final ExecutorService learningExecutor;

    @Inject
    public LearningService(
            StateStore stateStore,
            EventBus eventBus,
            ActionRegistry registry,
            PlanProposalParser parser,
            OrchestratorConfig config
    ) {
        this.stateStore = stateStore;
        this.eventBus = eventBus;
        this.registry = registry;
        this.parser = parser;
        this.settings = config.learning();
        this.learningExecutor = Executors.newSingleThreadExecutor(new WorkerThreadFactory("learning"));
    }

    // ---------------------------------------------------------------------
    // Feedback
    // ---------------------------------------------------------------------

    /**
     * Store feedback, derive and upsert its pattern, and announce it.
     *
     * @return the feedback id
     */
    public String recordFeedback(FeedbackRecord feedback) {
        if (!settings.enabled()) {
            log.debug("Learning disabled, ignoring feedback {}", feedback.id());
            return feedback.id();
        }

        stateStore.set(StateKeys.feedback(feedback.id()), feedback, settings.feedbackRetention());

        List<String> patternIds = new ArrayList<>();
        derivePattern(feedback).ifPresent(pattern -> {
            stateStore.set(StateKeys.pattern(pattern.id()), pattern, settings.patternRetention());
            patternIds.add(pattern.id());
        });

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("feedback_id", feedback.id());
        payload.put("type", feedback.type().wireName());
        payload.put("category", feedback.category().wireName());
        payload.put("workflow_id", feedback.workflowId());
        payload.put("patterns", patternIds);
        eventBus.emit(EventNames.LEARNING_FEEDBACK_RECORDED, SOURCE, payload,
                new EventIds(feedback.workflowId(), feedback.userId(), null));

        log.info("Recorded {} feedback {} ({} pattern(s))", feedback.type().wireName(), feedback.id(), patternIds.size());
        return feedback.id();
    }

    /**
     * Hand feedback to the learning executor. Never blocks the caller.
     */
    public CompletableFuture<String> submit(FeedbackRecord feedback) {
        return CompletableFuture
                .supplyAsync(() -> recordFeedback(feedback), learningExecutor)
                .whenComplete((id, error) -> {
                    if (error != null) {
                        log.warn("Failed to record feedback {}: {}", feedback.id(), error.getMessage());
                    }
                });
    }

    /**
     * Submit success or failure feedback for a finished run. Other terminal states produce none.
     */
    public Optional<CompletableFuture<String>> submitOutcome(WorkflowExecutionState state) {
        if (state.status() == WorkflowStatus.COMPLETED) {
            return Optional.of(submit(successFeedback(state)));
        }
        if (state.status() == WorkflowStatus.FAILED) {
            return Optional.of(submit(failureFeedback(state)));
        }
        return Optional.empty();
    }

    public String recordSuccess(WorkflowExecutionState state) {
        return recordFeedback(successFeedback(state));
    }

    public String recordFailure(WorkflowExecutionState state) {
        return recordFeedback(failureFeedback(state));
    }

    /**
     * Record that a user replaced a proposed plan with a better one.
     */
    public String recordUserCorrection(
            String workflowId,
            String originalRequest,
            PlanProposal originalPlan,
            PlanProposal correctedPlan,
            String userId
    ) {
        Map<String, Object> original = parser.toObject(originalPlan);
        Map<String, Object> correction = new LinkedHashMap<>();
        correction.put("original_plan", original);
        correction.put("corrected_plan", parser.toObject(correctedPlan));
        correction.put("correction_reason", "User provided better approach");

        FeedbackRecord feedback = FeedbackRecord.builder(FeedbackType.USER_CORRECTION, LearningCategory.ACTION_SEQUENCING)
                .workflowId(workflowId)
                .originalRequest(originalRequest)
                .userId(userId)
                .originalPlan(original)
                .userCorrection(correction)
                .confidence(0.9)
                .build();
        return recordFeedback(feedback);
    }

    FeedbackRecord successFeedback(WorkflowExecutionState state) {
        return FeedbackRecord.builder(FeedbackType.SUCCESS, LearningCategory.WORKFLOW_OPTIMIZATION)
                .workflowId(state.workflowId())
                .originalRequest(state.originalRequest())
                .executionResult(executionResult(state))
                .performanceMetrics(performanceMetrics(state))
                .build();
    }

    FeedbackRecord failureFeedback(WorkflowExecutionState state) {
        Map<String, Object> errorDetails = new LinkedHashMap<>();
        errorDetails.put("error", state.error());
        state.steps().values().stream()
                .filter(step -> step.status() == StepStatus.FAILED)
                .findFirst()
                .ifPresent(step -> {
                    errorDetails.put("failed_step", step.stepId());
                    errorDetails.put("failed_action", step.action());
                    errorDetails.put("error_kind", step.errorKind());
                    errorDetails.put("http_status", step.httpStatus());
                });

        return FeedbackRecord.builder(FeedbackType.FAILURE, LearningCategory.ERROR_PREVENTION)
                .workflowId(state.workflowId())
                .originalRequest(state.originalRequest())
                .executionResult(executionResult(state))
                .errorDetails(errorDetails)
                .build();
    }

    // ---------------------------------------------------------------------
    // Patterns
    // ---------------------------------------------------------------------

    /**
     * Patterns whose triggers overlap the request enough, best first
     */
    public List<ScoredPattern> findSimilarPatterns(String request) {
        Set<String> keywords = KeywordExtractor.extract(request);
        if (keywords.isEmpty()) {
            return List.of();
        }

        return allPatterns().stream()
                .map(pattern -> new ScoredPattern(pattern, KeywordExtractor.jaccard(keywords, pattern.triggers())))
                .filter(scored -> scored.similarity() >= settings.similarityThreshold())
                .sorted(Comparator.comparingDouble(ScoredPattern::score).reversed())
                .limit(MAX_SIMILAR)
                .collect(Collectors.toList());
    }

    public List<LearningSuggestion> suggestionsFor(String request) {
        return findSimilarPatterns(request).stream()
                .map(scored -> LearningSuggestion.from(scored.pattern()))
                .sorted(Comparator.comparingDouble(LearningSuggestion::rank).reversed())
                .limit(MAX_SUGGESTIONS)
                .collect(Collectors.toList());
    }

    /**
     * Replace the proposal with a matching user-corrected plan when one is close enough.
     * Any failure returns the proposal unchanged.
     */
    public PlanImprovement improvePlan(PlanProposal proposal, String request) {
        if (!settings.enabled()) {
            return PlanImprovement.unchanged(proposal);
        }
        try {
            Set<String> keywords = KeywordExtractor.extract(request);
            List<ScoredPattern> corrections = allPatterns().stream()
                    .filter(pattern -> pattern.category() == LearningCategory.ACTION_SEQUENCING)
                    .map(pattern -> new ScoredPattern(pattern, KeywordExtractor.jaccard(keywords, pattern.triggers())))
                    .filter(scored -> scored.similarity() >= settings.correctionApplyThreshold())
                    .sorted(Comparator.comparingDouble(ScoredPattern::similarity)
                            .thenComparingDouble(scored -> scored.pattern().confidence())
                            .reversed())
                    .collect(Collectors.toList());

            List<String> notes = new ArrayList<>();
            for (ScoredPattern candidate : corrections) {
                Object corrected = candidate.pattern().payload().get("corrected_approach");
                if (corrected == null) {
                    continue;
                }
                PlanProposal correctedPlan = parser.fromObject(corrected);
                List<String> unknown = correctedPlan.steps().stream()
                        .map(ProposedStep::action)
                        .filter(action -> !registry.contains(action))
                        .collect(Collectors.toList());
                if (correctedPlan.isEmpty() || !unknown.isEmpty()) {
                    notes.add("Skipped correction " + candidate.pattern().id() + ": unknown actions " + unknown);
                    continue;
                }

                log.info("Applying user correction pattern {} (similarity {})",
                        candidate.pattern().id(), String.format("%.2f", candidate.similarity()));
                notes.add("Applied user correction " + candidate.pattern().id());
                return new PlanImprovement(correctedPlan, List.of(candidate.pattern().id()), notes);
            }
            return new PlanImprovement(proposal, List.of(), notes);
        } catch (RuntimeException e) {
            log.warn("Plan improvement failed, keeping proposal: {}", e.getMessage());
            return PlanImprovement.unchanged(proposal);
        }
    }

    /**
     * Fold an observed outcome into a pattern's statistics.
     */
    public Optional<LearningPattern> recordPatternOutcome(String patternId, boolean success) {
        Optional<LearningPattern> existing = stateStore.get(StateKeys.pattern(patternId), LearningPattern.class);
        if (existing.isEmpty()) {
            log.debug("Pattern {} not found, outcome ignored", patternId);
            return Optional.empty();
        }
        LearningPattern updated = existing.get().recordOutcome(success, settings.confidenceStep());
        stateStore.set(StateKeys.pattern(patternId), updated, settings.patternRetention());
        return Optional.of(updated);
    }

    /**
     * Report a finished run back to the patterns that shaped its plan, on the learning executor.
     * Cancelled runs and runs without applied patterns report nothing.
     */
    public Optional<CompletableFuture<Void>> submitPatternOutcomes(List<String> patternIds, WorkflowExecutionState state) {
        if (patternIds.isEmpty() || !(state.status() == WorkflowStatus.COMPLETED || state.status() == WorkflowStatus.FAILED)) {
            return Optional.empty();
        }
        boolean success = state.status() == WorkflowStatus.COMPLETED;
        List<String> ids = List.copyOf(patternIds);
        return Optional.of(CompletableFuture
                .runAsync(() -> ids.forEach(id -> recordPatternOutcome(id, success)), learningExecutor)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        log.warn("Failed to record pattern outcomes for {}: {}", state.workflowId(), error.getMessage());
                    }
                }));
    }

    public Optional<LearningPattern> pattern(String patternId) {
        return stateStore.get(StateKeys.pattern(patternId), LearningPattern.class);
    }

    public LearningMetrics metrics() {
        List<LearningPattern> patterns = allPatterns();
        Map<String, Integer> byCategory = new LinkedHashMap<>();
        for (LearningPattern pattern : patterns) {
            byCategory.merge(pattern.category().wireName(), 1, Integer::sum);
        }
        double avgConfidence = patterns.stream().mapToDouble(LearningPattern::confidence).average().orElse(0.0);
        double avgSuccess = patterns.stream().mapToDouble(LearningPattern::successRate).average().orElse(0.0);
        return new LearningMetrics(patterns.size(), byCategory, avgConfidence, avgSuccess);
    }

    @PreDestroy
    void shutdown() {
        learningExecutor.shutdown();
    }

    private List<LearningPattern> allPatterns() {
        List<LearningPattern> patterns = new ArrayList<>();
        for (String key : stateStore.keys(StateKeys.PATTERN)) {
            stateStore.get(key, LearningPattern.class).ifPresent(patterns::add);
        }
        return patterns;
    }

    private Optional<LearningPattern> derivePattern(FeedbackRecord feedback) {
        Set<String> keywords = KeywordExtractor.extract(feedback.originalRequest());
        if (keywords.isEmpty()) {
            log.debug("No keywords in request of feedback {}, no pattern derived", feedback.id());
            return Optional.empty();
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("request_keywords", List.copyOf(keywords));

        String kind;
        LearningCategory category;
        double confidence;
        double successRate;
        switch (feedback.type()) {
            case SUCCESS -> {
                kind = "success";
                category = LearningCategory.WORKFLOW_OPTIMIZATION;
                confidence = 0.8;
                successRate = 1.0;
                payload.put("successful_actions", successfulActions(feedback.executionResult()));
                payload.put("execution_metrics", feedback.performanceMetrics());
                payload.put("suggested_approach", "Follow this successful pattern");
            }
            case USER_CORRECTION -> {
                if (feedback.userCorrection().isEmpty()) {
                    return Optional.empty();
                }
                kind = "correction";
                category = LearningCategory.ACTION_SEQUENCING;
                confidence = 0.9;
                successRate = 1.0;
                payload.put("original_approach", feedback.userCorrection().get("original_plan"));
                payload.put("corrected_approach", feedback.userCorrection().get("corrected_plan"));
                payload.put("suggested_approach", "Apply user-corrected pattern");
            }
            case FAILURE -> {
                kind = "failure";
                category = LearningCategory.ERROR_PREVENTION;
                confidence = 0.7;
                successRate = 0.0;
                payload.put("error_details", feedback.errorDetails());
                payload.put("failed_approach", feedback.executionResult());
                payload.put("suggested_approach", "Avoid this pattern");
            }
            default -> {
                return Optional.empty();
            }
        }

        String id = patternId(kind, keywords);
        LearningPattern pattern = stateStore.get(StateKeys.pattern(id), LearningPattern.class)
                .map(existing -> existing.reinforce(settings.confidenceStep()))
                .orElseGet(() -> LearningPattern.seed(id, category, keywords, payload, confidence, successRate));
        return Optional.of(pattern);
    }

    static String patternId(String kind, Set<String> sortedKeywords) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            byte[] hash = md5.digest(String.join(" ", sortedKeywords).getBytes(StandardCharsets.UTF_8));
            return kind + "_" + HexFormat.of().formatHex(hash).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    private static Map<String, Object> executionResult(WorkflowExecutionState state) {
        Map<String, Object> stepResults = new LinkedHashMap<>();
        for (StepState step : state.steps().values()) {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("action", step.action());
            summary.put("status", step.status().wireName());
            summary.put("success", step.status() == StepStatus.COMPLETED);
            summary.put("attempts", step.attempts());
            stepResults.put(step.stepId(), summary);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("workflow_id", state.workflowId());
        result.put("status", state.status().wireName());
        result.put("step_results", stepResults);
        return result;
    }

    private static Map<String, Object> performanceMetrics(WorkflowExecutionState state) {
        Duration duration = state.getDuration();
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("duration_ms", duration.toMillis());
        metrics.put("step_count", state.steps().size());
        metrics.put("completed_steps", state.countSteps(StepStatus.COMPLETED));
        metrics.put("total_attempts", state.steps().values().stream().mapToInt(StepState::attempts).sum());
        return metrics;
    }

    @SuppressWarnings("unchecked")
    private static List<String> successfulActions(Map<String, Object> executionResult) {
        Object stepResults = executionResult.get("step_results");
        if (!(stepResults instanceof Map<?, ?> results)) {
            return List.of();
        }
        List<String> actions = new ArrayList<>();
        for (Object value : results.values()) {
            if (value instanceof Map<?, ?> step && Boolean.TRUE.equals(step.get("success"))) {
                Object action = ((Map<String, Object>) step).get("action");
                if (action != null) {
                    actions.add(action.toString());
                }
            }
        }
        return actions;
    }
}
