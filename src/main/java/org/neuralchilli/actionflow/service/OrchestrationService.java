package org.neuralchilli.actionflow.service;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.neuralchilli.actionflow.action.ActionRegistry;
import org.neuralchilli.actionflow.action.Caller;
import org.neuralchilli.actionflow.audit.AuditMiddleware;
import org.neuralchilli.actionflow.audit.AuditTrailListener;
import org.neuralchilli.actionflow.core.DagAnalyzer;
import org.neuralchilli.actionflow.core.WorkflowOrchestrator;
import org.neuralchilli.actionflow.domain.DAGNode;
import org.neuralchilli.actionflow.domain.EventIds;
import org.neuralchilli.actionflow.domain.ExecutionMode;
import org.neuralchilli.actionflow.domain.PlanProposal;
import org.neuralchilli.actionflow.domain.StepState;
import org.neuralchilli.actionflow.domain.WorkflowDAG;
import org.neuralchilli.actionflow.domain.WorkflowExecutionState;
import org.neuralchilli.actionflow.domain.WorkflowStatus;
import org.neuralchilli.actionflow.events.EventBus;
import org.neuralchilli.actionflow.events.EventNames;
import org.neuralchilli.actionflow.learning.LearningService;
import org.neuralchilli.actionflow.learning.LearningSuggestion;
import org.neuralchilli.actionflow.learning.PlanImprovement;
import org.neuralchilli.actionflow.monitoring.ExecutionMetrics;
import org.neuralchilli.actionflow.planner.PlanBuilder;
import org.neuralchilli.actionflow.planner.PlanningClient;
import org.neuralchilli.actionflow.state.HealthReport;
import org.neuralchilli.actionflow.state.StateStore;
import org.neuralchilli.actionflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point of the engine. Accepts either a direct action call or a natural-language
 * request, plans it, optionally runs it and shapes the result into a boundary response.
 * Every call goes through the {@link AuditMiddleware}.
 */
@ApplicationScoped
public class OrchestrationService {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationService.class);
    private static final String SOURCE = "orchestration_service";

    private static final List<String> CONTEXT_KEYS =
            List.of("last_resource_id", "last_file_id", "last_file_url", "last_contact_id");

    private final ActionRegistry registry;
    private final PlanningClient planningClient;
    private final PlanBuilder planBuilder;
    private final DagAnalyzer analyzer;
    private final WorkflowOrchestrator orchestrator;
    private final LearningService learning;
    private final StateStore stateStore;
    private final EventBus eventBus;
    private final AuditMiddleware audit;
    private final ExecutionMetrics metrics;
    private final AuditTrailListener auditTrail = new AuditTrailListener();

    @Inject
    public OrchestrationService(
            ActionRegistry registry,
            PlanningClient planningClient,
            PlanBuilder planBuilder,
            DagAnalyzer analyzer,
            WorkflowOrchestrator orchestrator,
            LearningService learning,
            StateStore stateStore,
            EventBus eventBus,
            AuditMiddleware audit,
            ExecutionMetrics metrics
    ) {
        this.registry = registry;
        this.planningClient = planningClient;
        this.planBuilder = planBuilder;
        this.analyzer = analyzer;
        this.orchestrator = orchestrator;
        this.learning = learning;
        this.stateStore = stateStore;
        this.eventBus = eventBus;
        this.audit = audit;
        this.metrics = metrics;
    }

    void onStart(@Observes StartupEvent event) {
        log.info("Orchestration service starting: {} actions registered, state backend '{}'{}",
                registry.size(), stateStore.backendName(), stateStore.isDegraded() ? " (degraded)" : "");
        registerAuditTrail();
    }

    public int registerAuditTrail() {
        return auditTrail.register(eventBus);
    }

    /**
     * Handle one boundary call
     */
    public BoundaryResponse handle(BoundaryRequest request) {
        return audit.around(request, () -> dispatch(request));
    }

    private BoundaryResponse dispatch(BoundaryRequest request) {
        try {
            return request.isActionCall() ? handleAction(request) : handleRequest(request);
        } catch (RuntimeException e) {
            log.error("Internal error while handling '{}'", request.label(), e);
            return BoundaryResponse.error(500, "internal_error", "Internal error while handling the request");
        }
    }

    // ---------------------------------------------------------------------
    // Direct action calls
    // ---------------------------------------------------------------------

    private BoundaryResponse handleAction(BoundaryRequest request) {
        String action = request.action();
        if (!registry.contains(action)) {
            log.info("Rejected call to unknown action '{}'", action);
            return BoundaryResponse.error(400, "unknown_action", "Action '" + action + "' is not registered");
        }

        WorkflowDAG dag = planBuilder.singleAction(action, request.params());
        WorkflowExecutionState state = orchestrator.execute(dag, request.caller(), request.mode(), "action:" + action);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("workflow_id", state.workflowId());
        body.put("action", action);

        if (request.mode() == ExecutionMode.PLAN_ONLY) {
            body.put("status", "planned");
            body.put("plan", planView(dag));
            return BoundaryResponse.ok(body);
        }

        StepState step = state.step(dag.nodes().get(0).id());
        if (state.status() == WorkflowStatus.COMPLETED) {
            body.put("status", "success");
            body.put("data", step.result());
            return BoundaryResponse.ok(body);
        }
        if (state.status() == WorkflowStatus.CANCELLED) {
            return BoundaryResponse.error(409, "cancelled", "Workflow " + state.workflowId() + " was cancelled");
        }

        int code = step.httpStatus() != null && step.httpStatus() >= 400 ? step.httpStatus() : 500;
        String kind = step.errorKind() != null ? step.errorKind() : "unknown_error";
        BoundaryResponse failure = BoundaryResponse.error(code, kind, step.error());
        failure.body().put("workflow_id", state.workflowId());
        failure.body().put("attempts", step.attempts());
        return failure;
    }

    // ---------------------------------------------------------------------
    // Natural-language requests
    // ---------------------------------------------------------------------

    private BoundaryResponse handleRequest(BoundaryRequest request) {
        Caller caller = request.caller();
        Map<String, Object> conversation = stateStore.getConversationContext(caller.userId());

        PlanImprovement improvement = null;
        WorkflowDAG dag;
        PlanProposal proposal = propose(request.request(), conversation);
        if (proposal == null) {
            dag = planBuilder.fallback(request.request());
        } else {
            improvement = learning.improvePlan(proposal, request.request());
            dag = planBuilder.build(improvement.proposal());
            if (dag.size() == 0) {
                log.warn("No usable steps in proposed plan for '{}', using fallback", request.request());
                dag = planBuilder.fallback(request.request());
            }
        }
        List<LearningSuggestion> suggestions = learning.suggestionsFor(request.request());

        Map<String, Object> planned = new LinkedHashMap<>();
        planned.put("workflow_id", dag.id());
        planned.put("name", dag.name());
        planned.put("steps", dag.nodeIds());
        planned.put("dropped_nodes", dag.droppedNodes());
        planned.put("linearized", dag.linearized());
        planned.put("improved", improvement != null && improvement.isImproved());
        eventBus.emit(EventNames.PLAN_GENERATED, SOURCE, planned,
                new EventIds(dag.id(), caller.userId(), caller.sessionId()));

        WorkflowExecutionState state = orchestrator.execute(dag, caller, request.mode(), request.request());
        rememberConversation(caller, request.request(), state);
        if (improvement != null) {
            learning.submitPatternOutcomes(improvement.appliedPatterns(), state);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("workflow_id", dag.id());
        if (request.mode() == ExecutionMode.PLAN_ONLY) {
            body.put("status", "planned");
            body.put("plan", planView(dag));
            body.put("suggestions", Jsons.mapper().convertValue(suggestions, List.class));
            if (improvement != null) {
                body.put("improvements", improvement.notes());
            }
            return BoundaryResponse.ok(body);
        }

        body.put("status", state.status().wireName());
        body.put("state", Jsons.toMap(state));
        return BoundaryResponse.ok(body);
    }

    /**
     * Ask the planning collaborator; null when it fails or proposes nothing
     */
    private PlanProposal propose(String request, Map<String, Object> conversation) {
        try {
            PlanProposal proposal = planningClient.propose(request, conversation, registry.names());
            if (proposal == null || proposal.isEmpty()) {
                log.warn("Planner proposed no steps for '{}', using fallback", request);
                return null;
            }
            return proposal;
        } catch (RuntimeException e) {
            log.warn("Planner failed for '{}', using fallback: {}", request, e.getMessage());
            return null;
        }
    }

    private void rememberConversation(Caller caller, String request, WorkflowExecutionState state) {
        Map<String, Object> conversation = new LinkedHashMap<>(stateStore.getConversationContext(caller.userId()));
        conversation.put("last_workflow_id", state.workflowId());
        conversation.put("last_request", request);
        conversation.put("last_status", state.status().wireName());
        for (String key : CONTEXT_KEYS) {
            Object value = state.context().get(key);
            if (value != null) {
                conversation.put(key, value);
            }
        }
        stateStore.setConversationContext(caller.userId(), conversation);
    }

    private Map<String, Object> planView(WorkflowDAG dag) {
        List<Map<String, Object>> nodes = new ArrayList<>();
        for (DAGNode node : dag.nodes()) {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("id", node.id());
            view.put("action", node.action());
            view.put("params", node.params());
            view.put("dependencies", List.copyOf(node.dependencies()));
            view.put("parallel_group", node.parallelGroup());
            view.put("priority", node.priority());
            view.put("timeout_seconds", node.timeoutSeconds());
            view.put("max_retries", node.maxRetries());
            view.put("estimated_duration_seconds", node.estimatedDurationSeconds());
            if (node.isBlocked()) {
                view.put("blocked_by", List.copyOf(node.blockedBy()));
            }
            nodes.add(view);
        }

        Map<String, Object> plan = new LinkedHashMap<>();
        plan.put("id", dag.id());
        plan.put("name", dag.name());
        plan.put("description", dag.description());
        plan.put("nodes", nodes);
        plan.put("parallel_groups", dag.parallelGroups());
        plan.put("estimated_duration_seconds", dag.estimatedDurationSeconds());
        plan.put("dropped_nodes", dag.droppedNodes());
        plan.put("linearized", dag.linearized());
        plan.put("statistics", Jsons.toMap(analyzer.getStatistics(dag.nodes())));
        return plan;
    }

    // ---------------------------------------------------------------------
    // Queries and management
    // ---------------------------------------------------------------------

    public Optional<WorkflowExecutionState> status(String workflowId) {
        return orchestrator.status(workflowId);
    }

    public boolean cancel(String workflowId) {
        return orchestrator.cancel(workflowId);
    }

    public List<LearningSuggestion> suggestions(String request) {
        return learning.suggestionsFor(request);
    }

    /**
     * Record that the user replaced a workflow's plan with their own
     */
    public String recordCorrection(
            String workflowId,
            String request,
            PlanProposal originalPlan,
            PlanProposal correctedPlan,
            Caller caller
    ) {
        return learning.recordUserCorrection(workflowId, request, originalPlan, correctedPlan, caller.userId());
    }

    /**
     * Combined health of the store, the bus and the execution counters
     */
    public Map<String, Object> health() {
        HealthReport store = stateStore.health();
        HealthReport bus = eventBus.health();

        String overall;
        if (store.status() == HealthReport.Status.UNHEALTHY) {
            overall = HealthReport.Status.UNHEALTHY.wireName();
        } else if (!store.isHealthy() || !bus.isHealthy()) {
            overall = HealthReport.Status.DEGRADED.wireName();
        } else {
            overall = HealthReport.Status.HEALTHY.wireName();
        }

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", overall);
        health.put("state_store", reportView(store));
        health.put("event_bus", reportView(bus));
        health.put("active_workflows", orchestrator.activeWorkflows().size());
        health.put("registered_actions", registry.size());
        health.put("metrics", metrics.snapshot());
        health.put("store_stats", stateStore.stats());
        return health;
    }

    private static Map<String, Object> reportView(HealthReport report) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("status", report.status().wireName());
        view.put("backend", report.backend());
        view.put("latency_ms", report.latency().toMillis());
        view.put("message", report.message());
        view.put("details", report.details());
        return view;
    }
}
