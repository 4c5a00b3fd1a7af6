package org.neuralchilli.actionflow.core;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.actionflow.action.Caller;
import org.neuralchilli.actionflow.config.OrchestratorConfig;
import org.neuralchilli.actionflow.domain.DAGNode;
import org.neuralchilli.actionflow.domain.EventIds;
import org.neuralchilli.actionflow.domain.ExecutionMode;
import org.neuralchilli.actionflow.domain.StepError;
import org.neuralchilli.actionflow.domain.StepState;
import org.neuralchilli.actionflow.domain.StepStatus;
import org.neuralchilli.actionflow.domain.WorkflowDAG;
import org.neuralchilli.actionflow.domain.WorkflowExecutionState;
import org.neuralchilli.actionflow.domain.WorkflowStatus;
import org.neuralchilli.actionflow.events.EventBus;
import org.neuralchilli.actionflow.events.EventNames;
import org.neuralchilli.actionflow.learning.LearningService;
import org.neuralchilli.actionflow.monitoring.ExecutionMetrics;
import org.neuralchilli.actionflow.state.StateStore;
import org.neuralchilli.actionflow.worker.StepExecutor;
import org.neuralchilli.actionflow.worker.StepOutcome;
import org.neuralchilli.actionflow.worker.WorkerThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a validated workflow plan step by step.
 *
 * Steps execute one at a time in plan order. A step runs only when every dependency
 * completed; otherwise it is skipped. A step that fails is retried up to its
 * {@code maxRetries}; exhausting them halts the run and fails the workflow.
 * Results flow into the shared context so later steps can reference them with
 * <code>${step_result}</code> placeholders.
 *
 * State is persisted after every transition. Many runs may be in flight at once on the
 * bounded run pool; cancellation is cooperative and takes effect between steps.
 */
@ApplicationScoped
public class WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);
    private static final String SOURCE = "orchestrator";

    private final StepExecutor stepExecutor;
    private final ContextSubstitutor substitutor;
    private final StateStore stateStore;
    private final EventBus eventBus;
    private final LearningService learning;
    private final ExecutionMetrics metrics;
    private final Duration retryBackoff;
    private final List<String> filePrefixes;
    private final List<String> contactPrefixes;

    // In-flight runs
    private final Map<String, WorkflowExecutionState> inFlight = new ConcurrentHashMap<>();
    private final Set<String> cancelRequested = ConcurrentHashMap.newKeySet();

    private final ExecutorService runPool;

    @Inject
    public WorkflowOrchestrator(
            StepExecutor stepExecutor,
            ContextSubstitutor substitutor,
            StateStore stateStore,
            EventBus eventBus,
            LearningService learning,
            ExecutionMetrics metrics,
            OrchestratorConfig config
    ) {
        this.stepExecutor = stepExecutor;
        this.substitutor = substitutor;
        this.stateStore = stateStore;
        this.eventBus = eventBus;
        this.learning = learning;
        this.metrics = metrics;
        this.retryBackoff = config.execution().retryBackoff();
        this.filePrefixes = List.copyOf(config.context().fileActionPrefixes());
        this.contactPrefixes = List.copyOf(config.context().contactActionPrefixes());
        this.runPool = Executors.newFixedThreadPool(
                Math.max(1, config.execution().maxConcurrentRuns()),
                new WorkerThreadFactory("workflow-run"));
    }

    /**
     * Execute a plan on the calling thread and return its terminal state.
     * In {@link ExecutionMode#PLAN_ONLY} mode the pending state is persisted and nothing runs.
     */
    public WorkflowExecutionState execute(WorkflowDAG dag, Caller caller, ExecutionMode mode, String request) {
        WorkflowExecutionState initial = WorkflowExecutionState.create(dag, mode, request);
        stateStore.storeWorkflowDefinition(dag);

        if (mode == ExecutionMode.PLAN_ONLY) {
            stateStore.createWorkflowSession(initial);
            log.info("Planned workflow {} '{}' with {} steps (not executed)", dag.id(), dag.name(), dag.size());
            return initial;
        }

        Run run = new Run(dag, caller, initial.start());
        inFlight.put(dag.id(), run.state);
        stateStore.createWorkflowSession(run.state);
        metrics.recordWorkflowStarted();

        log.info("Starting workflow {} '{}' with {} steps", dag.id(), dag.name(), dag.size());
        emit(run, EventNames.WORKFLOW_STARTED, Map.of(
                "workflow_id", dag.id(),
                "name", dag.name(),
                "steps", dag.nodeIds(),
                "estimated_duration_seconds", dag.estimatedDurationSeconds()));

        try {
            runSteps(run);
            finish(run, null);
        } catch (WorkflowExhaustedException e) {
            log.warn("Workflow {} halted: {}", dag.id(), e.getMessage());
            finish(run, e);
        } catch (RuntimeException e) {
            log.error("Workflow {} aborted by unexpected error", dag.id(), e);
            inFlight.compute(dag.id(), (id, current) -> {
                cancelRequested.remove(id);
                run.update(run.state.fail("Internal error: " + e.getMessage()));
                stateStore.completeWorkflowSession(run.state);
                return null;
            });
            metrics.recordWorkflowFailed();
            throw e;
        }
        return run.state;
    }

    /**
     * Execute a plan on the run pool
     */
    public CompletableFuture<WorkflowExecutionState> submit(
            WorkflowDAG dag,
            Caller caller,
            ExecutionMode mode,
            String request
    ) {
        return CompletableFuture.supplyAsync(() -> execute(dag, caller, mode, request), runPool);
    }

    /**
     * Request cancellation. The stored status flips to cancelled immediately;
     * the run itself stops once its current step returns.
     *
     * @return false if the workflow is unknown or already finished
     */
    public boolean cancel(String workflowId) {
        // runs under the same per-workflow lock as persist and finish
        AtomicBoolean requested = new AtomicBoolean(false);
        inFlight.computeIfPresent(workflowId, (id, running) -> {
            cancelRequested.add(id);
            stateStore.updateWorkflowSession(running.cancel());
            requested.set(true);
            return running;
        });
        if (requested.get()) {
            log.info("Cancellation requested for workflow {}", workflowId);
            return true;
        }

        Optional<WorkflowExecutionState> stored = stateStore.getWorkflowState(workflowId);
        if (stored.isPresent() && !stored.get().isFinished()) {
            stateStore.completeWorkflowSession(stored.get().cancel());
            metrics.recordWorkflowCancelled();
            log.info("Cancelled workflow {} before it started", workflowId);
            return true;
        }
        return false;
    }

    /**
     * Best known state: the store first, then in-flight memory
     */
    public Optional<WorkflowExecutionState> status(String workflowId) {
        Optional<WorkflowExecutionState> stored = stateStore.getWorkflowState(workflowId);
        return stored.isPresent() ? stored : Optional.ofNullable(inFlight.get(workflowId));
    }

    public List<WorkflowExecutionState> activeWorkflows() {
        return new ArrayList<>(inFlight.values());
    }

    @PreDestroy
    void shutdown() {
        log.info("Shutting down orchestrator with {} workflow(s) in flight", inFlight.size());
        runPool.shutdownNow();
        metrics.logReport();
    }

    // ---------------------------------------------------------------------
    // Run loop
    // ---------------------------------------------------------------------

    private void runSteps(Run run) {
        for (DAGNode node : run.dag.nodes()) {
            if (cancelRequested.contains(run.dag.id())) {
                log.info("Workflow {} cancelled before step '{}'", run.dag.id(), node.id());
                return;
            }

            if (node.isBlocked()) {
                skip(run, node, "Blocked by dropped step(s) " + node.blockedBy());
                continue;
            }

            List<String> unmet = new ArrayList<>();
            for (String dependency : node.dependencies()) {
                StepState upstream = run.state.step(dependency);
                if (upstream == null || upstream.status() != StepStatus.COMPLETED) {
                    unmet.add(dependency);
                }
            }
            if (!unmet.isEmpty()) {
                skip(run, node, "Dependencies not completed: " + unmet);
                continue;
            }

            runStep(run, node);
        }
    }

    private void runStep(Run run, DAGNode node) {
        int maxAttempts = 1 + node.maxRetries();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            StepState step = run.state.step(node.id()).start();
            run.update(run.state.withStep(step));
            persist(run);
            metrics.recordStepAttempt();

            emit(run, EventNames.ACTION_STARTED, Map.of(
                    "workflow_id", run.dag.id(),
                    "step_id", node.id(),
                    "action", node.action(),
                    "attempt", step.attempts()));

            Map<String, Object> params = substitutor.substitute(node.params(), run.state.context());
            log.debug("Executing step '{}' ({}) attempt {}/{}", node.id(), node.action(), attempt, maxAttempts);
            StepOutcome outcome = stepExecutor.execute(node, run.caller, params);

            if (outcome.success()) {
                run.update(run.state.withStep(step.complete(outcome.data())));
                run.update(run.state.withContext(contextEntries(run, node, outcome.data())));
                persist(run);

                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("workflow_id", run.dag.id());
                payload.put("step_id", node.id());
                payload.put("action", node.action());
                payload.put("attempts", step.attempts());
                payload.put("cached", outcome.cached());
                payload.put("duration_ms", outcome.durationMillis());
                emit(run, EventNames.WORKFLOW_STEP_COMPLETED, payload);
                return;
            }

            String error = outcome.error() != null ? outcome.error() : "Step failed";
            run.update(run.state.withError(StepError.of(node.id(), step.attempts(), outcome.errorKind(), error)));

            if (attempt < maxAttempts) {
                log.warn("Step '{}' attempt {}/{} failed ({}), retrying: {}",
                        node.id(), attempt, maxAttempts, outcome.errorKind(), error);
                run.update(run.state.withStep(step.retry(error, outcome.errorKind(), outcome.httpStatus())));
                persist(run);
                metrics.recordStepRetry();
                if (!pauseBeforeRetry(run)) {
                    return;
                }
            } else {
                run.update(run.state.withStep(step.fail(error, outcome.errorKind(), outcome.httpStatus())));
                persist(run);
                throw new WorkflowExhaustedException(node.id(), node.action(), step.attempts(), error);
            }
        }
    }

    /**
     * @return false if the run was interrupted and should stop
     */
    private boolean pauseBeforeRetry(Run run) {
        if (retryBackoff.isZero() || retryBackoff.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(retryBackoff.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Workflow {} interrupted during retry backoff", run.dag.id());
            cancelRequested.add(run.dag.id());
            return false;
        }
    }

    private void skip(Run run, DAGNode node, String reason) {
        log.info("Skipping step '{}' of workflow {}: {}", node.id(), run.dag.id(), reason);
        run.update(run.state.withStep(run.state.step(node.id()).skip(reason)));
        persist(run);
        metrics.recordStepSkipped();
    }

    private void finish(Run run, WorkflowExhaustedException exhausted) {
        String workflowId = run.dag.id();

        // leaving inFlight and storing the terminal state is one step, so a late cancel finds nothing to flip
        inFlight.compute(workflowId, (id, current) -> {
            boolean cancelled = cancelRequested.remove(id);
            if (exhausted != null) {
                run.update(run.state.fail(exhausted.getMessage()));
            } else if (cancelled) {
                run.update(run.state.cancel());
            } else {
                run.update(run.state.complete());
            }
            stateStore.completeWorkflowSession(run.state);
            return null;
        });

        switch (run.state.status()) {
            case FAILED -> metrics.recordWorkflowFailed();
            case CANCELLED -> metrics.recordWorkflowCancelled();
            default -> metrics.recordWorkflowCompleted();
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("workflow_id", workflowId);
        payload.put("name", run.dag.name());
        payload.put("completed_steps", run.state.countSteps(StepStatus.COMPLETED));
        payload.put("skipped_steps", run.state.countSteps(StepStatus.SKIPPED));
        payload.put("duration_ms", run.state.getDuration().toMillis());

        WorkflowStatus status = run.state.status();
        switch (status) {
            case COMPLETED -> emit(run, EventNames.WORKFLOW_COMPLETED, payload);
            case FAILED -> {
                payload.put("error", run.state.error());
                payload.put("failed_step", exhausted != null ? exhausted.stepId() : null);
                emit(run, EventNames.WORKFLOW_FAILED, payload);
            }
            case CANCELLED -> emit(run, EventNames.WORKFLOW_CANCELLED, payload);
            default -> throw new IllegalStateException("Workflow " + workflowId + " finished as " + status);
        }

        log.info("Workflow {} {} in {}ms ({} completed, {} skipped)",
                workflowId, status.wireName(), run.state.getDuration().toMillis(),
                payload.get("completed_steps"), payload.get("skipped_steps"));

        learning.submitOutcome(run.state);
    }

    /**
     * Persist the current state. While cancellation is pending the stored copy stays cancelled.
     */
    private void persist(Run run) {
        WorkflowExecutionState state = run.state;
        inFlight.compute(state.workflowId(), (id, current) -> {
            if (cancelRequested.contains(id) && !state.isFinished()) {
                stateStore.updateWorkflowSession(state.cancel());
            } else {
                stateStore.updateWorkflowSession(state);
            }
            return state;
        });
    }

    // ---------------------------------------------------------------------
    // Context propagation
    // ---------------------------------------------------------------------

    /**
     * Context entries contributed by a completed step: its raw result plus well-known
     * identifiers pulled out of map results.
     */
    private Map<String, Object> contextEntries(Run run, DAGNode node, Object result) {
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put(node.id() + "_result", result);

        if (!(result instanceof Map<?, ?> data)) {
            return entries;
        }

        Object id = data.get("id");
        if (id != null) {
            entries.put("last_resource_id", id);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("action", node.action());
            metadata.put("workflow_id", run.dag.id());
            metadata.put("step_id", node.id());
            Object name = data.get("name");
            if (name != null) {
                metadata.put("name", name);
            }
            stateStore.storeResource(resourceType(node.action()), id.toString(), metadata);
        }

        if (hasPrefix(node.action(), filePrefixes)) {
            if (id != null) {
                entries.put("last_file_id", id);
            }
            Object webUrl = data.get("webUrl");
            if (webUrl != null) {
                entries.put("last_file_url", webUrl);
            }
        }

        if (id != null && hasPrefix(node.action(), contactPrefixes)) {
            entries.put("last_contact_id", id);
        }
        return entries;
    }

    private static boolean hasPrefix(String action, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (!prefix.isBlank() && action.startsWith(prefix.trim())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Resource registry type: the action prefix up to the first underscore
     */
    static String resourceType(String action) {
        int underscore = action.indexOf('_');
        return underscore > 0 ? action.substring(0, underscore) : action;
    }

    private void emit(Run run, String name, Map<String, Object> payload) {
        eventBus.emit(name, SOURCE, payload,
                new EventIds(run.dag.id(), run.caller.userId(), run.caller.sessionId()));
    }

    /**
     * Mutable holder for one run's evolving immutable state
     */
    private static final class Run {
        private final WorkflowDAG dag;
        private final Caller caller;
        private WorkflowExecutionState state;

        private Run(WorkflowDAG dag, Caller caller, WorkflowExecutionState state) {
            this.dag = dag;
            this.caller = caller;
            this.state = state;
        }

        private void update(WorkflowExecutionState next) {
            this.state = next;
        }
    }
}
