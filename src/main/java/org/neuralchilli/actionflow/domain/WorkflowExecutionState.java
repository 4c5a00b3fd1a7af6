package org.neuralchilli.actionflow.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Progress of one workflow run. Persisted after every step transition.
 */
public record WorkflowExecutionState(
        String workflowId,
        String name,
        String originalRequest,
        ExecutionMode mode,
        WorkflowStatus status,
        Map<String, StepState> steps,
        Map<String, Object> context,
        List<StepError> errors,
        Instant startedAt,
        Instant updatedAt,
        Instant completedAt,
        String error
) {
    public WorkflowExecutionState {
        if (workflowId == null || workflowId.isBlank()) {
            throw new IllegalArgumentException("Workflow id cannot be null or empty");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (mode == null) {
            mode = ExecutionMode.EXECUTE;
        }

        // Defaults
        steps = steps == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(steps));
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Create the initial state for a plan, every step pending
     */
    public static WorkflowExecutionState create(WorkflowDAG dag, ExecutionMode mode, String originalRequest) {
        Map<String, StepState> steps = new LinkedHashMap<>();
        for (DAGNode node : dag.nodes()) {
            steps.put(node.id(), StepState.pending(node));
        }
        Instant now = Instant.now();
        return new WorkflowExecutionState(
                dag.id(),
                dag.name(),
                originalRequest,
                mode,
                WorkflowStatus.PENDING,
                steps,
                Map.of(),
                List.of(),
                now,
                now,
                null,
                null
        );
    }

    /**
     * Update status
     */
    public WorkflowExecutionState withStatus(WorkflowStatus newStatus) {
        return new WorkflowExecutionState(workflowId, name, originalRequest, mode, newStatus, steps,
                context, errors, startedAt, Instant.now(), completedAt, error);
    }

    /**
     * Mark as running
     */
    public WorkflowExecutionState start() {
        Instant now = Instant.now();
        return new WorkflowExecutionState(workflowId, name, originalRequest, mode, WorkflowStatus.RUNNING,
                steps, context, errors, now, now, null, null);
    }

    /**
     * Replace one step's state
     */
    public WorkflowExecutionState withStep(StepState step) {
        Map<String, StepState> updated = new LinkedHashMap<>(steps);
        updated.put(step.stepId(), step);
        return new WorkflowExecutionState(workflowId, name, originalRequest, mode, status, updated,
                context, errors, startedAt, Instant.now(), completedAt, error);
    }

    /**
     * Merge entries into the shared context
     */
    public WorkflowExecutionState withContext(Map<String, Object> entries) {
        Map<String, Object> merged = new LinkedHashMap<>(context);
        merged.putAll(entries);
        return new WorkflowExecutionState(workflowId, name, originalRequest, mode, status, steps,
                merged, errors, startedAt, Instant.now(), completedAt, error);
    }

    /**
     * Append to the error log
     */
    public WorkflowExecutionState withError(StepError stepError) {
        List<StepError> appended = new ArrayList<>(errors);
        appended.add(stepError);
        return new WorkflowExecutionState(workflowId, name, originalRequest, mode, status, steps,
                context, appended, startedAt, Instant.now(), completedAt, error);
    }

    /**
     * Mark as completed
     */
    public WorkflowExecutionState complete() {
        return finish(WorkflowStatus.COMPLETED, null);
    }

    /**
     * Mark as failed
     */
    public WorkflowExecutionState fail(String errorMessage) {
        return finish(WorkflowStatus.FAILED, errorMessage);
    }

    /**
     * Mark as cancelled
     */
    public WorkflowExecutionState cancel() {
        return finish(WorkflowStatus.CANCELLED, "Cancelled by request");
    }

    public StepState step(String stepId) {
        return steps.get(stepId);
    }

    public long countSteps(StepStatus stepStatus) {
        return steps.values().stream().filter(s -> s.status() == stepStatus).count();
    }

    /**
     * Results of completed steps keyed by step id
     */
    public Map<String, Object> stepResults() {
        Map<String, Object> results = new LinkedHashMap<>();
        steps.values().stream()
                .filter(s -> s.status() == StepStatus.COMPLETED)
                .forEach(s -> results.put(s.stepId(), s.result()));
        return results;
    }

    public boolean isFinished() {
        return status.isTerminal();
    }

    public Duration getDuration() {
        Instant end = completedAt != null ? completedAt : Instant.now();
        return startedAt != null ? Duration.between(startedAt, end) : Duration.ZERO;
    }

    private WorkflowExecutionState finish(WorkflowStatus terminal, String errorMessage) {
        Instant now = Instant.now();
        return new WorkflowExecutionState(workflowId, name, originalRequest, mode, terminal, steps,
                context, errors, startedAt, now, now, errorMessage);
    }
}
