package org.neuralchilli.actionflow.worker;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.actionflow.action.Action;
import org.neuralchilli.actionflow.action.ActionRegistry;
import org.neuralchilli.actionflow.action.ActionResult;
import org.neuralchilli.actionflow.action.Caller;
import org.neuralchilli.actionflow.config.OrchestratorConfig;
import org.neuralchilli.actionflow.domain.DAGNode;
import org.neuralchilli.actionflow.monitoring.ExecutionMetrics;
import org.neuralchilli.actionflow.state.Fingerprints;
import org.neuralchilli.actionflow.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a single attempt of a step against the action registry under the step's timeout.
 * Never throws for action failures; every failure comes back as a failed {@link StepOutcome}.
 */
@ApplicationScoped
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final ActionRegistry registry;
    private final StateStore stateStore;
    private final ExecutionMetrics metrics;
    private final boolean cacheIdempotentResults;
    private final ExecutorService stepPool;

    @Inject
    public StepExecutor(
            ActionRegistry registry,
            StateStore stateStore,
            ExecutionMetrics metrics,
            OrchestratorConfig config
    ) {
        this.registry = registry;
        this.stateStore = stateStore;
        this.metrics = metrics;
        this.cacheIdempotentResults = config.execution().cacheIdempotentResults();
        this.stepPool = Executors.newCachedThreadPool(new WorkerThreadFactory("step"));
    }

    /**
     * Execute one attempt of a node with already-substituted parameters.
     */
    public StepOutcome execute(DAGNode node, Caller caller, Map<String, Object> params) {
        long start = System.nanoTime();

        Optional<Action> resolved = registry.find(node.action());
        if (resolved.isEmpty()) {
            log.warn("Action '{}' for step '{}' not found", node.action(), node.id());
            return StepOutcome.failure("action_not_found", 404,
                    "Action '" + node.action() + "' not found", elapsedMillis(start));
        }
        Action action = resolved.get();

        String fingerprint = null;
        if (cacheIdempotentResults && action.idempotent()) {
            fingerprint = Fingerprints.of(action.name(), params);
            Optional<Object> cached = stateStore.getCachedResult(action.name(), fingerprint);
            if (cached.isPresent()) {
                metrics.recordCacheHit();
                log.debug("Step '{}' served from cache ({})", node.id(), action.name());
                return StepOutcome.cached(cached.get());
            }
            metrics.recordCacheMiss();
        }

        try {
            ActionResult result = invoke(node, action, caller, params);
            if (fingerprint != null) {
                stateStore.cacheActionResult(action.name(), fingerprint, result.data());
            }
            return StepOutcome.success(result.data(), elapsedMillis(start));
        } catch (StepTimeoutException e) {
            metrics.recordStepTimeout();
            log.warn(e.getMessage());
            return StepOutcome.failure(e.errorKind(), e.httpStatus(), e.getMessage(), elapsedMillis(start));
        } catch (StepExecutionException e) {
            log.debug("Step '{}' failed ({}): {}", node.id(), e.errorKind(), e.getMessage());
            return StepOutcome.failure(e.errorKind(), e.httpStatus(), e.getMessage(), elapsedMillis(start));
        }
    }

    private ActionResult invoke(DAGNode node, Action action, Caller caller, Map<String, Object> params) {
        Future<ActionResult> future = stepPool.submit(() -> action.execute(caller, params));

        ActionResult result;
        try {
            result = future.get(node.timeoutSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StepTimeoutException(node.id(), node.timeoutSeconds());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new StepExecutionException("exception", 500,
                    cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new StepExecutionException("interrupted", 500, "Step '" + node.id() + "' interrupted", e);
        }

        if (result == null) {
            throw new StepExecutionException("invalid_result", 500, "Action '" + action.name() + "' returned no result");
        }
        if (!result.isSuccess()) {
            throw new StepExecutionException(result.errorKind(), result.httpStatus(),
                    result.message() != null ? result.message() : "Action '" + action.name() + "' reported an error");
        }
        return result;
    }

    @PreDestroy
    void shutdown() {
        stepPool.shutdownNow();
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
