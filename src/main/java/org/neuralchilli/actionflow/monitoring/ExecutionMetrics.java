package org.neuralchilli.actionflow.monitoring;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters for workflow runs, step attempts, the result cache and response offloading.
 */
@ApplicationScoped
public class ExecutionMetrics {

    private static final Logger log = LoggerFactory.getLogger(ExecutionMetrics.class);

    // Workflow metrics
    private final LongAdder workflowsStarted = new LongAdder();
    private final LongAdder workflowsCompleted = new LongAdder();
    private final LongAdder workflowsFailed = new LongAdder();
    private final LongAdder workflowsCancelled = new LongAdder();

    // Step metrics
    private final LongAdder stepAttempts = new LongAdder();
    private final LongAdder stepRetries = new LongAdder();
    private final LongAdder stepTimeouts = new LongAdder();
    private final LongAdder stepsSkipped = new LongAdder();

    // Result cache metrics
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder cacheMisses = new LongAdder();

    private final LongAdder responsesOffloaded = new LongAdder();

    public void recordWorkflowStarted() {
        workflowsStarted.increment();
    }

    public void recordWorkflowCompleted() {
        workflowsCompleted.increment();
    }

    public void recordWorkflowFailed() {
        workflowsFailed.increment();
    }

    public void recordWorkflowCancelled() {
        workflowsCancelled.increment();
    }

    public void recordStepAttempt() {
        stepAttempts.increment();
    }

    public void recordStepRetry() {
        stepRetries.increment();
    }

    public void recordStepTimeout() {
        stepTimeouts.increment();
    }

    public void recordStepSkipped() {
        stepsSkipped.increment();
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public void recordResponseOffloaded() {
        responsesOffloaded.increment();
    }

    /**
     * Percentage of cache lookups that were served from the cache
     */
    public double getCacheHitRate() {
        long hits = cacheHits.sum();
        long total = hits + cacheMisses.sum();
        return total > 0 ? (hits * 100.0) / total : 0.0;
    }

    /**
     * Percentage of finished runs that completed
     */
    public double getWorkflowSuccessRate() {
        long completed = workflowsCompleted.sum();
        long total = completed + workflowsFailed.sum();
        return total > 0 ? (completed * 100.0) / total : 0.0;
    }

    public long getStepAttempts() {
        return stepAttempts.sum();
    }

    public long getStepTimeouts() {
        return stepTimeouts.sum();
    }

    public long getCacheHits() {
        return cacheHits.sum();
    }

    public long getResponsesOffloaded() {
        return responsesOffloaded.sum();
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("workflows_started", workflowsStarted.sum());
        snapshot.put("workflows_completed", workflowsCompleted.sum());
        snapshot.put("workflows_failed", workflowsFailed.sum());
        snapshot.put("workflows_cancelled", workflowsCancelled.sum());
        snapshot.put("workflow_success_rate", getWorkflowSuccessRate());
        snapshot.put("step_attempts", stepAttempts.sum());
        snapshot.put("step_retries", stepRetries.sum());
        snapshot.put("step_timeouts", stepTimeouts.sum());
        snapshot.put("steps_skipped", stepsSkipped.sum());
        snapshot.put("cache_hits", cacheHits.sum());
        snapshot.put("cache_misses", cacheMisses.sum());
        snapshot.put("cache_hit_rate", getCacheHitRate());
        snapshot.put("responses_offloaded", responsesOffloaded.sum());
        return snapshot;
    }

    /**
     * Reset all metrics (useful for testing).
     */
    public void reset() {
        workflowsStarted.reset();
        workflowsCompleted.reset();
        workflowsFailed.reset();
        workflowsCancelled.reset();
        stepAttempts.reset();
        stepRetries.reset();
        stepTimeouts.reset();
        stepsSkipped.reset();
        cacheHits.reset();
        cacheMisses.reset();
        responsesOffloaded.reset();
        log.info("Execution metrics reset");
    }

    public void logReport() {
        log.info("Execution metrics: {}", snapshot());
    }
}
