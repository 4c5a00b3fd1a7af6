package org.neuralchilli.actionflow.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.List;

/**
 * Typed view over the {@code orchestrator.*} configuration tree.
 */
@ConfigMapping(prefix = "orchestrator")
public interface OrchestratorConfig {

    State state();

    Execution execution();

    Context context();

    Learning learning();

    Audit audit();

    Planner planner();

    interface State {

        /**
         * TTL of a workflow session while it is running
         */
        @WithName("session-ttl")
        @WithDefault("PT1H")
        Duration sessionTtl();

        /**
         * TTL of a workflow session after it reached a terminal state
         */
        @WithName("completed-retention")
        @WithDefault("PT24H")
        Duration completedRetention();

        @WithName("resource-ttl")
        @WithDefault("PT24H")
        Duration resourceTtl();

        @WithName("context-ttl")
        @WithDefault("PT2H")
        Duration contextTtl();

        @WithName("cache-ttl")
        @WithDefault("PT1H")
        Duration cacheTtl();

        @WithName("definition-ttl")
        @WithDefault("PT24H")
        Duration definitionTtl();
    }

    interface Execution {

        @WithName("default-timeout")
        @WithDefault("PT5M")
        Duration defaultTimeout();

        /**
         * Added to a step's estimated duration to derive its timeout
         */
        @WithName("timeout-buffer")
        @WithDefault("PT60S")
        Duration timeoutBuffer();

        @WithName("default-max-retries")
        @WithDefault("3")
        int defaultMaxRetries();

        /**
         * Pause before re-attempting a failed step. Zero retries immediately.
         */
        @WithName("retry-backoff")
        @WithDefault("PT0S")
        Duration retryBackoff();

        @WithName("max-concurrent-runs")
        @WithDefault("8")
        int maxConcurrentRuns();

        @WithName("cache-idempotent-results")
        @WithDefault("true")
        boolean cacheIdempotentResults();
    }

    interface Context {

        @WithName("file-action-prefixes")
        @WithDefault("onedrive_,sharepoint_")
        List<String> fileActionPrefixes();

        @WithName("contact-action-prefixes")
        @WithDefault("hubspot_")
        List<String> contactActionPrefixes();
    }

    interface Learning {

        @WithDefault("true")
        boolean enabled();

        @WithName("similarity-threshold")
        @WithDefault("0.3")
        double similarityThreshold();

        /**
         * Minimum similarity before a user correction replaces a proposed plan
         */
        @WithName("correction-apply-threshold")
        @WithDefault("0.6")
        double correctionApplyThreshold();

        @WithName("confidence-step")
        @WithDefault("0.1")
        double confidenceStep();

        @WithName("feedback-retention")
        @WithDefault("P90D")
        Duration feedbackRetention();

        @WithName("pattern-retention")
        @WithDefault("P90D")
        Duration patternRetention();
    }

    interface Audit {

        @WithDefault("true")
        boolean enabled();

        @WithName("offload-enabled")
        @WithDefault("true")
        boolean offloadEnabled();

        @WithName("offload-threshold-bytes")
        @WithDefault("10485760")
        long offloadThresholdBytes();

        @WithName("redacted-keys")
        @WithDefault("payload,body,content,attachments,attachment,file_content,data")
        List<String> redactedKeys();

        @WithName("record-retention")
        @WithDefault("P30D")
        Duration recordRetention();
    }

    interface Planner {

        /**
         * Action used for the single-step plan when planning fails
         */
        @WithName("fallback-action")
        @WithDefault("assistant_generate_response")
        String fallbackAction();
    }
}
