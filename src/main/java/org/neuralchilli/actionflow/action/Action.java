package org.neuralchilli.actionflow.action;

import java.util.Map;

/**
 * A registered capability against an external service.
 * Implementations may throw; the step executor records the exception as a failed attempt.
 */
public interface Action {

    /**
     * Unique registry name, e.g. {@code onedrive_upload_file}
     */
    String name();

    /**
     * Grouping tag used for discovery
     */
    default String category() {
        return "general";
    }

    /**
     * Whether identical invocations may be served from the result cache
     */
    default boolean idempotent() {
        return false;
    }

    default int estimatedDurationSeconds() {
        return 60;
    }

    ActionResult execute(Caller caller, Map<String, Object> params) throws Exception;
}
