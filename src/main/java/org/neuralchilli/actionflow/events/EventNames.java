package org.neuralchilli.actionflow.events;

/**
 * Logical event names. The name doubles as the channel.
 */
public final class EventNames {

    // Workflow lifecycle
    public static final String WORKFLOW_STARTED = "workflow.started";
    public static final String WORKFLOW_STEP_COMPLETED = "workflow.step_completed";
    public static final String WORKFLOW_COMPLETED = "workflow.completed";
    public static final String WORKFLOW_FAILED = "workflow.failed";
    public static final String WORKFLOW_CANCELLED = "workflow.cancelled";

    // Action lifecycle
    public static final String ACTION_STARTED = "action.started";
    public static final String ACTION_COMPLETED = "action.completed";
    public static final String ACTION_FAILED = "action.failed";

    public static final String PLAN_GENERATED = "plan.generated";
    public static final String LEARNING_FEEDBACK_RECORDED = "learning.feedback_recorded";
    public static final String AUDIT_RECORDED = "audit.recorded";
    public static final String RESPONSE_OFFLOADED = "response.offloaded";

    // System
    public static final String SYSTEM_ERROR = "system.error";
    public static final String SYSTEM_WARNING = "system.warning";
    public static final String SYSTEM_INFO = "system.info";

    private EventNames() {
    }
}
