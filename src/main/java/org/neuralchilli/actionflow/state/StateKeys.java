package org.neuralchilli.actionflow.state;

/**
 * Colon-delimited key layout shared by every writer of the state store.
 */
public final class StateKeys {

    public static final String WORKFLOW = "workflow:";
    public static final String WORKFLOW_DEFINITION = "workflow_def:";
    public static final String RESOURCE = "resource:";
    public static final String CONTEXT = "context:";
    public static final String ACTION_CACHE = "cache:action:";
    public static final String PATTERN = "pattern:";
    public static final String FEEDBACK = "feedback:";
    public static final String AUDIT = "audit:";
    public static final String BLOB = "blob:";

    private StateKeys() {
    }

    public static String workflow(String workflowId) {
        return WORKFLOW + workflowId;
    }

    public static String workflowDefinition(String workflowId) {
        return WORKFLOW_DEFINITION + workflowId;
    }

    public static String resource(String type, String id) {
        return RESOURCE + type + ":" + id;
    }

    public static String resourcePrefix(String type) {
        return RESOURCE + type + ":";
    }

    public static String context(String userId) {
        return CONTEXT + userId;
    }

    public static String actionCache(String action, String fingerprint) {
        return ACTION_CACHE + action + ":" + fingerprint;
    }

    public static String pattern(String patternId) {
        return PATTERN + patternId;
    }

    public static String feedback(String feedbackId) {
        return FEEDBACK + feedbackId;
    }

    public static String audit(String auditId) {
        return AUDIT + auditId;
    }

    public static String blob(String name) {
        return BLOB + name;
    }
}
