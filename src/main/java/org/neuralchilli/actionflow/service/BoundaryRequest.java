package org.neuralchilli.actionflow.service;

import org.neuralchilli.actionflow.action.Caller;
import org.neuralchilli.actionflow.domain.ExecutionMode;

import java.util.Map;

/**
 * A call into the orchestration boundary: either a direct action name or a
 * natural-language request.
 */
public record BoundaryRequest(
        String action,
        String request,
        Map<String, Object> params,
        ExecutionMode mode,
        Caller caller
) {
    public BoundaryRequest {
        boolean hasAction = action != null && !action.isBlank();
        boolean hasRequest = request != null && !request.isBlank();
        if (!hasAction && !hasRequest) {
            throw new IllegalArgumentException("Either an action or a request is required");
        }
        if (caller == null) {
            throw new IllegalArgumentException("Caller cannot be null");
        }
        params = params == null ? Map.of() : params;
        mode = mode == null ? ExecutionMode.EXECUTE : mode;
    }

    public static BoundaryRequest action(String action, Map<String, Object> params, ExecutionMode mode, Caller caller) {
        return new BoundaryRequest(action, null, params, mode, caller);
    }

    public static BoundaryRequest naturalLanguage(String request, ExecutionMode mode, Caller caller) {
        return new BoundaryRequest(null, request, Map.of(), mode, caller);
    }

    public boolean isActionCall() {
        return action != null && !action.isBlank();
    }

    /**
     * Name used for audit records and offloaded file names
     */
    public String label() {
        return isActionCall() ? action : "natural_language_request";
    }
}
