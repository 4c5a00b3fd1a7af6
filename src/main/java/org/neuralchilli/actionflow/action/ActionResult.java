package org.neuralchilli.actionflow.action;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one action invocation. Errors always carry a kind and an HTTP-style code.
 */
public record ActionResult(
        Status status,
        Object data,
        String errorKind,
        int httpStatus,
        String message
) {
    public enum Status {
        SUCCESS,
        ERROR;

        public String wireName() {
            return name().toLowerCase();
        }
    }

    public ActionResult {
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (status == Status.ERROR) {
            if (errorKind == null || errorKind.isBlank()) {
                errorKind = "unknown_error";
            }
            // An error must never look successful
            if (httpStatus < 400) {
                httpStatus = 500;
            }
        } else if (httpStatus <= 0) {
            httpStatus = 200;
        }
    }

    public static ActionResult success(Object data) {
        return new ActionResult(Status.SUCCESS, data, null, 200, null);
    }

    public static ActionResult error(String errorKind, int httpStatus, String message) {
        return new ActionResult(Status.ERROR, null, errorKind, httpStatus, message);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /**
     * Mapping form used at the boundary
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", status.wireName());
        map.put("http_status", httpStatus);
        if (isSuccess()) {
            map.put("data", data);
        } else {
            map.put("error_kind", errorKind);
            map.put("message", message);
        }
        return map;
    }
}
