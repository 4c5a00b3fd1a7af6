package org.neuralchilli.actionflow.service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Status code, JSON-serializable body and response headers returned by the boundary.
 */
public record BoundaryResponse(int httpStatus, Map<String, Object> body, Map<String, String> headers) {

    public BoundaryResponse {
        body = body == null ? Map.of() : body;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static BoundaryResponse ok(Map<String, Object> body) {
        return new BoundaryResponse(200, body, Map.of());
    }

    public static BoundaryResponse error(int httpStatus, String errorKind, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "error");
        body.put("error", errorKind);
        body.put("message", message);
        return new BoundaryResponse(httpStatus, body, Map.of());
    }

    public BoundaryResponse withHeader(String name, String value) {
        Map<String, String> updated = new LinkedHashMap<>(headers);
        updated.put(name, value);
        return new BoundaryResponse(httpStatus, body, updated);
    }

    public boolean isSuccess() {
        return httpStatus >= 200 && httpStatus < 300;
    }
}
