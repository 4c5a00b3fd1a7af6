package org.neuralchilli.actionflow.state;

import java.time.Duration;
import java.util.Map;

/**
 * Health of a backend-facing component.
 */
public record HealthReport(Status status, String backend, Duration latency, String message, Map<String, Object> details) {

    public enum Status {
        HEALTHY,
        DEGRADED,
        UNHEALTHY;

        public String wireName() {
            return name().toLowerCase();
        }
    }

    public HealthReport {
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        latency = latency == null ? Duration.ZERO : latency;
        details = details == null ? Map.of() : details;
    }

    public static HealthReport healthy(String backend, Duration latency) {
        return new HealthReport(Status.HEALTHY, backend, latency, "ok", Map.of());
    }

    public static HealthReport degraded(String backend, Duration latency, String message) {
        return new HealthReport(Status.DEGRADED, backend, latency, message, Map.of());
    }

    public static HealthReport unhealthy(String backend, String message) {
        return new HealthReport(Status.UNHEALTHY, backend, Duration.ZERO, message, Map.of());
    }

    public HealthReport withDetails(Map<String, Object> newDetails) {
        return new HealthReport(status, backend, latency, message, newDetails);
    }

    public boolean isHealthy() {
        return status == Status.HEALTHY;
    }
}
