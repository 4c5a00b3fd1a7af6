package org.neuralchilli.actionflow.domain;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome or correction handed to the learning subsystem.
 */
public record FeedbackRecord(
        String id,
        FeedbackType type,
        LearningCategory category,
        String originalRequest,
        String workflowId,
        String userId,
        Instant timestamp,
        Map<String, Object> originalPlan,
        Map<String, Object> executionResult,
        Map<String, Object> userCorrection,
        Map<String, Object> performanceMetrics,
        Map<String, Object> errorDetails,
        double confidence
) {
    public FeedbackRecord {
        if (type == null) {
            throw new IllegalArgumentException("Feedback type cannot be null");
        }
        if (category == null) {
            throw new IllegalArgumentException("Learning category cannot be null");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0 and 1, got: " + confidence);
        }

        // Defaults
        if (id == null) {
            id = "fb_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        if (originalRequest == null) {
            originalRequest = "";
        }
        originalPlan = originalPlan == null ? Map.of() : originalPlan;
        executionResult = executionResult == null ? Map.of() : executionResult;
        userCorrection = userCorrection == null ? Map.of() : userCorrection;
        performanceMetrics = performanceMetrics == null ? Map.of() : performanceMetrics;
        errorDetails = errorDetails == null ? Map.of() : errorDetails;
    }

    public static Builder builder(FeedbackType type, LearningCategory category) {
        return new Builder(type, category);
    }

    public static class Builder {
        private final FeedbackType type;
        private final LearningCategory category;
        private String originalRequest;
        private String workflowId;
        private String userId;
        private Map<String, Object> originalPlan;
        private Map<String, Object> executionResult;
        private Map<String, Object> userCorrection;
        private Map<String, Object> performanceMetrics;
        private Map<String, Object> errorDetails;
        private double confidence = 1.0;

        private Builder(FeedbackType type, LearningCategory category) {
            this.type = type;
            this.category = category;
        }

        public Builder originalRequest(String originalRequest) {
            this.originalRequest = originalRequest;
            return this;
        }

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder originalPlan(Map<String, Object> originalPlan) {
            this.originalPlan = originalPlan;
            return this;
        }

        public Builder executionResult(Map<String, Object> executionResult) {
            this.executionResult = executionResult;
            return this;
        }

        public Builder userCorrection(Map<String, Object> userCorrection) {
            this.userCorrection = userCorrection;
            return this;
        }

        public Builder performanceMetrics(Map<String, Object> performanceMetrics) {
            this.performanceMetrics = performanceMetrics;
            return this;
        }

        public Builder errorDetails(Map<String, Object> errorDetails) {
            this.errorDetails = errorDetails;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public FeedbackRecord build() {
            return new FeedbackRecord(null, type, category, originalRequest, workflowId, userId, null,
                    originalPlan, executionResult, userCorrection, performanceMetrics, errorDetails, confidence);
        }
    }
}
