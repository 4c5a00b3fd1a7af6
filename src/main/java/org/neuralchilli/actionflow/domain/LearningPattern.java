package org.neuralchilli.actionflow.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A reusable observation mined from feedback, matched to new requests by keyword overlap.
 */
public record LearningPattern(
        String id,
        LearningCategory category,
        Set<String> triggers,
        Map<String, Object> payload,
        double confidence,
        int usageCount,
        double successRate,
        Instant createdAt,
        Instant updatedAt
) {
    public LearningPattern {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Pattern id cannot be null or empty");
        }
        if (category == null) {
            throw new IllegalArgumentException("Category cannot be null");
        }
        if (usageCount < 0) {
            throw new IllegalArgumentException("Usage count cannot be negative");
        }

        // Defaults
        triggers = triggers == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(triggers));
        payload = payload == null ? Map.of() : payload;
        confidence = clamp(confidence);
        successRate = clamp(successRate);
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * Seed a new pattern
     */
    public static LearningPattern seed(
            String id,
            LearningCategory category,
            Set<String> triggers,
            Map<String, Object> payload,
            double confidence,
            double successRate
    ) {
        Instant now = Instant.now();
        return new LearningPattern(id, category, triggers, payload, confidence, 1, successRate, now, now);
    }

    /**
     * Count a reuse and nudge confidence upward, capped at 1.0
     */
    public LearningPattern reinforce(double confidenceStep) {
        return new LearningPattern(id, category, triggers, payload, confidence + confidenceStep,
                usageCount + 1, successRate, createdAt, Instant.now());
    }

    /**
     * Fold an observed outcome into the running success rate
     */
    public LearningPattern recordOutcome(boolean success, double confidenceStep) {
        double outcome = success ? 1.0 : 0.0;
        double rate = (successRate * usageCount + outcome) / (usageCount + 1);
        double nudged = success ? confidence + confidenceStep : confidence;
        return new LearningPattern(id, category, triggers, payload, nudged,
                usageCount + 1, rate, createdAt, Instant.now());
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
