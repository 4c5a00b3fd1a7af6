package org.neuralchilli.actionflow.learning;

import java.util.Map;

public record LearningMetrics(
        int totalPatterns,
        Map<String, Integer> patternsByCategory,
        double averageConfidence,
        double averageSuccessRate
) {
    public LearningMetrics {
        patternsByCategory = patternsByCategory == null ? Map.of() : Map.copyOf(patternsByCategory);
    }
}
