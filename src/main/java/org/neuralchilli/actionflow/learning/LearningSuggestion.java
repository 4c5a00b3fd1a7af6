package org.neuralchilli.actionflow.learning;

import org.neuralchilli.actionflow.domain.LearningCategory;
import org.neuralchilli.actionflow.domain.LearningPattern;

public record LearningSuggestion(
        String patternId,
        LearningCategory category,
        double confidence,
        double successRate,
        int usageCount,
        String suggestion
) {
    static LearningSuggestion from(LearningPattern pattern) {
        Object approach = pattern.payload().get("suggested_approach");
        return new LearningSuggestion(
                pattern.id(),
                pattern.category(),
                pattern.confidence(),
                pattern.successRate(),
                pattern.usageCount(),
                approach != null ? approach.toString() : ""
        );
    }

    public double rank() {
        return confidence * successRate;
    }
}
