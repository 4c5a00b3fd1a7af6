package org.neuralchilli.actionflow.learning;

import org.neuralchilli.actionflow.domain.LearningPattern;

/**
 * A pattern matched against a request, with its keyword similarity.
 */
public record ScoredPattern(LearningPattern pattern, double similarity) {

    /**
     * Ranking score: similarity weighted by how often the pattern worked
     */
    public double score() {
        return similarity * pattern.successRate();
    }
}
