package org.neuralchilli.actionflow.domain;

import javax.annotation.Nonnull;
import java.time.Duration;

/**
 * Shape of a validated plan as shown to callers before it runs.
 *
 * @param widestLevel         most steps sharing one execution level
 * @param blockedSteps        steps that will be skipped because a step they needed was dropped
 * @param criticalPathSeconds longest chain of estimated step durations through the dependencies
 */
public record PlanStatistics(
        int totalSteps,
        int rootSteps,
        int leafSteps,
        int executionLevels,
        int widestLevel,
        int blockedSteps,
        int criticalPathSeconds
) {
    public PlanStatistics {
        if (totalSteps < 0 || rootSteps < 0 || leafSteps < 0 || executionLevels < 0 || widestLevel < 0) {
            throw new IllegalArgumentException("Plan shape counts cannot be negative");
        }
        if (blockedSteps < 0 || blockedSteps > totalSteps) {
            throw new IllegalArgumentException("Blocked steps must be between 0 and " + totalSteps);
        }
        if (criticalPathSeconds < 0) {
            throw new IllegalArgumentException("Critical path cannot be negative");
        }
    }

    public static PlanStatistics empty() {
        return new PlanStatistics(0, 0, 0, 0, 0, 0, 0);
    }

    /**
     * True when every step waits on the one before it.
     */
    public boolean isSequential() {
        return widestLevel <= 1;
    }

    public Duration criticalPath() {
        return Duration.ofSeconds(criticalPathSeconds);
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format(
                "PlanStatistics[steps=%d, levels=%d, widest=%d, blocked=%d, critical_path=%ds]",
                totalSteps, executionLevels, widestLevel, blockedSteps, criticalPathSeconds
        );
    }
}
