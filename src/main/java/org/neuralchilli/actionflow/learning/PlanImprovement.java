package org.neuralchilli.actionflow.learning;

import org.neuralchilli.actionflow.domain.PlanProposal;

import java.util.List;

/**
 * Result of running a proposal past the learned patterns.
 * When nothing applied, {@code proposal} is the input unchanged.
 */
public record PlanImprovement(PlanProposal proposal, List<String> appliedPatterns, List<String> notes) {

    public PlanImprovement {
        appliedPatterns = appliedPatterns == null ? List.of() : List.copyOf(appliedPatterns);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public static PlanImprovement unchanged(PlanProposal proposal) {
        return new PlanImprovement(proposal, List.of(), List.of());
    }

    public boolean isImproved() {
        return !appliedPatterns.isEmpty();
    }
}
