package org.neuralchilli.actionflow.domain;

import java.util.List;

/**
 * Unvalidated plan as returned by the planning collaborator.
 */
public record PlanProposal(String name, String description, List<ProposedStep> steps) {

    public PlanProposal {
        if (name == null || name.isBlank()) {
            name = "workflow";
        }
        if (description == null) {
            description = "";
        }
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static PlanProposal of(String name, ProposedStep... steps) {
        return new PlanProposal(name, "", List.of(steps));
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }
}
