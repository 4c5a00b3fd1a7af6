package org.neuralchilli.actionflow.planner;

import org.neuralchilli.actionflow.domain.PlanProposal;

import java.util.Map;
import java.util.Set;

/**
 * External collaborator that turns a natural-language request into a proposed plan.
 * Its output is untrusted and always goes through {@link PlanBuilder}.
 */
public interface PlanningClient {

    /**
     * @param request   the caller's natural-language request
     * @param context   conversation context of the caller, possibly empty
     * @param available names of the registered actions
     */
    PlanProposal propose(String request, Map<String, Object> context, Set<String> available);
}
