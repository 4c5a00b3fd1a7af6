package org.neuralchilli.actionflow.planner;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.actionflow.config.OrchestratorConfig;
import org.neuralchilli.actionflow.domain.PlanProposal;
import org.neuralchilli.actionflow.domain.ProposedStep;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Planner used when no real planning service is deployed: a single step that hands
 * the request to the configured fallback action.
 */
@DefaultBean
@ApplicationScoped
public class FallbackPlanningClient implements PlanningClient {

    private final String fallbackAction;

    @Inject
    public FallbackPlanningClient(OrchestratorConfig config) {
        this.fallbackAction = config.planner().fallbackAction();
    }

    @Override
    public PlanProposal propose(String request, Map<String, Object> context, Set<String> available) {
        return new PlanProposal(
                "Fallback workflow",
                "Single step fallback for: " + request,
                List.of(ProposedStep.of("step_1", fallbackAction, Map.of("prompt", request)))
        );
    }
}
