package org.neuralchilli.actionflow.planner;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.neuralchilli.actionflow.action.ActionRegistry;
import org.neuralchilli.actionflow.config.OrchestratorConfig;
import org.neuralchilli.actionflow.core.DagAnalyzer;
import org.neuralchilli.actionflow.domain.DAGNode;
import org.neuralchilli.actionflow.domain.PlanProposal;
import org.neuralchilli.actionflow.domain.ProposedStep;
import org.neuralchilli.actionflow.domain.WorkflowDAG;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates and repairs an externally proposed plan into an immutable {@link WorkflowDAG}.
 *
 * Steps naming unknown actions are dropped. Dependencies that no longer resolve are pruned,
 * and a step that depended on a dropped step is marked blocked so it ends up skipped.
 * Any dependency cycle turns the whole plan into one sequential chain.
 */
@ApplicationScoped
public class PlanBuilder {

    private static final Logger log = LoggerFactory.getLogger(PlanBuilder.class);

    private final ActionRegistry registry;
    private final DagAnalyzer analyzer;
    private final int timeoutBufferSeconds;
    private final int defaultTimeoutSeconds;
    private final int defaultMaxRetries;
    private final String fallbackAction;

    @Inject
    public PlanBuilder(ActionRegistry registry, DagAnalyzer analyzer, OrchestratorConfig config) {
        this.registry = registry;
        this.analyzer = analyzer;
        this.timeoutBufferSeconds = (int) config.execution().timeoutBuffer().toSeconds();
        this.defaultTimeoutSeconds = (int) config.execution().defaultTimeout().toSeconds();
        this.defaultMaxRetries = config.execution().defaultMaxRetries();
        this.fallbackAction = config.planner().fallbackAction();
    }

    /**
     * Build a validated plan from a proposal. Never fails for plan-shape problems.
     */
    public WorkflowDAG build(PlanProposal proposal) {
        log.debug("Building plan '{}' from {} proposed steps", proposal.name(), proposal.steps().size());

        // Drop unknown actions
        List<ProposedStep> kept = new ArrayList<>();
        Set<String> keptIds = new LinkedHashSet<>();
        Set<String> dropped = new LinkedHashSet<>();
        for (ProposedStep step : proposal.steps()) {
            if (!registry.contains(step.action())) {
                log.warn("Dropping step '{}': unknown action '{}'", step.id(), step.action());
                dropped.add(step.id());
            } else if (!keptIds.add(step.id())) {
                log.warn("Dropping duplicate step id '{}'", step.id());
            } else {
                kept.add(step);
            }
        }

        // Prune dangling dependencies
        List<DAGNode> nodes = new ArrayList<>();
        for (ProposedStep step : kept) {
            Set<String> dependencies = new LinkedHashSet<>();
            Set<String> blockedBy = new LinkedHashSet<>();
            for (String dependency : step.dependencies()) {
                if (keptIds.contains(dependency)) {
                    dependencies.add(dependency);
                } else if (dropped.contains(dependency)) {
                    blockedBy.add(dependency);
                } else {
                    log.warn("Pruning dependency '{}' of step '{}': no such step", dependency, step.id());
                }
            }
            nodes.add(toNode(step, dependencies, blockedBy));
        }

        // Cycles
        boolean linearized = false;
        if (hasSelfDependency(nodes) || analyzer.hasCycle(nodes)) {
            log.warn("Plan '{}' has circular dependencies, linearizing {} steps", proposal.name(), nodes.size());
            nodes = linearize(nodes);
            linearized = true;
        }

        List<DAGNode> ordered = linearized ? nodes : topologicalOrder(nodes);
        Map<String, List<String>> groups = parallelGroups(ordered);

        WorkflowDAG dag = WorkflowDAG.create(
                proposal.name(),
                proposal.description(),
                ordered,
                groups,
                estimateDurationSeconds(ordered),
                List.copyOf(dropped),
                linearized
        );

        log.info("Built plan {} '{}': {} steps, {} dropped, {} parallel groups, ~{}s",
                dag.id(), dag.name(), dag.size(), dropped.size(), groups.size(), dag.estimatedDurationSeconds());
        return dag;
    }

    /**
     * Build a linear workflow {@code step_1..N} from action/params specs.
     * Each spec holds an {@code action} name and optional {@code params}.
     */
    @SuppressWarnings("unchecked")
    public WorkflowDAG sequential(String name, List<Map<String, Object>> specs) {
        List<ProposedStep> steps = new ArrayList<>();
        String previous = null;
        for (int i = 0; i < specs.size(); i++) {
            Map<String, Object> spec = specs.get(i);
            String id = "step_" + (i + 1);
            Object params = spec.getOrDefault("params", Map.of());
            steps.add(new ProposedStep(
                    id,
                    String.valueOf(spec.get("action")),
                    params instanceof Map<?, ?> ? (Map<String, Object>) params : Map.of(),
                    previous == null ? List.of() : List.of(previous),
                    null, 0, 0, 0, null
            ));
            previous = id;
        }
        return build(new PlanProposal(name, "Sequential workflow", steps));
    }

    /**
     * One-step plan for a direct action call
     */
    public WorkflowDAG singleAction(String action, Map<String, Object> params) {
        return build(new PlanProposal(action, "Direct action call",
                List.of(ProposedStep.of("step_1", action, params))));
    }

    /**
     * Plan used when the planning collaborator fails or proposes nothing usable
     */
    public WorkflowDAG fallback(String request) {
        return build(new PlanProposal("Fallback workflow", "Fallback for: " + request,
                List.of(ProposedStep.of("step_1", fallbackAction, Map.of("prompt", request)))));
    }

    /**
     * Sum of durations outside any parallel group plus the longest duration within each group.
     */
    public static int estimateDurationSeconds(List<DAGNode> nodes) {
        int sequential = 0;
        Map<String, Integer> groupMax = new HashMap<>();
        for (DAGNode node : nodes) {
            if (node.isParallel()) {
                groupMax.merge(node.parallelGroup(), node.estimatedDurationSeconds(), Math::max);
            } else {
                sequential += node.estimatedDurationSeconds();
            }
        }
        return sequential + groupMax.values().stream().mapToInt(Integer::intValue).sum();
    }

    private DAGNode toNode(ProposedStep step, Set<String> dependencies, Set<String> blockedBy) {
        int duration = step.estimatedDurationSeconds() > 0
                ? step.estimatedDurationSeconds()
                : DAGNode.DEFAULT_DURATION_SECONDS;

        int timeout;
        if (step.timeoutSeconds() > 0) {
            timeout = step.timeoutSeconds();
        } else if (step.estimatedDurationSeconds() > 0) {
            timeout = step.estimatedDurationSeconds() + timeoutBufferSeconds;
        } else {
            timeout = defaultTimeoutSeconds;
        }

        int priority = step.priority() >= 1 && step.priority() <= 5 ? step.priority() : DAGNode.DEFAULT_PRIORITY;
        int retries = step.maxRetries() != null && step.maxRetries() >= 0 ? step.maxRetries() : defaultMaxRetries;

        return new DAGNode(step.id(), step.action(), step.params(), dependencies, step.parallelGroup(),
                timeout, retries, priority, duration, blockedBy);
    }

    private boolean hasSelfDependency(List<DAGNode> nodes) {
        return nodes.stream().anyMatch(node -> node.dependencies().contains(node.id()));
    }

    /**
     * Chain every step to its predecessor in proposal order and clear parallel groups
     */
    private List<DAGNode> linearize(List<DAGNode> nodes) {
        List<DAGNode> chain = new ArrayList<>(nodes.size());
        String previous = null;
        for (DAGNode node : nodes) {
            Set<String> dependencies = previous == null ? Set.of() : Set.of(previous);
            chain.add(node.withDependencies(dependencies, node.blockedBy()).withParallelGroup(null));
            previous = node.id();
        }
        return chain;
    }

    private List<DAGNode> topologicalOrder(List<DAGNode> nodes) {
        Map<String, Integer> proposalIndex = new HashMap<>();
        Map<String, DAGNode> byId = new LinkedHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            proposalIndex.put(nodes.get(i).id(), i);
            byId.put(nodes.get(i).id(), nodes.get(i));
        }

        DirectedAcyclicGraph<String, DefaultEdge> graph = analyzer.buildDAG(nodes);
        List<DAGNode> ordered = new ArrayList<>(nodes.size());
        for (String id : analyzer.getTopologicalOrder(graph, Comparator.comparing(proposalIndex::get))) {
            ordered.add(byId.get(id));
        }
        return ordered;
    }

    private Map<String, List<String>> parallelGroups(List<DAGNode> nodes) {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (DAGNode node : nodes) {
            if (node.isParallel()) {
                groups.computeIfAbsent(node.parallelGroup(), g -> new ArrayList<>()).add(node.id());
            }
        }
        return groups;
    }
}
