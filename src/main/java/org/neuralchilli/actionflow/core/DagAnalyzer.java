package org.neuralchilli.actionflow.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.neuralchilli.actionflow.domain.DAGNode;
import org.neuralchilli.actionflow.domain.PlanStatistics;
import org.neuralchilli.actionflow.planner.PlanValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds and analyzes step dependency graphs using JGraphT.
 * Vertices are node ids; an edge runs from a dependency to its dependent.
 */
@ApplicationScoped
public class DagAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DagAnalyzer.class);

    /**
     * Build a DAG from plan nodes.
     *
     * @throws PlanValidationException if a dependency is unknown or the dependencies form a cycle
     */
    public DirectedAcyclicGraph<String, DefaultEdge> buildDAG(List<DAGNode> nodes) {
        DirectedAcyclicGraph<String, DefaultEdge> dag = new DirectedAcyclicGraph<>(DefaultEdge.class);

        // First pass: vertices
        for (DAGNode node : nodes) {
            if (!dag.addVertex(node.id())) {
                throw new PlanValidationException("Duplicate step id: " + node.id());
            }
        }

        // Second pass: edges
        for (DAGNode node : nodes) {
            for (String dependency : node.dependencies()) {
                if (!dag.containsVertex(dependency)) {
                    throw new PlanValidationException(
                            "Step '" + node.id() + "' depends on '" + dependency + "' which does not exist in the plan");
                }
                try {
                    dag.addEdge(dependency, node.id());
                    log.trace("Added edge: {} -> {}", dependency, node.id());
                } catch (IllegalArgumentException e) {
                    // Raised for self-loops and for edges that would close a cycle
                    throw new PlanValidationException(
                            "Dependency '" + dependency + "' -> '" + node.id() + "' would create a cycle", e);
                }
            }
        }

        log.debug("DAG built: {} vertices, {} edges", dag.vertexSet().size(), dag.edgeSet().size());
        return dag;
    }

    /**
     * Check whether the dependencies contain a cycle of any length.
     * Dependencies on unknown ids are ignored.
     */
    public boolean hasCycle(List<DAGNode> nodes) {
        DirectedAcyclicGraph<String, DefaultEdge> dag = new DirectedAcyclicGraph<>(DefaultEdge.class);
        nodes.forEach(node -> dag.addVertex(node.id()));

        for (DAGNode node : nodes) {
            for (String dependency : node.dependencies()) {
                if (!dag.containsVertex(dependency)) {
                    continue;
                }
                try {
                    dag.addEdge(dependency, node.id());
                } catch (IllegalArgumentException e) {
                    log.debug("Cycle through '{}' -> '{}'", dependency, node.id());
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Topological order, breaking ties by the given comparator.
     */
    public List<String> getTopologicalOrder(
            DirectedAcyclicGraph<String, DefaultEdge> dag,
            Comparator<String> tieBreaker
    ) {
        List<String> order = new ArrayList<>();
        TopologicalOrderIterator<String, DefaultEdge> iterator = new TopologicalOrderIterator<>(dag, tieBreaker);
        while (iterator.hasNext()) {
            order.add(iterator.next());
        }
        return order;
    }

    public Set<String> getRootSteps(DirectedAcyclicGraph<String, DefaultEdge> dag) {
        return dag.vertexSet().stream()
                .filter(node -> dag.incomingEdgesOf(node).isEmpty())
                .collect(Collectors.toSet());
    }

    public Set<String> getLeafSteps(DirectedAcyclicGraph<String, DefaultEdge> dag) {
        return dag.vertexSet().stream()
                .filter(node -> dag.outgoingEdgesOf(node).isEmpty())
                .collect(Collectors.toSet());
    }

    public Set<String> getDependencies(DirectedAcyclicGraph<String, DefaultEdge> dag, String node) {
        return dag.incomingEdgesOf(node).stream()
                .map(dag::getEdgeSource)
                .collect(Collectors.toSet());
    }

    /**
     * Group steps into levels whose members do not depend on each other.
     */
    public List<Set<String>> getExecutionLevels(DirectedAcyclicGraph<String, DefaultEdge> dag) {
        List<Set<String>> levels = new ArrayList<>();
        Map<String, Integer> depth = new HashMap<>();

        for (String node : getTopologicalOrder(dag, Comparator.naturalOrder())) {
            int level = getDependencies(dag, node).stream()
                    .mapToInt(depth::get)
                    .max()
                    .orElse(-1) + 1;
            depth.put(node, level);
            while (levels.size() <= level) {
                levels.add(new HashSet<>());
            }
            levels.get(level).add(node);
        }

        return levels;
    }

    /**
     * Plan shape plus the longest chain of estimated durations. Blocked steps still count
     * towards the shape since they stay in the plan.
     */
    public PlanStatistics getStatistics(List<DAGNode> nodes) {
        if (nodes.isEmpty()) {
            return PlanStatistics.empty();
        }
        DirectedAcyclicGraph<String, DefaultEdge> dag = buildDAG(nodes);
        Map<String, DAGNode> byId = nodes.stream().collect(Collectors.toMap(DAGNode::id, n -> n));

        Map<String, Integer> finishAt = new HashMap<>();
        for (String id : getTopologicalOrder(dag, Comparator.naturalOrder())) {
            int start = getDependencies(dag, id).stream().mapToInt(finishAt::get).max().orElse(0);
            finishAt.put(id, start + byId.get(id).estimatedDurationSeconds());
        }

        List<Set<String>> levels = getExecutionLevels(dag);
        return new PlanStatistics(
                dag.vertexSet().size(),
                getRootSteps(dag).size(),
                getLeafSteps(dag).size(),
                levels.size(),
                levels.stream().mapToInt(Set::size).max().orElse(0),
                (int) nodes.stream().filter(DAGNode::isBlocked).count(),
                finishAt.values().stream().mapToInt(Integer::intValue).max().orElse(0)
        );
    }
}
