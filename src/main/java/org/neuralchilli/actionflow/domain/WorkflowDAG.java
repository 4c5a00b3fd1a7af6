package org.neuralchilli.actionflow.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * A validated, immutable workflow plan.
 * Nodes are held in execution order; every dependency id resolves to a sibling node.
 */
public record WorkflowDAG(
        String id,
        String name,
        String description,
        List<DAGNode> nodes,
        Map<String, List<String>> parallelGroups,
        int estimatedDurationSeconds,
        Instant createdAt,
        List<String> droppedNodes,
        boolean linearized
) {
    public WorkflowDAG {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Workflow id cannot be null or empty");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Workflow name cannot be null or empty");
        }
        if (nodes == null) {
            throw new IllegalArgumentException("Nodes cannot be null");
        }
        if (estimatedDurationSeconds < 0) {
            throw new IllegalArgumentException("Estimated duration cannot be negative");
        }

        nodes = List.copyOf(nodes);
        validateReferences(nodes);

        // Defaults
        if (description == null) {
            description = "";
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        droppedNodes = droppedNodes == null ? List.of() : List.copyOf(droppedNodes);
        parallelGroups = parallelGroups == null ? Map.of() : copyGroups(parallelGroups);
    }

    /**
     * Create a plan with a freshly generated id
     */
    public static WorkflowDAG create(
            String name,
            String description,
            List<DAGNode> nodes,
            Map<String, List<String>> parallelGroups,
            int estimatedDurationSeconds,
            List<String> droppedNodes,
            boolean linearized
    ) {
        return new WorkflowDAG(
                "wf_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12),
                name,
                description,
                nodes,
                parallelGroups,
                estimatedDurationSeconds,
                Instant.now(),
                droppedNodes,
                linearized
        );
    }

    /**
     * Find node by id
     */
    public Optional<DAGNode> node(String nodeId) {
        return nodes.stream().filter(n -> n.id().equals(nodeId)).findFirst();
    }

    /**
     * Get all node ids in execution order
     */
    public List<String> nodeIds() {
        List<String> ids = new ArrayList<>(nodes.size());
        nodes.forEach(n -> ids.add(n.id()));
        return ids;
    }

    public int size() {
        return nodes.size();
    }

    private static void validateReferences(List<DAGNode> nodes) {
        Set<String> ids = new HashSet<>();
        for (DAGNode node : nodes) {
            if (!ids.add(node.id())) {
                throw new IllegalArgumentException("Duplicate node id: " + node.id());
            }
        }
        for (DAGNode node : nodes) {
            for (String dependency : node.dependencies()) {
                if (!ids.contains(dependency)) {
                    throw new IllegalArgumentException(
                            "Node '" + node.id() + "' depends on '" + dependency + "' which is not in this plan");
                }
            }
        }
    }

    private static Map<String, List<String>> copyGroups(Map<String, List<String>> groups) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        groups.forEach((group, members) -> copy.put(group, List.copyOf(members)));
        return Collections.unmodifiableMap(copy);
    }
}
