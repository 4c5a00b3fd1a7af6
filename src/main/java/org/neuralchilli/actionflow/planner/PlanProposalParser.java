package org.neuralchilli.actionflow.planner;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.actionflow.domain.PlanProposal;
import org.neuralchilli.actionflow.domain.ProposedStep;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Parses a planner's JSON or YAML response into a {@link PlanProposal}.
 *
 * Accepts either a document with {@code name}, {@code description} and {@code nodes}
 * (or {@code steps}), or a bare list of steps.
 */
@ApplicationScoped
public class PlanProposalParser {

    private final Yaml yaml = new Yaml();

    /**
     * Parse a plan document.
     *
     * @throws PlanValidationException if the document is not a plan
     */
    public PlanProposal parse(String document) {
        if (document == null || document.isBlank()) {
            throw new PlanValidationException("Plan document is empty");
        }

        Object root;
        try {
            root = yaml.load(stripCodeFence(document));
        } catch (YAMLException e) {
            throw new PlanValidationException("Plan document is not valid JSON or YAML: " + e.getMessage(), e);
        }
        return fromObject(root);
    }

    /**
     * Convert an already-loaded plan structure, such as a stored corrected plan.
     *
     * @throws PlanValidationException if the structure is not a plan
     */
    @SuppressWarnings("unchecked")
    public PlanProposal fromObject(Object root) {
        if (root instanceof List<?> list) {
            return new PlanProposal(null, null, parseSteps((List<Object>) list));
        }
        if (!(root instanceof Map<?, ?>)) {
            throw new PlanValidationException("Plan document must be a mapping or a list of steps");
        }

        Map<String, Object> data = (Map<String, Object>) root;
        Object steps = data.containsKey("nodes") ? data.get("nodes") : data.get("steps");
        if (!(steps instanceof List<?>)) {
            throw new PlanValidationException("Plan document must define a 'nodes' list");
        }

        return new PlanProposal(
                getString(data, "name", false),
                getString(data, "description", false),
                parseSteps((List<Object>) steps)
        );
    }

    /**
     * Inverse of {@link #fromObject(Object)}, used when a plan has to be stored
     */
    public Map<String, Object> toObject(PlanProposal proposal) {
        List<Map<String, Object>> nodes = new ArrayList<>();
        for (ProposedStep step : proposal.steps()) {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("id", step.id());
            node.put("action", step.action());
            node.put("params", step.params());
            node.put("dependencies", step.dependencies());
            if (step.parallelGroup() != null) {
                node.put("parallel_group", step.parallelGroup());
            }
            if (step.estimatedDurationSeconds() > 0) {
                node.put("estimated_duration_seconds", step.estimatedDurationSeconds());
            }
            if (step.priority() > 0) {
                node.put("priority", step.priority());
            }
            if (step.timeoutSeconds() > 0) {
                node.put("timeout_seconds", step.timeoutSeconds());
            }
            if (step.maxRetries() != null) {
                node.put("max_retries", step.maxRetries());
            }
            nodes.add(node);
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("name", proposal.name());
        document.put("description", proposal.description());
        document.put("nodes", nodes);
        return document;
    }

    @SuppressWarnings("unchecked")
    private List<ProposedStep> parseSteps(List<Object> stepsList) {
        List<ProposedStep> result = new ArrayList<>();

        for (int i = 0; i < stepsList.size(); i++) {
            Object item = stepsList.get(i);
            if (!(item instanceof Map<?, ?>)) {
                throw new PlanValidationException("Step " + (i + 1) + " is not a mapping");
            }
            Map<String, Object> stepData = (Map<String, Object>) item;

            String id = firstString(stepData, "id", "node_id");
            if (id == null) {
                id = "step_" + (i + 1);
            }
            String action = getString(stepData, "action", true);

            Object rawParams = stepData.getOrDefault("params", Map.of());
            Map<String, Object> params = rawParams instanceof Map<?, ?>
                    ? new HashMap<>((Map<String, Object>) rawParams)
                    : Map.of();

            List<String> dependencies = getStringList(stepData, "dependencies");
            if (dependencies.isEmpty()) {
                dependencies = getStringList(stepData, "depends_on");
            }

            Object retries = stepData.get("max_retries");

            result.add(new ProposedStep(
                    id,
                    action,
                    params,
                    dependencies,
                    getString(stepData, "parallel_group", false),
                    getInt(stepData, "estimated_duration_seconds", 0),
                    getInt(stepData, "priority", 0),
                    getInt(stepData, "timeout_seconds", 0),
                    retries != null ? getInt(stepData, "max_retries", 0) : null
            ));
        }

        return result;
    }

    /**
     * Planners often wrap JSON in a markdown code fence
     */
    private String stripCodeFence(String document) {
        String trimmed = document.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int closing = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && closing > firstNewline) {
                return trimmed.substring(firstNewline + 1, closing);
            }
        }
        return trimmed;
    }

    // Helper methods for type-safe extraction

    private String getString(Map<String, Object> map, String key, boolean required) {
        Object value = map.get(key);
        if (value == null) {
            if (required) {
                throw new PlanValidationException("Missing required field: " + key);
            }
            return null;
        }
        return value.toString();
    }

    private String firstString(Map<String, Object> map, String... keys) {
        for (String key : keys) {
            Object value = map.get(key);
            if (value != null) {
                return value.toString();
            }
        }
        return null;
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new PlanValidationException("Field '" + key + "' must be a number, got: " + value, e);
        }
    }

    private List<String> getStringList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream()
                    .map(Object::toString)
                    .collect(Collectors.toList());
        }
        return List.of();
    }
}
