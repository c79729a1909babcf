package com.z254.loom.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Structural checks run before a graph is compiled.
 */
final class GraphValidator {

    private GraphValidator() {
    }

    static List<ValidationError> validate(GraphDefinition definition) {
        List<ValidationError> errors = new ArrayList<>();
        String entryPoint = definition.getEntryPoint();

        if (entryPoint == null) {
            errors.add(new ValidationError("entryPoint", "entry point is not set"));
        } else if (!definition.hasNode(entryPoint)) {
            errors.add(new ValidationError("entryPoint", "entry point references unknown node " + entryPoint));
        }

        for (Map.Entry<String, List<String>> entry : definition.getEdges().entrySet()) {
            if (entry.getValue().size() > 1) {
                errors.add(new ValidationError("edge:" + entry.getKey(),
                        "node has " + entry.getValue().size() + " static edges, at most one is allowed"));
            }
        }

        for (Map.Entry<String, List<ConditionalEdge>> entry : definition.getConditionalEdges().entrySet()) {
            String source = entry.getKey();
            if (!definition.hasNode(source)) {
                errors.add(new ValidationError("conditionalEdge:" + source,
                        "conditional edge source references unknown node " + source));
            }
            for (ConditionalEdge edge : entry.getValue()) {
                for (String target : edge.getPossibleTargets()) {
                    if (!EdgeDecision.END.equals(target) && !definition.hasNode(target)) {
                        errors.add(new ValidationError("conditionalEdge:" + source,
                                "conditional edge target references unknown node " + target));
                    }
                }
            }
        }

        if (entryPoint != null && definition.hasNode(entryPoint) && !canReachTermination(definition)) {
            errors.add(new ValidationError("graph",
                    "no path from entry point " + entryPoint + " reaches an exit point or the end"));
        }
        return errors;
    }

    private static boolean canReachTermination(GraphDefinition definition) {
        Deque<String> pending = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        pending.add(definition.getEntryPoint());

        while (!pending.isEmpty()) {
            String node = pending.poll();
            if (!visited.add(node) || !definition.hasNode(node)) {
                continue;
            }
            if (canTerminate(definition, node)) {
                return true;
            }
            definition.getStaticEdge(node).ifPresent(pending::add);
            for (ConditionalEdge edge : definition.getConditionalEdges(node)) {
                pending.addAll(edge.getPossibleTargets());
            }
        }
        return false;
    }

    private static boolean canTerminate(GraphDefinition definition, String node) {
        if (definition.isExitPoint(node)) {
            return true;
        }
        Optional<String> staticEdge = definition.getStaticEdge(node);
        // No static edge: the run ends once no conditional edge decides
        if (staticEdge.isEmpty() || EdgeDecision.END.equals(staticEdge.get())) {
            return true;
        }
        return definition.getConditionalEdges(node).stream().anyMatch(ConditionalEdge::mayEnd);
    }
}
