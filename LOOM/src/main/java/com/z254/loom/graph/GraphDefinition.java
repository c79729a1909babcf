package com.z254.loom.graph;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Frozen structure of a graph: nodes, edges, entry and exit points.
 * <p>
 * Instances are created by {@link GraphBuilder} from copies of its tables, so later builder
 * mutations never reach a definition.
 */
@Getter
public final class GraphDefinition {

    private final String name;
    private final Map<String, NodeHandler> nodes;
    private final Map<String, List<String>> edges;
    private final Map<String, List<ConditionalEdge>> conditionalEdges;
    private final String entryPoint;
    private final Set<String> exitPoints;

    GraphDefinition(String name,
                    Map<String, NodeHandler> nodes,
                    Map<String, List<String>> edges,
                    Map<String, List<ConditionalEdge>> conditionalEdges,
                    String entryPoint,
                    Set<String> exitPoints) {
        this.name = name;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = copyOfLists(edges);
        this.conditionalEdges = copyOfLists(conditionalEdges);
        this.entryPoint = entryPoint;
        this.exitPoints = Collections.unmodifiableSet(new LinkedHashSet<>(exitPoints));
    }

    public boolean hasNode(String nodeName) {
        return nodes.containsKey(nodeName);
    }

    public NodeHandler getNode(String nodeName) {
        return nodes.get(nodeName);
    }

    /**
     * The single static edge leaving a node, if any.
     */
    public Optional<String> getStaticEdge(String nodeName) {
        List<String> targets = edges.get(nodeName);
        return targets == null || targets.isEmpty() ? Optional.empty() : Optional.of(targets.get(0));
    }

    /**
     * Conditional edges leaving a node, in registration order.
     */
    public List<ConditionalEdge> getConditionalEdges(String nodeName) {
        return conditionalEdges.getOrDefault(nodeName, List.of());
    }

    public boolean isExitPoint(String nodeName) {
        return exitPoints.contains(nodeName);
    }

    private static <T> Map<String, List<T>> copyOfLists(Map<String, List<T>> source) {
        Map<String, List<T>> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, List.copyOf(value)));
        return Collections.unmodifiableMap(copy);
    }
}
