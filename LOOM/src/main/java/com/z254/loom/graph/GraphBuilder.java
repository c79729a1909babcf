package com.z254.loom.graph;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable assembler for graph definitions.
 * <p>
 * Usage:
 * <pre>
 * CompiledGraph graph = GraphBuilder.create("triage")
 *         .addNode("start", NodeHandler.of(state -&gt; state.withValue("greeted", true)))
 *         .addNode("classify", classifier)
 *         .addNode("respond", responder)
 *         .addEdge("start", "classify")
 *         .addConditionalEdge("classify",
 *                 EdgeCondition.of(state -&gt; state.hasValue("intent") ? EdgeDecision.to("respond") : EdgeDecision.end()),
 *                 "respond", EdgeDecision.END)
 *         .setEntryPoint("start")
 *         .addExitPoint("respond")
 *         .compile();
 * </pre>
 * A builder may keep being mutated after {@link #compile()}; graphs already compiled are not
 * affected.
 */
@Slf4j
public class GraphBuilder {

    private final String name;
    private final Map<String, NodeHandler> nodes = new LinkedHashMap<>();
    private final Map<String, List<String>> edges = new LinkedHashMap<>();
    private final Map<String, List<ConditionalEdge>> conditionalEdges = new LinkedHashMap<>();
    private final Set<String> exitPoints = new LinkedHashSet<>();
    private String entryPoint;

    public GraphBuilder(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Graph name must not be blank");
        }
        this.name = name;
    }

    public static GraphBuilder create(String name) {
        return new GraphBuilder(name);
    }

    public GraphBuilder addNode(String nodeName, NodeHandler handler) {
        if (nodeName == null || nodeName.isBlank()) {
            throw new IllegalArgumentException("Node name must not be blank");
        }
        if (EdgeDecision.END.equals(nodeName)) {
            throw new IllegalArgumentException("Node name " + EdgeDecision.END + " is reserved");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler for node " + nodeName + " must not be null");
        }
        if (nodes.containsKey(nodeName)) {
            throw GraphException.duplicateNode(nodeName);
        }
        nodes.put(nodeName, handler);
        return this;
    }

    public GraphBuilder addNode(GraphNode node) {
        return addNode(node.getName(), node);
    }

    /**
     * Add a static edge. The target may be {@link EdgeDecision#END}.
     */
    public GraphBuilder addEdge(String from, String to) {
        requireNode(from);
        if (!EdgeDecision.END.equals(to)) {
            requireNode(to);
        }
        edges.computeIfAbsent(from, key -> new ArrayList<>()).add(to);
        return this;
    }

    /**
     * Add a conditional edge. Conditional edges of one node are evaluated in the order they were
     * added and the first decision wins.
     *
     * @param possibleTargets where the condition may route; only used by compile-time validation
     */
    public GraphBuilder addConditionalEdge(String from, EdgeCondition condition, String... possibleTargets) {
        if (condition == null) {
            throw new IllegalArgumentException("Condition for edge from " + from + " must not be null");
        }
        conditionalEdges.computeIfAbsent(from, key -> new ArrayList<>())
                .add(new ConditionalEdge(from, condition, Set.copyOf(Arrays.asList(possibleTargets))));
        return this;
    }

    public GraphBuilder setEntryPoint(String nodeName) {
        requireNode(nodeName);
        this.entryPoint = nodeName;
        return this;
    }

    public GraphBuilder addExitPoint(String nodeName) {
        requireNode(nodeName);
        exitPoints.add(nodeName);
        return this;
    }

    /**
     * Validate the current structure and freeze it.
     *
     * @throws GraphValidationException listing every defect found
     */
    public CompiledGraph compile() {
        GraphDefinition definition = new GraphDefinition(
                name, nodes, edges, conditionalEdges, entryPoint, exitPoints);

        List<ValidationError> errors = GraphValidator.validate(definition);
        if (!errors.isEmpty()) {
            log.warn("Graph {} failed validation with {} error(s)", name, errors.size());
            throw new GraphValidationException(name, errors);
        }

        log.debug("Compiled graph {} with {} nodes", name, nodes.size());
        return new CompiledGraph(definition);
    }

    private void requireNode(String nodeName) {
        if (nodeName == null || !nodes.containsKey(nodeName)) {
            throw GraphException.nodeNotFound(nodeName);
        }
    }
}
