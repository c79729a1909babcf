package com.z254.loom.graph;

/**
 * A node handler that carries its own name.
 */
public interface GraphNode extends NodeHandler {

    String getName();
}
