package com.z254.loom.graph;

/**
 * One structural defect found while compiling a graph.
 *
 * @param element the node, edge or property at fault
 * @param message what is wrong with it
 */
public record ValidationError(String element, String message) {

    @Override
    public String toString() {
        return element + ": " + message;
    }
}
