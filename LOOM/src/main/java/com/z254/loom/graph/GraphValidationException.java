package com.z254.loom.graph;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised by {@link GraphBuilder#compile()} with every defect found, not just the first.
 */
@Getter
public class GraphValidationException extends RuntimeException {

    private final String graphName;
    private final List<ValidationError> errors;

    public GraphValidationException(String graphName, List<ValidationError> errors) {
        super("Graph '" + graphName + "' validation failed: " + errors.size() + " error(s): "
                + errors.stream().map(ValidationError::toString).collect(Collectors.joining("; ")));
        this.graphName = graphName;
        this.errors = List.copyOf(errors);
    }
}
