package com.example.workflowguard.validation;

import com.example.workflowguard.domain.NodeTypeError;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when new nodes use types missing from the node type catalogue.
 * <p>
 * Mapped to HTTP 400 with one entry per unknown node by {@link com.example.workflowguard.api.GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class UnknownNodeTypeException extends RuntimeException {

    private final List<NodeTypeError> errors;

    public UnknownNodeTypeException(List<NodeTypeError> errors) {
        super("Unknown node types: " + (errors != null ? errors.size() + " node(s)" : ""));
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
