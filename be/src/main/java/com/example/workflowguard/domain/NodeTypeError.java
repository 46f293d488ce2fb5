package com.example.workflowguard.domain;

import java.util.List;

/**
 * Unknown node type, with up to three close known types.
 */
public record NodeTypeError(String nodeType, String nodeName, String message, List<String> suggestions) {
    public NodeTypeError {
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }
}
