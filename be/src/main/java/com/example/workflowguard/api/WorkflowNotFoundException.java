package com.example.workflowguard.api;

import lombok.Getter;

/**
 * Thrown when the remote store has no workflow with the given id.
 * <p>
 * Mapped to HTTP 404 by {@link GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class WorkflowNotFoundException extends RuntimeException {

    private final String workflowId;

    public WorkflowNotFoundException(String workflowId) {
        super("Workflow not found: " + workflowId);
        this.workflowId = workflowId;
    }
}
