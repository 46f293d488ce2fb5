package com.example.workflowguard.api.v1.dto;

import com.example.workflowguard.domain.Workflow;

/**
 * Workflow id, name and active flag after activate/deactivate.
 */
public record ActivationResponse(String id, String name, boolean active) {

    public static ActivationResponse of(Workflow workflow) {
        return new ActivationResponse(workflow.getId(), workflow.getName(), workflow.isActive());
    }
}
