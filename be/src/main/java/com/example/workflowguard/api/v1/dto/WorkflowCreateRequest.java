package com.example.workflowguard.api.v1.dto;

import com.example.workflowguard.domain.Connections;
import com.example.workflowguard.domain.Node;
import com.example.workflowguard.domain.Workflow;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Request body for creating a workflow. Connections and settings are optional.
 */
public record WorkflowCreateRequest(
        @NotBlank String name,
        @NotNull List<Node> nodes,
        Connections connections,
        Map<String, Object> settings
) {

    public Workflow toWorkflow() {
        Workflow workflow = new Workflow(null, name, new ArrayList<>(nodes), connections);
        workflow.setSettings(settings);
        return workflow;
    }
}
