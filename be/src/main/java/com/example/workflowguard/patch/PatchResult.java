package com.example.workflowguard.patch;

import com.example.workflowguard.domain.Workflow;

import java.util.List;
import java.util.Objects;

/**
 * Patched copy of the workflow plus the warnings collected while applying the operations.
 */
public record PatchResult(Workflow workflow, List<String> warnings) {
    public PatchResult {
        Objects.requireNonNull(workflow, "workflow");
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
