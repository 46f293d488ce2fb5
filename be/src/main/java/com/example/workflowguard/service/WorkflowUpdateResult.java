package com.example.workflowguard.service;

import java.util.List;
import java.util.Objects;

/**
 * Result of applying patch operations to a stored workflow.
 *
 * @param versionSaved id of the snapshot taken before the update, or null when none was written
 */
public record WorkflowUpdateResult(CleanupResult cleanup, List<String> patchWarnings, String versionSaved) {
    public WorkflowUpdateResult {
        Objects.requireNonNull(cleanup, "cleanup");
        patchWarnings = patchWarnings != null ? List.copyOf(patchWarnings) : List.of();
    }
}
