package com.example.workflowguard.service;

import com.example.workflowguard.domain.ValidationWarning;
import com.example.workflowguard.domain.Workflow;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of the validate, auto-fix and format pass that follows every write.
 *
 * @param warnings  warnings auto-fix could not repair
 * @param autoFixed descriptions of the fixes that were applied
 * @param persisted whether the cleaned workflow was written back to the store
 */
public record CleanupResult(
        Workflow workflow,
        boolean valid,
        List<ValidationWarning> warnings,
        List<String> autoFixed,
        boolean persisted
) {
    public CleanupResult {
        Objects.requireNonNull(workflow, "workflow");
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        autoFixed = autoFixed != null ? List.copyOf(autoFixed) : List.of();
    }
}
