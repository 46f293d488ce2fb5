package com.example.workflowguard.autofix;

import com.example.workflowguard.domain.AutofixAction;
import com.example.workflowguard.domain.ValidationWarning;
import com.example.workflowguard.domain.Workflow;

import java.util.List;
import java.util.Objects;

/**
 * Repaired copy of the workflow, the fixes applied to it, and the warnings left as they were.
 */
public record AutofixResult(Workflow workflow, List<AutofixAction> fixes, List<ValidationWarning> unfixable) {
    public AutofixResult {
        Objects.requireNonNull(workflow, "workflow");
        fixes = List.copyOf(fixes);
        unfixable = List.copyOf(unfixable);
    }
}
