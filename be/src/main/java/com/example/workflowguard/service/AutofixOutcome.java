package com.example.workflowguard.service;

import com.example.workflowguard.domain.AutofixAction;
import com.example.workflowguard.domain.ValidationWarning;
import com.example.workflowguard.domain.Workflow;

import java.util.List;

/**
 * Auto-fix preview or applied result. {@code applied} is false for a preview and when there was nothing to fix.
 */
public record AutofixOutcome(boolean applied, List<AutofixAction> fixes, List<ValidationWarning> unfixable, Workflow workflow) {
    public AutofixOutcome {
        fixes = fixes != null ? List.copyOf(fixes) : List.of();
        unfixable = unfixable != null ? List.copyOf(unfixable) : List.of();
    }
}
