package com.example.workflowguard.service;

import com.example.workflowguard.domain.ExpressionIssue;
import com.example.workflowguard.domain.ValidationWarning;

import java.util.List;

/**
 * Rule warnings, expression issues and reference cycles of one workflow.
 */
public record WorkflowValidationReport(
        String workflowId,
        String workflowName,
        boolean valid,
        List<ValidationWarning> warnings,
        List<ExpressionIssue> expressionIssues,
        List<List<String>> circularReferences
) {
    public WorkflowValidationReport {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        expressionIssues = expressionIssues != null ? List.copyOf(expressionIssues) : List.of();
        circularReferences = circularReferences != null ? List.copyOf(circularReferences) : List.of();
    }
}
