package com.example.workflowguard.validation;

import com.example.workflowguard.domain.ValidationWarning;

import java.util.List;

/**
 * Outcome of {@link WorkflowValidator#validate}: valid when no warning has error severity.
 */
public record ValidationResult(boolean valid, List<ValidationWarning> warnings) {

    public ValidationResult {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static ValidationResult of(List<ValidationWarning> warnings) {
        boolean valid = warnings.stream().noneMatch(ValidationWarning::isError);
        return new ValidationResult(valid, warnings);
    }
}
