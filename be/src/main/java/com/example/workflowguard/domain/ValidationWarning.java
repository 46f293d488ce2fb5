package com.example.workflowguard.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Advisory finding produced by a validation rule. {@code node} is null for workflow-level findings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationWarning(String rule, Severity severity, String node, String message, String suggestion) {
    public ValidationWarning {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
    }

    @JsonIgnore
    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
