package com.example.workflowguard.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Problem found in one embedded expression; {@code parameter} is a path such as {@code options.items[2].value}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExpressionIssue(
        String node,
        String parameter,
        String expression,
        String issue,
        Severity severity,
        String suggestion
) {}
