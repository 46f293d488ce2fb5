package com.example.workflowguard.service;

import com.example.workflowguard.domain.Workflow;

/**
 * Layout preview or applied result.
 */
public record FormatOutcome(boolean applied, Workflow workflow) {
}
