package com.example.workflowguard.api.v1.dto;

import com.example.workflowguard.domain.WorkflowSummary;

import java.util.List;

/**
 * Response for GET /api/v1/workflows: one page of workflow summaries.
 */
public record WorkflowListResponse(List<WorkflowSummary> workflows, int total, String nextCursor) {}
