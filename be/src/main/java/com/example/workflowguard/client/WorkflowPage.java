package com.example.workflowguard.client;

import com.example.workflowguard.domain.WorkflowSummary;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * One page of the remote workflow listing; {@code nextCursor} is null on the last page.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowPage(List<WorkflowSummary> data, String nextCursor) {
    public WorkflowPage {
        data = data != null ? List.copyOf(data) : List.of();
    }
}
