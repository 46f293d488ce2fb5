package com.example.workflowguard.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * List entry as returned by the remote store's workflow listing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowSummary(String id, String name, boolean active, String updatedAt) {
}
