package com.example.workflowguard.service;

import com.example.workflowguard.domain.VersionDiff;

/**
 * @param from snapshot id of the older side, or {@value WorkflowVersionService#CURRENT} for the live workflow
 */
public record VersionDiffResult(String from, String to, VersionDiff diff) {
}
