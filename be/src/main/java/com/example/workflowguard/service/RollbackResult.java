package com.example.workflowguard.service;

import com.example.workflowguard.domain.VersionMeta;
import com.example.workflowguard.domain.Workflow;

/**
 * The snapshot that was restored and the workflow as the store returned it.
 */
public record RollbackResult(VersionMeta restoredVersion, Workflow workflow) {
}
