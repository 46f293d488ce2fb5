package com.example.workflowguard.domain;

import java.util.Objects;

/**
 * A stored snapshot: metadata plus the full workflow as it was at save time.
 */
public record VersionSnapshot(VersionMeta meta, Workflow workflow) {
    public VersionSnapshot {
        Objects.requireNonNull(meta, "meta");
        Objects.requireNonNull(workflow, "workflow");
    }
}
