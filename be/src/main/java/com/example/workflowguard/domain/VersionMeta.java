package com.example.workflowguard.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Metadata of a stored workflow snapshot.
 */
public record VersionMeta(
        String id,
        String workflowId,
        String workflowName,
        Instant timestamp,
        String reason,
        int nodeCount,
        String hash
) {
    public VersionMeta {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(hash, "hash");
    }
}
