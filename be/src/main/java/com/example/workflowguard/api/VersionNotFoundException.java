package com.example.workflowguard.api;

import lombok.Getter;

/**
 * Thrown when a snapshot id does not exist for a workflow. Mapped to HTTP 404.
 */
@Getter
public class VersionNotFoundException extends RuntimeException {

    private final String workflowId;
    private final String versionId;

    public VersionNotFoundException(String workflowId, String versionId) {
        super("Version not found: " + versionId + " (workflow " + workflowId + ")");
        this.workflowId = workflowId;
        this.versionId = versionId;
    }
}
