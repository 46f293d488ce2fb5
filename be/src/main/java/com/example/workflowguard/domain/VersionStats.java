package com.example.workflowguard.domain;

/**
 * Snapshot store status.
 */
public record VersionStats(boolean enabled, String storageDir, int maxVersions, int workflowCount, int totalVersions) {
}
