package com.example.workflowguard.version;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;

/**
 * Snapshot store settings, bound from {@code workflow-guard.versions.*}.
 *
 * @param enabled     when false, {@link VersionStore#save} writes nothing
 * @param maxVersions snapshots kept per workflow; older ones are pruned after each save
 * @param storageDir  root directory; a leading {@code ~} is the user's home
 */
@ConfigurationProperties("workflow-guard.versions")
public record VersionStoreProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("20") int maxVersions,
        @DefaultValue("~/.workflow-guard/versions") String storageDir
) {

    public VersionStoreProperties {
        if (maxVersions < 1) {
            throw new IllegalArgumentException("workflow-guard.versions.max-versions must be at least 1: " + maxVersions);
        }
        if (storageDir == null || storageDir.isBlank()) {
            throw new IllegalArgumentException("workflow-guard.versions.storage-dir is required");
        }
    }

    public Path storagePath() {
        String dir = storageDir.trim();
        if (dir.equals("~") || dir.startsWith("~/")) {
            return Path.of(System.getProperty("user.home"), dir.substring(1).replaceFirst("^/", ""));
        }
        return Path.of(dir);
    }
}
