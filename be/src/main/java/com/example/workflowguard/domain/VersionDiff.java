package com.example.workflowguard.domain;

import java.util.List;

/**
 * Structural difference between two workflows; nodes are matched by name.
 */
public record VersionDiff(
        List<String> nodesAdded,
        List<String> nodesRemoved,
        List<String> nodesModified,
        boolean connectionsChanged,
        boolean settingsChanged,
        String summary
) {
    public VersionDiff {
        nodesAdded = List.copyOf(nodesAdded);
        nodesRemoved = List.copyOf(nodesRemoved);
        nodesModified = List.copyOf(nodesModified);
    }

    public boolean hasChanges() {
        return !nodesAdded.isEmpty() || !nodesRemoved.isEmpty() || !nodesModified.isEmpty()
                || connectionsChanged || settingsChanged;
    }
}
