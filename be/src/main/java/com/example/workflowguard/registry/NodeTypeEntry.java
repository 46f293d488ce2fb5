package com.example.workflowguard.registry;

import java.util.Objects;

/**
 * A known node type with its display name and category.
 */
public record NodeTypeEntry(String type, String name, String category) {
    public NodeTypeEntry {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
    }
}
