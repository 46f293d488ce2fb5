package com.example.workflowguard.registry;

import java.util.List;

/**
 * Static catalogue of node types. Used for type checks on new nodes and for search.
 */
public interface NodeTypeRegistry {

    int DEFAULT_LIMIT = 100;

    /**
     * Entries whose name or type contains {@code search} and whose category equals {@code category},
     * both case-insensitive and ignored when blank, at most {@code limit} of them.
     */
    List<NodeTypeEntry> search(String search, String category, Integer limit);

    /**
     * Distinct categories, sorted.
     */
    List<String> categories();

    int count();

    boolean exists(String type);

    /**
     * All type identifiers in catalogue order.
     */
    List<String> knownTypes();
}
