package com.example.workflowguard.patch;

import java.util.UUID;

/**
 * Supplies ids for nodes added without one.
 */
@FunctionalInterface
public interface NodeIdGenerator {

    String nextId();

    static NodeIdGenerator random() {
        return () -> UUID.randomUUID().toString();
    }
}
