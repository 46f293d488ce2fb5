package com.example.workflowguard.domain;

/**
 * One inbound end of a connection: target node name, input-type label and input index.
 */
public record ConnectionTarget(String node, String type, int index) {

    public static final String MAIN = "main";

    public ConnectionTarget {
        type = type != null ? type : MAIN;
    }

    public ConnectionTarget withNode(String newNode) {
        return new ConnectionTarget(newNode, type, index);
    }
}
