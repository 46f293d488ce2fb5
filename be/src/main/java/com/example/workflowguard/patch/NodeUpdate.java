package com.example.workflowguard.patch;

import com.example.workflowguard.domain.JsonValues;
import com.example.workflowguard.domain.Node;
import com.example.workflowguard.domain.Position;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Partial node properties for an {@code updateNode} operation. Non-null fields replace the node's
 * current values; {@code parameters} replaces the whole parameter bag.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record NodeUpdate(
        String name,
        String type,
        Number typeVersion,
        Position position,
        Map<String, Object> parameters,
        Map<String, Object> credentials,
        Boolean disabled,
        String notes
) {

    public static NodeUpdate parameters(Map<String, Object> parameters) {
        return new NodeUpdate(null, null, null, null, parameters, null, null, null);
    }

    void mergeInto(Node node) {
        if (name != null) {
            node.setName(name);
        }
        if (type != null) {
            node.setType(type);
        }
        if (typeVersion != null) {
            node.setTypeVersion(typeVersion);
        }
        if (position != null) {
            node.setPosition(position);
        }
        if (parameters != null) {
            node.setParameters(JsonValues.deepCopyMap(parameters));
        }
        if (credentials != null) {
            node.setCredentials(JsonValues.deepCopyMap(credentials));
        }
        if (disabled != null) {
            node.setDisabled(disabled);
        }
        if (notes != null) {
            node.setNotes(notes);
        }
    }
}
