package com.example.workflowguard.patch;

import com.example.workflowguard.domain.Node;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Map;

/**
 * Structural edit applied by {@link PatchEngine}. The JSON form carries its kind in {@code type},
 * e.g. {@code {"type": "removeNode", "nodeName": "http_request"}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PatchOperation.AddNode.class, name = "addNode"),
        @JsonSubTypes.Type(value = PatchOperation.RemoveNode.class, name = "removeNode"),
        @JsonSubTypes.Type(value = PatchOperation.UpdateNode.class, name = "updateNode"),
        @JsonSubTypes.Type(value = PatchOperation.AddConnection.class, name = "addConnection"),
        @JsonSubTypes.Type(value = PatchOperation.RemoveConnection.class, name = "removeConnection"),
        @JsonSubTypes.Type(value = PatchOperation.UpdateSettings.class, name = "updateSettings"),
        @JsonSubTypes.Type(value = PatchOperation.UpdateName.class, name = "updateName"),
        @JsonSubTypes.Type(value = PatchOperation.Activate.class, name = "activate"),
        @JsonSubTypes.Type(value = PatchOperation.Deactivate.class, name = "deactivate")
})
public sealed interface PatchOperation {

    @JsonIgnore
    Kind kind();

    /**
     * Throws {@link MalformedPatchOperationException} when a required field is missing.
     */
    default void checkWellFormed() {
    }

    enum Kind {
        ADD_NODE("addNode"),
        REMOVE_NODE("removeNode"),
        UPDATE_NODE("updateNode"),
        ADD_CONNECTION("addConnection"),
        REMOVE_CONNECTION("removeConnection"),
        UPDATE_SETTINGS("updateSettings"),
        UPDATE_NAME("updateName"),
        ACTIVATE("activate"),
        DEACTIVATE("deactivate");

        private final String tag;

        Kind(String tag) {
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }
    }

    /** Appends a node; an id is generated when the node has none. */
    record AddNode(Node node) implements PatchOperation {
        @Override
        public Kind kind() {
            return Kind.ADD_NODE;
        }

        @Override
        public void checkWellFormed() {
            if (node == null) {
                throw new MalformedPatchOperationException(kind().tag(), "node");
            }
            require(kind(), "node.name", node.getName());
            require(kind(), "node.type", node.getType());
        }
    }

    record RemoveNode(String nodeName) implements PatchOperation {
        @Override
        public Kind kind() {
            return Kind.REMOVE_NODE;
        }

        @Override
        public void checkWellFormed() {
            require(kind(), "nodeName", nodeName);
        }
    }

    record UpdateNode(String nodeName, NodeUpdate properties) implements PatchOperation {
        @Override
        public Kind kind() {
            return Kind.UPDATE_NODE;
        }

        @Override
        public void checkWellFormed() {
            require(kind(), "nodeName", nodeName);
            if (properties == null) {
                throw new MalformedPatchOperationException(kind().tag(), "properties");
            }
        }
    }

    /** Wires {@code from} to {@code to}. Omitted labels default to {@code main}, omitted indexes to 0. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record AddConnection(
            String from,
            String to,
            Integer fromOutput,
            Integer toInput,
            String outputType,
            String inputType
    ) implements PatchOperation {

        public AddConnection(String from, String to) {
            this(from, to, null, null, null, null);
        }

        @Override
        public Kind kind() {
            return Kind.ADD_CONNECTION;
        }

        @Override
        public void checkWellFormed() {
            require(kind(), "from", from);
            require(kind(), "to", to);
            nonNegative(kind(), "fromOutput", fromOutput);
            nonNegative(kind(), "toInput", toInput);
        }
    }

    /** Removes the first matching target from one output slot; {@code toInput} narrows the match when given. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record RemoveConnection(
            String from,
            String to,
            Integer fromOutput,
            Integer toInput,
            String outputType
    ) implements PatchOperation {

        public RemoveConnection(String from, String to) {
            this(from, to, null, null, null);
        }

        @Override
        public Kind kind() {
            return Kind.REMOVE_CONNECTION;
        }

        @Override
        public void checkWellFormed() {
            require(kind(), "from", from);
            require(kind(), "to", to);
            nonNegative(kind(), "fromOutput", fromOutput);
        }
    }

    record UpdateSettings(Map<String, Object> settings) implements PatchOperation {
        @Override
        public Kind kind() {
            return Kind.UPDATE_SETTINGS;
        }

        @Override
        public void checkWellFormed() {
            if (settings == null) {
                throw new MalformedPatchOperationException(kind().tag(), "settings");
            }
        }
    }

    record UpdateName(String name) implements PatchOperation {
        @Override
        public Kind kind() {
            return Kind.UPDATE_NAME;
        }

        @Override
        public void checkWellFormed() {
            require(kind(), "name", name);
        }
    }

    record Activate() implements PatchOperation {
        @Override
        public Kind kind() {
            return Kind.ACTIVATE;
        }
    }

    record Deactivate() implements PatchOperation {
        @Override
        public Kind kind() {
            return Kind.DEACTIVATE;
        }
    }

    private static void require(Kind kind, String field, String value) {
        if (value == null || value.isBlank()) {
            throw new MalformedPatchOperationException(kind.tag(), field);
        }
    }

    private static void nonNegative(Kind kind, String field, Integer value) {
        if (value != null && value < 0) {
            throw new MalformedPatchOperationException(kind.tag(), field);
        }
    }
}
