package com.example.workflowguard.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A workflow document as held by the remote store: a named graph of {@link Node}s wired by {@link Connections}.
 * <p>
 * Instances are transient working copies. Every pipeline component takes a {@link #copy()} and returns
 * the copy; inputs are never mutated. Node names are assumed unique within a workflow.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Workflow {

    private String id;
    private String name;
    private boolean active;
    private List<Node> nodes = new ArrayList<>();
    private Connections connections = new Connections();
    private Map<String, Object> settings;
    private String createdAt;
    private String updatedAt;
    private final Map<String, Object> additionalProperties = new LinkedHashMap<>();

    public Workflow(String id, String name, List<Node> nodes, Connections connections) {
        this.id = id;
        this.name = name;
        setNodes(nodes);
        setConnections(connections);
    }

    public void setNodes(List<Node> nodes) {
        this.nodes = nodes != null ? nodes : new ArrayList<>();
    }

    public void setConnections(Connections connections) {
        this.connections = connections != null ? connections : new Connections();
    }

    @JsonAnyGetter
    public Map<String, Object> getAdditionalProperties() {
        return additionalProperties;
    }

    @JsonAnySetter
    public void setAdditionalProperty(String key, Object value) {
        additionalProperties.put(key, value);
    }

    public Optional<Node> findNode(String nodeName) {
        return nodes.stream()
                .filter(n -> n.getName() != null && n.getName().equals(nodeName))
                .findFirst();
    }

    public Set<String> nodeNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Node node : nodes) {
            names.add(node.getName());
        }
        return names;
    }

    /**
     * Structural deep copy: nodes, parameter bags, connections and settings are all fresh instances.
     */
    public Workflow copy() {
        List<Node> copiedNodes = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            copiedNodes.add(node.copy());
        }
        Workflow copy = new Workflow(id, name, copiedNodes, connections.copy());
        copy.active = active;
        copy.settings = JsonValues.deepCopyMap(settings);
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        additionalProperties.forEach((k, v) -> copy.additionalProperties.put(k, JsonValues.deepCopy(v)));
        return copy;
    }
}
