package com.example.workflowguard.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Connection map of a workflow: source node name → output-type label → output slots (by index) → targets.
 * <p>
 * Describes a directed multigraph with labeled, indexed ports. The JSON shape is the one the remote
 * workflow store uses, e.g. {@code {"trigger": {"main": [[{"node": "process", "type": "main", "index": 0}]]}}}.
 * </p>
 */
public final class Connections {

    private final Map<String, Map<String, List<List<ConnectionTarget>>>> bySource;

    public Connections() {
        this.bySource = new LinkedHashMap<>();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public Connections(Map<String, Map<String, List<List<ConnectionTarget>>>> bySource) {
        this.bySource = new LinkedHashMap<>();
        if (bySource == null) {
            return;
        }
        bySource.forEach((source, outputs) -> {
            Map<String, List<List<ConnectionTarget>>> copiedOutputs = new LinkedHashMap<>();
            if (outputs != null) {
                outputs.forEach((label, slots) -> copiedOutputs.put(label, copySlots(slots)));
            }
            this.bySource.put(source, copiedOutputs);
        });
    }

    @JsonValue
    public Map<String, Map<String, List<List<ConnectionTarget>>>> asMap() {
        return bySource;
    }

    public Connections copy() {
        return new Connections(bySource);
    }

    public boolean isEmpty() {
        return bySource.isEmpty();
    }

    public Set<String> sources() {
        return bySource.keySet();
    }

    /**
     * Appends a target to the given output slot, creating the source entry, the label and any
     * missing lower-index slots (as empty lists) first.
     */
    public void add(String from, String outputType, int fromOutput, ConnectionTarget target) {
        List<List<ConnectionTarget>> slots = bySource
                .computeIfAbsent(from, k -> new LinkedHashMap<>())
                .computeIfAbsent(outputType, k -> new ArrayList<>());
        while (slots.size() <= fromOutput) {
            slots.add(new ArrayList<>());
        }
        slots.get(fromOutput).add(target);
    }

    /**
     * Removes the first target naming {@code to} (and {@code toInput}, when given) from one slot.
     *
     * @return true if an entry was removed
     */
    public boolean remove(String from, String outputType, int fromOutput, String to, Integer toInput) {
        Map<String, List<List<ConnectionTarget>>> outputs = bySource.get(from);
        if (outputs == null) {
            return false;
        }
        List<List<ConnectionTarget>> slots = outputs.get(outputType);
        if (slots == null || fromOutput < 0 || fromOutput >= slots.size()) {
            return false;
        }
        Iterator<ConnectionTarget> it = slots.get(fromOutput).iterator();
        while (it.hasNext()) {
            ConnectionTarget target = it.next();
            if (target.node().equals(to) && (toInput == null || target.index() == toInput)) {
                it.remove();
                return true;
            }
        }
        return false;
    }

    /**
     * Drops the node's outbound entry and every target entry naming it, in all labels and slots.
     */
    public void removeNode(String name) {
        bySource.remove(name);
        for (Map<String, List<List<ConnectionTarget>>> outputs : bySource.values()) {
            for (List<List<ConnectionTarget>> slots : outputs.values()) {
                for (List<ConnectionTarget> slot : slots) {
                    slot.removeIf(target -> target.node().equals(name));
                }
            }
        }
    }

    /**
     * Renames a node in the outbound key and in every inbound target entry. Key order is preserved.
     *
     * @return number of target entries rewritten
     */
    public int renameNode(String oldName, String newName) {
        if (bySource.containsKey(oldName)) {
            Map<String, Map<String, List<List<ConnectionTarget>>>> renamed = new LinkedHashMap<>();
            bySource.forEach((source, outputs) -> renamed.put(source.equals(oldName) ? newName : source, outputs));
            bySource.clear();
            bySource.putAll(renamed);
        }
        int rewritten = 0;
        for (Map<String, List<List<ConnectionTarget>>> outputs : bySource.values()) {
            for (List<List<ConnectionTarget>> slots : outputs.values()) {
                for (List<ConnectionTarget> slot : slots) {
                    for (int i = 0; i < slot.size(); i++) {
                        if (slot.get(i).node().equals(oldName)) {
                            slot.set(i, slot.get(i).withNode(newName));
                            rewritten++;
                        }
                    }
                }
            }
        }
        return rewritten;
    }

    /**
     * First source (in map order) with a target entry naming {@code nodeName}.
     */
    public Optional<String> findFirstSourceOf(String nodeName) {
        for (Map.Entry<String, Map<String, List<List<ConnectionTarget>>>> entry : bySource.entrySet()) {
            for (List<List<ConnectionTarget>> slots : entry.getValue().values()) {
                for (List<ConnectionTarget> slot : slots) {
                    for (ConnectionTarget target : slot) {
                        if (target.node().equals(nodeName)) {
                            return Optional.of(entry.getKey());
                        }
                    }
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Every node name appearing as a source key or as a target anywhere in the map.
     */
    public Set<String> connectedNodeNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Edge edge : edges()) {
            names.add(edge.source());
            names.add(edge.target());
        }
        names.addAll(bySource.keySet());
        return names;
    }

    /**
     * One edge per target entry, in map order (duplicates kept).
     */
    public List<Edge> edges() {
        List<Edge> edges = new ArrayList<>();
        bySource.forEach((source, outputs) -> {
            for (List<List<ConnectionTarget>> slots : outputs.values()) {
                for (List<ConnectionTarget> slot : slots) {
                    for (ConnectionTarget target : slot) {
                        edges.add(new Edge(source, target.node()));
                    }
                }
            }
        });
        return edges;
    }

    public int targetCount() {
        return edges().size();
    }

    private static List<List<ConnectionTarget>> copySlots(List<List<ConnectionTarget>> slots) {
        List<List<ConnectionTarget>> copied = new ArrayList<>();
        if (slots == null) {
            return copied;
        }
        for (List<ConnectionTarget> slot : slots) {
            copied.add(slot != null ? new ArrayList<>(slot) : new ArrayList<>());
        }
        return copied;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Connections other && bySource.equals(other.bySource);
    }

    @Override
    public int hashCode() {
        return bySource.hashCode();
    }

    @Override
    public String toString() {
        return "Connections" + bySource;
    }

    /** Directed source → target pair derived from one connection entry. */
    public record Edge(String source, String target) {
    }
}
