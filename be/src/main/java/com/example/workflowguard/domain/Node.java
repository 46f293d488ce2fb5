package com.example.workflowguard.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One step of a workflow.
 * <p>
 * Fields the model does not know about (e.g. {@code webhookId}, {@code notesInFlow}) are kept in
 * {@link #getAdditionalProperties()} so they survive a read-modify-write cycle against the remote store.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Node {

    private String id;
    private String name;
    private String type;
    /** Kept as written; node versions such as {@code 4.2} are fractional. */
    private Number typeVersion = 1;
    private Position position = Position.ORIGIN;
    private Map<String, Object> parameters = new LinkedHashMap<>();
    private Map<String, Object> credentials;
    private Boolean disabled;
    private String notes;
    private final Map<String, Object> additionalProperties = new LinkedHashMap<>();

    public Node(String id, String name, String type, Number typeVersion, Position position, Map<String, Object> parameters) {
        this.id = id;
        this.name = name;
        this.type = type;
        setTypeVersion(typeVersion);
        setPosition(position);
        setParameters(parameters);
    }

    public void setTypeVersion(Number typeVersion) {
        this.typeVersion = typeVersion != null ? JsonValues.compactNumber(typeVersion) : 1;
    }

    public void setPosition(Position position) {
        this.position = position != null ? position : Position.ORIGIN;
    }

    public void setParameters(Map<String, Object> parameters) {
        this.parameters = parameters != null ? parameters : new LinkedHashMap<>();
    }

    @JsonAnyGetter
    public Map<String, Object> getAdditionalProperties() {
        return additionalProperties;
    }

    @JsonAnySetter
    public void setAdditionalProperty(String key, Object value) {
        additionalProperties.put(key, value);
    }

    public Node copy() {
        Node copy = new Node(id, name, type, typeVersion, position, JsonValues.deepCopyMap(parameters));
        copy.credentials = JsonValues.deepCopyMap(credentials);
        copy.disabled = disabled;
        copy.notes = notes;
        additionalProperties.forEach((k, v) -> copy.additionalProperties.put(k, JsonValues.deepCopy(v)));
        return copy;
    }
}
