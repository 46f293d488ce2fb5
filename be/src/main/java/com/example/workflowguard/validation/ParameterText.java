package com.example.workflowguard.validation;

import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compact JSON text form of a node's parameter bag, used by the text-pattern rules and the text-rewriting fixes.
 */
public final class ParameterText {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private final JsonMapper jsonMapper;

    public ParameterText(JsonMapper jsonMapper) {
        this.jsonMapper = jsonMapper;
    }

    public String serialize(Map<String, Object> parameters) {
        try {
            return jsonMapper.writeValueAsString(parameters != null ? parameters : Map.of());
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize node parameters", e);
        }
    }

    public Map<String, Object> parse(String text) {
        try {
            return jsonMapper.readValue(text, MAP_TYPE);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to parse rewritten node parameters", e);
        }
    }

    /**
     * Escapes a value for splicing into the inside of a JSON string literal.
     */
    public String escape(String value) {
        String quoted;
        try {
            quoted = jsonMapper.writeValueAsString(value);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to escape value", e);
        }
        return quoted.substring(1, quoted.length() - 1);
    }
}
