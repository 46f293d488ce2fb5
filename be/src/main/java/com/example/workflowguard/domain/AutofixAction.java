package com.example.workflowguard.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * One repair applied by the auto-fix engine. {@code target} is {@code workflow} or {@code node:<name>}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AutofixAction(Type type, String target, String description, Object before, Object after) {

    public static final String WORKFLOW_TARGET = "workflow";

    public AutofixAction {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(description, "description");
    }

    public static String nodeTarget(String nodeName) {
        return "node:" + nodeName;
    }

    public enum Type {
        RENAME,
        EXPRESSION_FIX,
        PARAMETER_FIX;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Type fromValue(String value) {
            return valueOf(value.toUpperCase(Locale.ROOT));
        }
    }
}
