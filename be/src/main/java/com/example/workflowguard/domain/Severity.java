package com.example.workflowguard.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a validation warning or expression issue. Only {@link #ERROR} makes a workflow invalid.
 */
public enum Severity {
    ERROR,
    WARNING,
    INFO;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromValue(String value) {
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
