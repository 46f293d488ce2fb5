package com.example.workflowguard.api;

import java.util.Objects;

/**
 * A single request error (field and message).
 */
public record ValidationError(String field, String message) {
    public ValidationError {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(message, "message");
    }
}
