package com.example.workflowguard.patch;

import lombok.Getter;

/**
 * Thrown when a patch operation lacks a required field. No operation of the batch has been applied.
 * <p>
 * Mapped to HTTP 400 by {@link com.example.workflowguard.api.GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class MalformedPatchOperationException extends IllegalArgumentException {

    private final String operationType;
    private final String field;

    public MalformedPatchOperationException(String operationType, String field) {
        super(operationType + " operation requires '" + field + "'");
        this.operationType = operationType;
        this.field = field;
    }
}
