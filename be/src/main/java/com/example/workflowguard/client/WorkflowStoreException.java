package com.example.workflowguard.client;

import lombok.Getter;

/**
 * Non-2xx answer from the remote workflow store (other than 404 on a single workflow).
 * <p>
 * Mapped to HTTP 502 by {@link com.example.workflowguard.api.GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class WorkflowStoreException extends RuntimeException {

    private final int status;
    private final String responseBody;

    public WorkflowStoreException(int status, String responseBody) {
        super("n8n API error (" + status + "): " + responseBody);
        this.status = status;
        this.responseBody = responseBody;
    }

    public WorkflowStoreException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.responseBody = null;
    }
}
