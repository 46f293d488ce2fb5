package com.example.workflowguard.client;

import com.example.workflowguard.domain.Workflow;

/**
 * Remote store holding the workflows. Single-workflow calls throw
 * {@link com.example.workflowguard.api.WorkflowNotFoundException} for an unknown id.
 */
public interface WorkflowStore {

    /**
     * @param active filter on the active flag, or null for all
     * @param limit  page size, or null for the store's default
     * @param cursor cursor from a previous page, or null for the first page
     */
    WorkflowPage list(Boolean active, Integer limit, String cursor);

    Workflow get(String id);

    Workflow create(Workflow workflow);

    /**
     * Replaces the workflow; only writable fields are sent.
     */
    Workflow update(String id, Workflow workflow);

    void delete(String id);

    Workflow activate(String id);

    Workflow deactivate(String id);
}
