package com.example.workflowguard.api.v1.dto;

import com.example.workflowguard.patch.PatchOperation;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request body for PATCH /api/v1/workflows/{id}: operations applied in order.
 */
public record WorkflowPatchRequest(@NotNull @NotEmpty List<PatchOperation> operations) {}
