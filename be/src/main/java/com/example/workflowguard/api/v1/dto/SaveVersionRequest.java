package com.example.workflowguard.api.v1.dto;

import jakarta.validation.constraints.Size;

/**
 * Optional body for saving a snapshot; a missing reason is stored as {@code manual}.
 */
public record SaveVersionRequest(@Size(max = 200) String reason) {}
