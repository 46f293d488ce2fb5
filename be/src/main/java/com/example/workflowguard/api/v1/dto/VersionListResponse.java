package com.example.workflowguard.api.v1.dto;

import com.example.workflowguard.domain.VersionMeta;

import java.util.List;

/**
 * Snapshots of one workflow, newest first.
 */
public record VersionListResponse(String workflowId, List<VersionMeta> versions, int total) {}
