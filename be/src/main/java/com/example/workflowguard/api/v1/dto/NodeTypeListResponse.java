package com.example.workflowguard.api.v1.dto;

import com.example.workflowguard.registry.NodeTypeEntry;

import java.util.List;

/**
 * Response for GET /api/v1/node-types: matching entries plus catalogue size and categories.
 */
public record NodeTypeListResponse(List<NodeTypeEntry> nodes, int total, int totalAvailable, List<String> categories) {}
