package com.example.workflowguard.api.v1.dto;

public record DeleteVersionsResponse(String workflowId, int deleted) {}
