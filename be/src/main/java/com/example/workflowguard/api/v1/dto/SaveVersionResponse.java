package com.example.workflowguard.api.v1.dto;

import com.example.workflowguard.domain.VersionMeta;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SaveVersionResponse(boolean saved, VersionMeta version, String message) {

    public static SaveVersionResponse saved(VersionMeta version) {
        return new SaveVersionResponse(true, version, null);
    }

    public static SaveVersionResponse unchanged() {
        return new SaveVersionResponse(false, null, "No changes detected since last version");
    }
}
