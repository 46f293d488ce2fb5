package com.example.workflowguard.api.v1;

import com.example.workflowguard.registry.NodeTypeRegistry;
import com.example.workflowguard.version.VersionStoreProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GET /api/v1/health: liveness plus the local pipeline state (node catalogue size, snapshot settings).
 * The remote store is not contacted.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final NodeTypeRegistry nodeTypeRegistry;
    private final VersionStoreProperties versionProperties;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        log.trace("Health check");
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("service", "workflow-guard-be");
        body.put("nodeTypes", nodeTypeRegistry.count());
        body.put("versioning", versionProperties.enabled());
        return ResponseEntity.ok(body);
    }
}
