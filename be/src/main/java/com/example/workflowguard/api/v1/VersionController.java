package com.example.workflowguard.api.v1;

import com.example.workflowguard.api.v1.dto.DeleteVersionsResponse;
import com.example.workflowguard.api.v1.dto.SaveVersionRequest;
import com.example.workflowguard.api.v1.dto.SaveVersionResponse;
import com.example.workflowguard.api.v1.dto.VersionListResponse;
import com.example.workflowguard.domain.VersionMeta;
import com.example.workflowguard.domain.VersionSnapshot;
import com.example.workflowguard.domain.VersionStats;
import com.example.workflowguard.service.RollbackResult;
import com.example.workflowguard.service.VersionDiffResult;
import com.example.workflowguard.service.WorkflowVersionService;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * REST controller for local workflow snapshots.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class VersionController {

    private final WorkflowVersionService service;

    @GetMapping("/workflows/{id}/versions")
    public ResponseEntity<VersionListResponse> list(@PathVariable String id) {
        List<VersionMeta> versions = service.list(id);
        log.debug("Listing versions workflow id={} count={}", id, versions.size());
        return ResponseEntity.ok(new VersionListResponse(id, versions, versions.size()));
    }

    @PostMapping("/workflows/{id}/versions")
    public ResponseEntity<SaveVersionResponse> save(@PathVariable String id,
                                                    @Valid @RequestBody(required = false) SaveVersionRequest request) {
        log.info("Saving version workflow id={}", id);
        Optional<VersionMeta> saved = service.save(id, request != null ? request.reason() : null);
        if (saved.isEmpty()) {
            log.info("No changes since last version workflow id={}", id);
            return ResponseEntity.ok(SaveVersionResponse.unchanged());
        }
        log.info("Saved version workflow id={} version={}", id, saved.get().id());
        return ResponseEntity.status(HttpStatus.CREATED).body(SaveVersionResponse.saved(saved.get()));
    }

    @GetMapping("/workflows/{id}/versions/latest")
    public ResponseEntity<VersionSnapshot> latest(@PathVariable String id) {
        log.info("Getting latest version workflow id={}", id);
        return ResponseEntity.ok(service.latest(id));
    }

    @GetMapping("/workflows/{id}/versions/diff")
    public ResponseEntity<VersionDiffResult> diff(@PathVariable String id,
                                                  @RequestParam(required = false) String from,
                                                  @RequestParam String to) {
        log.info("Diffing workflow id={} from={} to={}", id, from != null ? from : WorkflowVersionService.CURRENT, to);
        return ResponseEntity.ok(service.diff(id, from, to));
    }

    @GetMapping("/workflows/{id}/versions/{versionId}")
    public ResponseEntity<VersionSnapshot> get(@PathVariable String id, @PathVariable String versionId) {
        log.info("Getting version workflow id={} version={}", id, versionId);
        return ResponseEntity.ok(service.get(id, versionId));
    }

    @PostMapping("/workflows/{id}/versions/{versionId}/rollback")
    public ResponseEntity<RollbackResult> rollback(@PathVariable String id, @PathVariable String versionId) {
        log.info("Rolling back workflow id={} to version={}", id, versionId);
        RollbackResult result = service.rollback(id, versionId);
        log.info("Rolled back workflow id={} to version={}", id, versionId);
        return ResponseEntity.ok(result);
    }

    @DeleteMapping("/workflows/{id}/versions")
    public ResponseEntity<DeleteVersionsResponse> deleteAll(@PathVariable String id) {
        log.info("Deleting all versions workflow id={}", id);
        return ResponseEntity.ok(new DeleteVersionsResponse(id, service.deleteAll(id)));
    }

    @GetMapping("/versions/stats")
    public ResponseEntity<VersionStats> stats() {
        log.debug("Version store stats");
        return ResponseEntity.ok(service.stats());
    }
}
