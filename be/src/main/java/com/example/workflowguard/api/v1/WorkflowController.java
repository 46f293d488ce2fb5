package com.example.workflowguard.api.v1;

import com.example.workflowguard.api.v1.dto.ActivationResponse;
import com.example.workflowguard.api.v1.dto.WorkflowCreateRequest;
import com.example.workflowguard.api.v1.dto.WorkflowListResponse;
import com.example.workflowguard.api.v1.dto.WorkflowPatchRequest;
import com.example.workflowguard.client.WorkflowPage;
import com.example.workflowguard.domain.Workflow;
import com.example.workflowguard.service.AutofixOutcome;
import com.example.workflowguard.service.CleanupResult;
import com.example.workflowguard.service.FormatOutcome;
import com.example.workflowguard.service.WorkflowEditService;
import com.example.workflowguard.service.WorkflowUpdateResult;
import com.example.workflowguard.service.WorkflowValidationReport;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for workflows held by the remote store.
 * <p>
 * Exposes {@code /api/v1/workflows} for list (GET), create (POST), get by id (GET /{id}), patch
 * operations (PATCH /{id}), delete (DELETE /{id}), activation, validation, and auto-fix/format
 * previews that are written only with {@code apply=true}.
 * </p>
 */
@RestController
@RequestMapping("/api/v1/workflows")
@RequiredArgsConstructor
@Slf4j
public class WorkflowController {

    private final WorkflowEditService service;

    @GetMapping
    public ResponseEntity<WorkflowListResponse> list(
            @RequestParam(required = false) Boolean active,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String cursor) {
        log.debug("Listing workflows active={} limit={}", active, limit);
        WorkflowPage page = service.list(active, limit != null ? limit : 100, cursor);
        return ResponseEntity.ok(new WorkflowListResponse(page.data(), page.data().size(), page.nextCursor()));
    }

    @PostMapping
    public ResponseEntity<CleanupResult> create(@Valid @RequestBody WorkflowCreateRequest request) {
        log.info("Creating workflow name={} nodeCount={}", request.name(), request.nodes().size());
        CleanupResult result = service.create(request.toWorkflow());
        log.info("Created workflow id={} valid={} autoFixed={}", result.workflow().getId(), result.valid(), result.autoFixed().size());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Workflow> getById(@PathVariable String id) {
        log.info("Getting workflow id={}", id);
        return ResponseEntity.ok(service.get(id));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<WorkflowUpdateResult> update(@PathVariable String id, @Valid @RequestBody WorkflowPatchRequest request) {
        log.info("Patching workflow id={} operations={}", id, request.operations().size());
        WorkflowUpdateResult result = service.update(id, request.operations());
        log.info("Patched workflow id={} patchWarnings={} versionSaved={}", id, result.patchWarnings().size(), result.versionSaved());
        return ResponseEntity.ok(result);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        log.info("Deleting workflow id={}", id);
        service.delete(id);
        log.info("Deleted workflow id={}", id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/activate")
    public ResponseEntity<ActivationResponse> activate(@PathVariable String id) {
        log.info("Activating workflow id={}", id);
        return ResponseEntity.ok(ActivationResponse.of(service.activate(id)));
    }

    @PostMapping("/{id}/deactivate")
    public ResponseEntity<ActivationResponse> deactivate(@PathVariable String id) {
        log.info("Deactivating workflow id={}", id);
        return ResponseEntity.ok(ActivationResponse.of(service.deactivate(id)));
    }

    @GetMapping("/{id}/validation")
    public ResponseEntity<WorkflowValidationReport> validate(@PathVariable String id) {
        log.info("Validating workflow id={}", id);
        WorkflowValidationReport report = service.validate(id);
        log.info("Validated workflow id={} valid={} warnings={} expressionIssues={}", id, report.valid(),
                report.warnings().size(), report.expressionIssues().size());
        return ResponseEntity.ok(report);
    }

    @PostMapping("/{id}/autofix")
    public ResponseEntity<AutofixOutcome> autofix(@PathVariable String id, @RequestParam(defaultValue = "false") boolean apply) {
        log.info("Auto-fixing workflow id={} apply={}", id, apply);
        AutofixOutcome outcome = service.autofix(id, apply);
        log.info("Auto-fix workflow id={} applied={} fixes={}", id, outcome.applied(), outcome.fixes().size());
        return ResponseEntity.ok(outcome);
    }

    @PostMapping("/{id}/format")
    public ResponseEntity<FormatOutcome> format(@PathVariable String id, @RequestParam(defaultValue = "false") boolean apply) {
        log.info("Formatting workflow id={} apply={}", id, apply);
        return ResponseEntity.ok(service.format(id, apply));
    }
}
