package com.example.workflowguard.service;

import com.example.workflowguard.autofix.AutofixEngine;
import com.example.workflowguard.autofix.AutofixResult;
import com.example.workflowguard.client.WorkflowPage;
import com.example.workflowguard.client.WorkflowStore;
import com.example.workflowguard.domain.Node;
import com.example.workflowguard.domain.NodeTypeError;
import com.example.workflowguard.domain.VersionMeta;
import com.example.workflowguard.domain.Workflow;
import com.example.workflowguard.expression.ExpressionAnalyzer;
import com.example.workflowguard.layout.WorkflowFormatter;
import com.example.workflowguard.patch.NodeIdGenerator;
import com.example.workflowguard.patch.PatchEngine;
import com.example.workflowguard.patch.PatchOperation;
import com.example.workflowguard.patch.PatchResult;
import com.example.workflowguard.registry.NodeTypeRegistry;
import com.example.workflowguard.validation.NodeTypeValidator;
import com.example.workflowguard.validation.UnknownNodeTypeException;
import com.example.workflowguard.validation.ValidationResult;
import com.example.workflowguard.validation.WorkflowValidator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Application service for workflow edits against the remote store.
 * <p>
 * Every write goes through {@link WorkflowCleanupService}. Updates, auto-fix and format snapshot the
 * stored state first, so each write can be rolled back.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowEditService {

    static final String BEFORE_UPDATE = "before_update";
    static final String BEFORE_AUTOFIX = "before_autofix";
    static final String BEFORE_FORMAT = "before_format";

    private final WorkflowStore store;
    private final WorkflowCleanupService cleanupService;
    private final WorkflowVersionService versionService;
    private final PatchEngine patchEngine;
    private final WorkflowValidator validator;
    private final AutofixEngine autofixEngine;
    private final ExpressionAnalyzer expressionAnalyzer;
    private final WorkflowFormatter formatter;
    private final NodeTypeRegistry nodeTypeRegistry;
    private final NodeIdGenerator idGenerator;

    public WorkflowPage list(Boolean active, Integer limit, String cursor) {
        return store.list(active, limit, cursor);
    }

    public Workflow get(String id) {
        return store.get(id);
    }

    /**
     * Creates the workflow remotely, then cleans it up. Nodes without an id get one; unknown node
     * types are rejected before anything is written.
     */
    public CleanupResult create(Workflow workflow) {
        Workflow draft = workflow.copy();
        checkNodeTypes(draft.getNodes());
        for (Node node : draft.getNodes()) {
            if (node.getId() == null || node.getId().isBlank()) {
                node.setId(idGenerator.nextId());
            }
        }
        log.debug("Creating workflow name={} nodes={}", draft.getName(), draft.getNodes().size());
        Workflow created = store.create(draft);
        return cleanupService.cleanup(created, created);
    }

    /**
     * Snapshots the stored workflow, applies the operations and cleans up the result. A change of
     * the active flag is sent through the activate/deactivate calls.
     */
    public WorkflowUpdateResult update(String id, List<PatchOperation> operations) {
        Workflow current = store.get(id);
        PatchResult patched = patchEngine.applyPatch(current, operations);
        checkNodeTypes(introducedNodes(current, patched.workflow()));

        Optional<VersionMeta> saved = versionService.snapshot(current, BEFORE_UPDATE);
        CleanupResult cleanup = cleanupService.cleanup(current, patched.workflow());
        if (patched.workflow().isActive() != current.isActive()) {
            Workflow toggled = patched.workflow().isActive() ? store.activate(id) : store.deactivate(id);
            cleanup = new CleanupResult(toggled, cleanup.valid(), cleanup.warnings(), cleanup.autoFixed(), true);
        }
        log.debug("Updated workflow id={} operations={} patchWarnings={}", id, operations.size(), patched.warnings().size());
        return new WorkflowUpdateResult(cleanup, patched.warnings(), saved.map(VersionMeta::id).orElse(null));
    }

    public WorkflowValidationReport validate(String id) {
        Workflow workflow = store.get(id);
        ValidationResult result = validator.validate(workflow);
        return new WorkflowValidationReport(
                workflow.getId(),
                workflow.getName(),
                result.valid(),
                result.warnings(),
                expressionAnalyzer.validateExpressions(workflow),
                expressionAnalyzer.checkCircularReferences(workflow));
    }

    /**
     * Previews the fixes, or with {@code apply} snapshots and writes them when there is at least one.
     */
    public AutofixOutcome autofix(String id, boolean apply) {
        Workflow workflow = store.get(id);
        AutofixResult result = autofixEngine.autofix(workflow, validator.validate(workflow).warnings());
        if (!apply || result.fixes().isEmpty()) {
            return new AutofixOutcome(false, result.fixes(), result.unfixable(), result.workflow());
        }
        versionService.snapshot(workflow, BEFORE_AUTOFIX);
        Workflow stored = store.update(id, result.workflow());
        log.debug("Applied {} fixes to workflow id={}", result.fixes().size(), id);
        return new AutofixOutcome(true, result.fixes(), result.unfixable(), stored);
    }

    public FormatOutcome format(String id, boolean apply) {
        Workflow workflow = store.get(id);
        Workflow formatted = formatter.formatWorkflow(workflow);
        if (!apply) {
            return new FormatOutcome(false, formatted);
        }
        versionService.snapshot(workflow, BEFORE_FORMAT);
        return new FormatOutcome(true, store.update(id, formatted));
    }

    public void delete(String id) {
        store.delete(id);
    }

    public Workflow activate(String id) {
        return store.activate(id);
    }

    public Workflow deactivate(String id) {
        return store.deactivate(id);
    }

    private void checkNodeTypes(List<Node> nodes) {
        if (nodes.isEmpty()) {
            return;
        }
        List<NodeTypeError> errors = NodeTypeValidator.validateNodeTypes(nodes, nodeTypeRegistry.knownTypes());
        if (!errors.isEmpty()) {
            log.debug("Rejecting {} nodes with unknown types", errors.size());
            throw new UnknownNodeTypeException(errors);
        }
    }

    /**
     * Nodes of {@code after} that are new or whose type changed. Nodes already stored with their
     * type are not re-checked, so a catalogue gap never blocks edits elsewhere in the workflow.
     */
    private static List<Node> introducedNodes(Workflow before, Workflow after) {
        Map<String, Node> existing = before.getNodes().stream()
                .filter(n -> n.getName() != null)
                .collect(Collectors.toMap(Node::getName, Function.identity(), (a, b) -> a));
        List<Node> introduced = new ArrayList<>();
        for (Node node : after.getNodes()) {
            Node previous = existing.get(node.getName());
            if (previous == null || !Objects.equals(previous.getType(), node.getType())) {
                introduced.add(node);
            }
        }
        return introduced;
    }
}
