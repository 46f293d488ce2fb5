package com.example.workflowguard.patch;

import com.example.workflowguard.domain.ConnectionTarget;
import com.example.workflowguard.domain.JsonValues;
import com.example.workflowguard.domain.Node;
import com.example.workflowguard.domain.Workflow;
import com.example.workflowguard.validation.WorkflowValidator;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies {@link PatchOperation}s to a copy of a workflow.
 * <p>
 * Operations run in caller order and each sees the effect of the previous ones. Missing targets
 * produce warnings rather than failures; an operation lacking a required field rejects the whole
 * batch before anything is applied.
 * </p>
 */
@Slf4j
public class PatchEngine {

    private final NodeIdGenerator idGenerator;

    public PatchEngine(NodeIdGenerator idGenerator) {
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    public PatchResult applyPatch(Workflow workflow, List<PatchOperation> operations) {
        Objects.requireNonNull(workflow, "workflow");
        List<PatchOperation> ops = operations != null ? operations : List.of();
        for (PatchOperation op : ops) {
            if (op == null) {
                throw new IllegalArgumentException("patch operation must not be null");
            }
            op.checkWellFormed();
        }

        Workflow result = workflow.copy();
        List<String> warnings = new ArrayList<>();
        for (PatchOperation op : ops) {
            apply(result, op).ifPresent(warnings::add);
        }
        log.debug("Applied {} patch operations to workflow id={} warnings={}", ops.size(), workflow.getId(), warnings.size());
        return new PatchResult(result, warnings);
    }

    private Optional<String> apply(Workflow workflow, PatchOperation op) {
        return switch (op.kind()) {
            case ADD_NODE -> addNode(workflow, (PatchOperation.AddNode) op);
            case REMOVE_NODE -> removeNode(workflow, (PatchOperation.RemoveNode) op);
            case UPDATE_NODE -> updateNode(workflow, (PatchOperation.UpdateNode) op);
            case ADD_CONNECTION -> addConnection(workflow, (PatchOperation.AddConnection) op);
            case REMOVE_CONNECTION -> removeConnection(workflow, (PatchOperation.RemoveConnection) op);
            case UPDATE_SETTINGS -> updateSettings(workflow, (PatchOperation.UpdateSettings) op);
            case UPDATE_NAME -> {
                workflow.setName(((PatchOperation.UpdateName) op).name());
                yield Optional.empty();
            }
            case ACTIVATE -> {
                workflow.setActive(true);
                yield Optional.empty();
            }
            case DEACTIVATE -> {
                workflow.setActive(false);
                yield Optional.empty();
            }
        };
    }

    private Optional<String> addNode(Workflow workflow, PatchOperation.AddNode op) {
        Node node = op.node().copy();
        if (node.getId() == null || node.getId().isBlank()) {
            node.setId(idGenerator.nextId());
        }
        workflow.getNodes().add(node);
        return Optional.empty();
    }

    private Optional<String> removeNode(Workflow workflow, PatchOperation.RemoveNode op) {
        Optional<Node> node = workflow.findNode(op.nodeName());
        if (node.isEmpty()) {
            return Optional.of(notFound(op.nodeName()));
        }
        workflow.getNodes().remove(node.get());
        workflow.getConnections().removeNode(op.nodeName());
        return Optional.empty();
    }

    private Optional<String> updateNode(Workflow workflow, PatchOperation.UpdateNode op) {
        Optional<Node> found = workflow.findNode(op.nodeName());
        if (found.isEmpty()) {
            return Optional.of(notFound(op.nodeName()));
        }
        Node node = found.get();
        Optional<String> warning = Optional.empty();
        if (op.properties().parameters() != null) {
            List<String> dropped = WorkflowValidator.droppedParameterKeys(node.getParameters(), op.properties().parameters());
            if (!dropped.isEmpty()) {
                warning = Optional.of("WARNING: Updating \"" + op.nodeName() + "\" will remove parameters: "
                        + String.join(", ", dropped) + ". Include all existing parameters to preserve them.");
            }
        }
        op.properties().mergeInto(node);
        return warning;
    }

    private Optional<String> addConnection(Workflow workflow, PatchOperation.AddConnection op) {
        String outputType = op.outputType() != null ? op.outputType() : ConnectionTarget.MAIN;
        String inputType = op.inputType() != null ? op.inputType() : ConnectionTarget.MAIN;
        int fromOutput = op.fromOutput() != null ? op.fromOutput() : 0;
        int toInput = op.toInput() != null ? op.toInput() : 0;
        workflow.getConnections().add(op.from(), outputType, fromOutput, new ConnectionTarget(op.to(), inputType, toInput));
        return Optional.empty();
    }

    private Optional<String> removeConnection(Workflow workflow, PatchOperation.RemoveConnection op) {
        String outputType = op.outputType() != null ? op.outputType() : ConnectionTarget.MAIN;
        int fromOutput = op.fromOutput() != null ? op.fromOutput() : 0;
        boolean removed = workflow.getConnections().remove(op.from(), outputType, fromOutput, op.to(), op.toInput());
        if (!removed) {
            log.debug("No connection {} -> {} on {}[{}] to remove", op.from(), op.to(), outputType, fromOutput);
        }
        return Optional.empty();
    }

    private Optional<String> updateSettings(Workflow workflow, PatchOperation.UpdateSettings op) {
        Map<String, Object> merged = workflow.getSettings() != null
                ? new LinkedHashMap<>(workflow.getSettings())
                : new LinkedHashMap<>();
        op.settings().forEach((key, value) -> merged.put(key, JsonValues.deepCopy(value)));
        workflow.setSettings(merged);
        return Optional.empty();
    }

    private static String notFound(String nodeName) {
        return "Node not found: " + nodeName;
    }
}
