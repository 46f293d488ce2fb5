package com.example.workflowguard.service;

import com.example.workflowguard.api.WorkflowNotFoundException;
import com.example.workflowguard.domain.Node;
import com.example.workflowguard.domain.Position;
import com.example.workflowguard.domain.VersionMeta;
import com.example.workflowguard.domain.Workflow;
import com.example.workflowguard.patch.NodeUpdate;
import com.example.workflowguard.patch.PatchOperation;
import com.example.workflowguard.validation.UnknownNodeTypeException;
import com.example.workflowguard.validation.ValidationRules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static com.example.workflowguard.TestWorkflows.HTTP_REQUEST;
import static com.example.workflowguard.TestWorkflows.MANUAL_TRIGGER;
import static com.example.workflowguard.TestWorkflows.SET;
import static com.example.workflowguard.TestWorkflows.connect;
import static com.example.workflowguard.TestWorkflows.node;
import static com.example.workflowguard.TestWorkflows.params;
import static com.example.workflowguard.TestWorkflows.workflow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("WorkflowEditService")
class WorkflowEditServiceTest {

    @TempDir
    Path storageDir;

    private ServiceFixture fixture;
    private WorkflowEditService service;

    @BeforeEach
    void setUp() {
        fixture = new ServiceFixture(storageDir);
        service = fixture.editService;
    }

    /** trigger → http → set_fields, already laid out so cleanup has nothing to change. */
    private Workflow seedTidy() {
        Workflow workflow = workflow("sample",
                node("trigger", MANUAL_TRIGGER),
                node("http", HTTP_REQUEST, params("url", "https://example.com", "method", "POST", "headers", Map.of("a", "b"))),
                node("set_fields", SET, params("mode", "raw")));
        connect(workflow, "trigger", "http");
        connect(workflow, "http", "set_fields");
        return fixture.store.seed(fixture.formatter.formatWorkflow(workflow));
    }

    private List<VersionMeta> versions() {
        return fixture.versionService.list("wf-1");
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        @DisplayName("snapshots the stored state, warns about dropped parameters and writes the patch")
        void droppedParameters() {
            seedTidy();

            WorkflowUpdateResult result = service.update("wf-1", List.of(
                    new PatchOperation.UpdateNode("http", NodeUpdate.parameters(params("url", "https://example.org")))));

            assertEquals(List.of("WARNING: Updating \"http\" will remove parameters: method, headers. "
                    + "Include all existing parameters to preserve them."), result.patchWarnings());
            assertNotNull(result.versionSaved());
            assertEquals(WorkflowEditService.BEFORE_UPDATE, versions().get(0).reason());
            assertTrue(result.cleanup().persisted());
            assertEquals(Map.of("url", "https://example.org"),
                    fixture.store.stored("wf-1").findNode("http").orElseThrow().getParameters());
            assertEquals(1, fixture.store.count("update:wf-1"));
        }

        @Test
        @DisplayName("auto-fixes and lays out nodes added by the patch")
        void cleansUpAddedNodes() {
            seedTidy();
            Node added = new Node(null, "ProcessItems", SET, 1, Position.ORIGIN, params("value", "={{ $json.id }}"));

            WorkflowUpdateResult result = service.update("wf-1", List.of(
                    new PatchOperation.AddNode(added),
                    new PatchOperation.AddConnection("set_fields", "ProcessItems")));

            CleanupResult cleanup = result.cleanup();
            assertEquals(List.of("Renamed node to snake_case", "Changed $json to explicit $('set_fields') reference"),
                    cleanup.autoFixed());
            assertTrue(cleanup.valid());
            Workflow stored = fixture.store.stored("wf-1");
            Node processItems = stored.findNode("process_items").orElseThrow();
            assertEquals("generated-1", processItems.getId());
            assertEquals("={{ $('set_fields').item.json.id }}", processItems.getParameters().get("value"));
            assertTrue(processItems.getPosition().x() > stored.findNode("set_fields").orElseThrow().getPosition().x());
        }

        @Test
        @DisplayName("rejects nodes of unknown type before writing anything")
        void unknownType() {
            seedTidy();
            Node added = node("notify", "n8n-nodes-base.slak");

            UnknownNodeTypeException e = assertThrows(UnknownNodeTypeException.class,
                    () -> service.update("wf-1", List.of(new PatchOperation.AddNode(added))));

            assertEquals("notify", e.getErrors().get(0).nodeName());
            assertEquals(List.of("n8n-nodes-base.slack"), e.getErrors().get(0).suggestions());
            assertEquals(0, fixture.store.count("update:wf-1"));
            assertTrue(versions().isEmpty());
        }

        @Test
        @DisplayName("does not re-check node types already stored")
        void storedTypesNotChecked() {
            Workflow workflow = workflow("legacy", node("trigger", MANUAL_TRIGGER), node("custom", "community.customNode"));
            connect(workflow, "trigger", "custom");
            fixture.store.seed(workflow);

            WorkflowUpdateResult result = service.update("wf-1", List.of(new PatchOperation.UpdateName("legacy_flow")));

            assertEquals("legacy_flow", result.cleanup().workflow().getName());
        }

        @Test
        @DisplayName("sends an active flag change through activate")
        void activation() {
            seedTidy();

            WorkflowUpdateResult result = service.update("wf-1", List.of(new PatchOperation.Activate()));

            assertTrue(result.cleanup().workflow().isActive());
            assertTrue(result.cleanup().persisted());
            assertEquals(1, fixture.store.count("activate:wf-1"));
        }

        @Test
        @DisplayName("fails for an unknown workflow")
        void missingWorkflow() {
            assertThrows(WorkflowNotFoundException.class,
                    () -> service.update("nope", List.of(new PatchOperation.UpdateName("x"))));
        }
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("assigns node ids, creates remotely and persists the cleaned result")
        void creates() {
            Node trigger = new Node(null, "Start", MANUAL_TRIGGER, 1, Position.ORIGIN, params());
            Node process = new Node("keep-me", "process", SET, 1, Position.ORIGIN, params());
            Workflow draft = new Workflow(null, "New Flow", new java.util.ArrayList<>(List.of(trigger, process)),
                    new com.example.workflowguard.domain.Connections());
            connect(draft, "Start", "process");

            CleanupResult result = service.create(draft);

            assertTrue(result.persisted());
            Workflow stored = fixture.store.stored("created-1");
            assertEquals("new_flow", stored.getName());
            assertEquals("generated-1", stored.findNode("start").orElseThrow().getId());
            assertEquals("keep-me", stored.findNode("process").orElseThrow().getId());
            assertEquals("start", stored.getConnections().findFirstSourceOf("process").orElseThrow());
            assertEquals(List.of("create:created-1", "update:created-1"), fixture.store.calls());
        }

        @Test
        @DisplayName("rejects unknown node types before creating")
        void unknownType() {
            Workflow draft = workflow("flow", node("fetch", "n8n-nodes-base.httpRequests"));

            assertThrows(UnknownNodeTypeException.class, () -> service.create(draft));
            assertTrue(fixture.store.calls().isEmpty());
        }
    }

    @Test
    @DisplayName("reports rule warnings, expression issues and circular references")
    void validate() {
        Workflow workflow = workflow("Loop Flow",
                node("a", SET, params("x", "{{ $('b').item.json.x }}")),
                node("b", SET, params("x", "={{ $json.x }} {{ $('a').item.json.x }}")));
        connect(workflow, "a", "b");
        fixture.store.seed(workflow);

        WorkflowValidationReport report = service.validate("wf-1");

        assertEquals("Loop Flow", report.workflowName());
        assertTrue(report.valid());
        assertTrue(report.warnings().stream().anyMatch(w -> w.rule().equals(ValidationRules.SNAKE_CASE)));
        assertTrue(report.warnings().stream().anyMatch(w -> w.rule().equals(ValidationRules.EXPLICIT_REFERENCE)));
        assertFalse(report.expressionIssues().isEmpty());
        assertEquals(List.of(List.of("a", "b", "a")), report.circularReferences());
        assertTrue(fixture.store.calls().stream().noneMatch(c -> c.startsWith("update")));
    }

    @Nested
    @DisplayName("autofix")
    class Autofix {

        private void seedFixable() {
            Workflow workflow = workflow("My-Workflow", node("trigger", MANUAL_TRIGGER),
                    node("process", SET, params("value", "={{ $json.field }}")));
            connect(workflow, "trigger", "process");
            fixture.store.seed(workflow);
        }

        @Test
        @DisplayName("previews fixes without writing")
        void preview() {
            seedFixable();

            AutofixOutcome outcome = service.autofix("wf-1", false);

            assertFalse(outcome.applied());
            assertEquals(2, outcome.fixes().size());
            assertEquals("my_workflow", outcome.workflow().getName());
            assertEquals("My-Workflow", fixture.store.stored("wf-1").getName());
            assertTrue(versions().isEmpty());
        }

        @Test
        @DisplayName("snapshots and writes fixes when applied")
        void apply() {
            seedFixable();

            AutofixOutcome outcome = service.autofix("wf-1", true);

            assertTrue(outcome.applied());
            assertEquals("my_workflow", fixture.store.stored("wf-1").getName());
            assertEquals(WorkflowEditService.BEFORE_AUTOFIX, versions().get(0).reason());
            assertEquals("My-Workflow", fixture.versionService.latest("wf-1").workflow().getName());
        }

        @Test
        @DisplayName("writes nothing when there is nothing to fix")
        void nothingToFix() {
            seedTidy();

            AutofixOutcome outcome = service.autofix("wf-1", true);

            assertFalse(outcome.applied());
            assertEquals(0, fixture.store.count("update:wf-1"));
        }
    }

    @Nested
    @DisplayName("format")
    class Format {

        @Test
        @DisplayName("previews positions without writing")
        void preview() {
            fixture.store.seed(connect(workflow("flow", node("trigger", MANUAL_TRIGGER), node("process", SET)), "trigger", "process"));

            FormatOutcome outcome = service.format("wf-1", false);

            assertFalse(outcome.applied());
            assertEquals(new Position(400, 240), outcome.workflow().findNode("process").orElseThrow().getPosition());
            assertEquals(Position.ORIGIN, fixture.store.stored("wf-1").findNode("process").orElseThrow().getPosition());
        }

        @Test
        @DisplayName("snapshots and writes positions when applied")
        void apply() {
            fixture.store.seed(connect(workflow("flow", node("trigger", MANUAL_TRIGGER), node("process", SET)), "trigger", "process"));

            FormatOutcome outcome = service.format("wf-1", true);

            assertTrue(outcome.applied());
            assertEquals(new Position(400, 240), fixture.store.stored("wf-1").findNode("process").orElseThrow().getPosition());
            assertEquals(WorkflowEditService.BEFORE_FORMAT, versions().get(0).reason());
        }
    }

    @Test
    @DisplayName("passes activation, deletion and listing through to the store")
    void passThrough() {
        seedTidy();

        assertTrue(service.activate("wf-1").isActive());
        assertEquals(1, service.list(true, null, null).data().size());
        assertFalse(service.deactivate("wf-1").isActive());
        service.delete("wf-1");

        assertThrows(WorkflowNotFoundException.class, () -> service.get("wf-1"));
    }
}
