package com.example.workflowguard.validation;

import com.example.workflowguard.domain.Node;
import com.example.workflowguard.domain.Severity;
import com.example.workflowguard.domain.ValidationWarning;
import com.example.workflowguard.domain.Workflow;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.example.workflowguard.TestWorkflows.AGENT;
import static com.example.workflowguard.TestWorkflows.CODE;
import static com.example.workflowguard.TestWorkflows.HTTP_REQUEST;
import static com.example.workflowguard.TestWorkflows.MANUAL_TRIGGER;
import static com.example.workflowguard.TestWorkflows.MEMORY_BUFFER;
import static com.example.workflowguard.TestWorkflows.SET;
import static com.example.workflowguard.TestWorkflows.WEBHOOK;
import static com.example.workflowguard.TestWorkflows.connect;
import static com.example.workflowguard.TestWorkflows.jsonMapper;
import static com.example.workflowguard.TestWorkflows.node;
import static com.example.workflowguard.TestWorkflows.params;
import static com.example.workflowguard.TestWorkflows.workflow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("WorkflowValidator")
class WorkflowValidatorTest {

    private final WorkflowValidator validator = new WorkflowValidator(new ParameterText(jsonMapper()));

    /** trigger → target, so neither node is an orphan. */
    private static Workflow wired(Node target) {
        Workflow workflow = workflow("checks", node("trigger", MANUAL_TRIGGER), target);
        return connect(workflow, "trigger", target.getName());
    }

    private List<ValidationWarning> warnings(Workflow workflow, String rule) {
        return validator.validate(workflow).warnings().stream().filter(w -> w.rule().equals(rule)).toList();
    }

    @Nested
    @DisplayName("naming")
    class Naming {

        @Test
        @DisplayName("flags workflow and node names that are not snake_case")
        void flagsBothNames() {
            Workflow workflow = workflow("My-Workflow", node("MyTrigger", WEBHOOK));

            ValidationResult result = validator.validate(workflow);

            assertEquals(2, result.warnings().size());
            assertTrue(result.valid());
            ValidationWarning workflowName = result.warnings().get(0);
            assertEquals(ValidationRules.SNAKE_CASE, workflowName.rule());
            assertNull(workflowName.node());
            assertEquals("Workflow name should use snake_case naming: \"My-Workflow\" -> \"my_workflow\"", workflowName.message());
            ValidationWarning nodeName = result.warnings().get(1);
            assertEquals("MyTrigger", nodeName.node());
            assertEquals("my_trigger", nodeName.suggestion());
            assertEquals(Severity.WARNING, nodeName.severity());
        }

        @Test
        @DisplayName("accepts lowercase names separated by spaces")
        void spacesAccepted() {
            assertTrue(warnings(wired(node("send email", SET)), ValidationRules.SNAKE_CASE).isEmpty());
        }
    }

    @Nested
    @DisplayName("parameter text rules")
    class ParameterRules {

        @Test
        @DisplayName("flags implicit $json access but not explicit references")
        void implicitReference() {
            assertEquals(1, warnings(wired(node("process", SET, params("value", "={{ $json.field }}"))),
                    ValidationRules.EXPLICIT_REFERENCE).size());
            assertTrue(warnings(wired(node("process", SET, params("value", "={{ $('trigger').item.json.field }}"))),
                    ValidationRules.EXPLICIT_REFERENCE).isEmpty());
        }

        @Test
        @DisplayName("reports one implicit reference warning per node")
        void oneWarningPerNode() {
            Node process = node("process", SET, params("a", "={{ $json.a }}", "b", "={{ $json.b }}"));
            assertEquals(1, warnings(wired(process), ValidationRules.EXPLICIT_REFERENCE).size());
        }

        @Test
        @DisplayName("flags hardcoded ids as info")
        void hardcodedIds() {
            List<ValidationWarning> found = warnings(wired(node("post", HTTP_REQUEST, params("channelId", "12345678901234567"))),
                    ValidationRules.NO_HARDCODED_IDS);
            assertEquals(1, found.size());
            assertEquals(Severity.INFO, found.get(0).severity());
            assertEquals(1, warnings(wired(node("post", HTTP_REQUEST, params("record", "507f1f77bcf86cd799439011"))),
                    ValidationRules.NO_HARDCODED_IDS).size());
        }

        @Test
        @DisplayName("flags literal secrets but not expressions")
        void hardcodedSecrets() {
            List<ValidationWarning> found = warnings(wired(node("post", HTTP_REQUEST, params("apiKey", "sk-live-abcdef123"))),
                    ValidationRules.NO_HARDCODED_SECRETS);
            assertEquals(1, found.size());
            assertEquals(Severity.INFO, found.get(0).severity());
            assertTrue(found.get(0).suggestion().contains("$env.VAR_NAME"));

            assertTrue(warnings(wired(node("post", HTTP_REQUEST, params("password", "={{ $env.PASSWORD }}"))),
                    ValidationRules.NO_HARDCODED_SECRETS).isEmpty());
            assertTrue(warnings(wired(node("post", HTTP_REQUEST, params("secret", "short"))),
                    ValidationRules.NO_HARDCODED_SECRETS).isEmpty());
        }
    }

    @Nested
    @DisplayName("node type rules")
    class TypeRules {

        @Test
        @DisplayName("flags code nodes as info")
        void codeNode() {
            List<ValidationWarning> found = warnings(wired(node("transform", CODE)), ValidationRules.CODE_NODE_USAGE);
            assertEquals(1, found.size());
            assertEquals(Severity.INFO, found.get(0).severity());
        }

        @Test
        @DisplayName("flags an AI node with an output parser but without the companion flags")
        void structuredOutput() {
            Node agent = node("summarize", AGENT, params("text", "Summarize", "hasOutputParser", false));
            List<ValidationWarning> found = warnings(wired(agent), ValidationRules.AI_STRUCTURED_OUTPUT);

            assertEquals(1, found.size());
            assertEquals("summarize", found.get(0).node());
        }

        @Test
        @DisplayName("accepts an AI node whose flags are already canonical")
        void structuredOutputCanonical() {
            Node agent = node("summarize", AGENT, params("promptType", "define", "hasOutputParser", true, "schemaType", "manual"));
            assertTrue(warnings(wired(agent), ValidationRules.AI_STRUCTURED_OUTPUT).isEmpty());
        }

        @Test
        @DisplayName("flags in-memory storage nodes")
        void inMemoryStorage() {
            assertEquals(1, warnings(wired(node("memory", MEMORY_BUFFER)), ValidationRules.IN_MEMORY_STORAGE).size());
        }

        @Test
        @DisplayName("tolerates a node without a type")
        void nullType() {
            Node untyped = node("untyped", null);
            assertTrue(validator.validate(wired(untyped)).warnings().isEmpty());
        }
    }

    @Nested
    @DisplayName("connectivity")
    class Connectivity {

        @Test
        @DisplayName("flags unconnected non-trigger nodes only")
        void orphans() {
            Workflow workflow = workflow("orphans", node("trigger", WEBHOOK), node("lonely", SET));

            List<ValidationWarning> found = warnings(workflow, ValidationRules.ORPHAN_NODE);

            assertEquals(1, found.size());
            assertEquals("Node \"lonely\" has no connections - may be orphaned", found.get(0).message());
        }
    }

    @Nested
    @DisplayName("validatePartialUpdate")
    class PartialUpdate {

        @Test
        @DisplayName("reports a missing node as an error")
        void missingNode() {
            List<ValidationWarning> found = validator.validatePartialUpdate(wired(node("process", SET)), "ghost", Map.of());

            assertEquals(1, found.size());
            assertEquals(ValidationRules.NODE_EXISTS, found.get(0).rule());
            assertTrue(found.get(0).isError());
        }

        @Test
        @DisplayName("lists parameters the replacement would drop")
        void droppedParameters() {
            Node process = node("process", SET, params("mode", "raw", "fields", List.of(), "options", Map.of()));
            List<ValidationWarning> found = validator.validatePartialUpdate(wired(process), "process", Map.of("mode", "manual"));

            assertEquals(1, found.size());
            assertEquals(ValidationRules.PARAMETER_PRESERVATION, found.get(0).rule());
            assertTrue(found.get(0).message().contains("fields, options"));
            assertFalse(ValidationResult.of(found).valid());
        }

        @Test
        @DisplayName("accepts a replacement that keeps every key")
        void keepsEverything() {
            Node process = node("process", SET, params("mode", "raw"));
            assertTrue(validator.validatePartialUpdate(wired(process), "process", Map.of("mode", "manual", "extra", 1)).isEmpty());
        }
    }
}
