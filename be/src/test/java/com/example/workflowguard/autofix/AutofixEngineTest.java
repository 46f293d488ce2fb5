package com.example.workflowguard.autofix;

import com.example.workflowguard.domain.AutofixAction;
import com.example.workflowguard.domain.Node;
import com.example.workflowguard.domain.Severity;
import com.example.workflowguard.domain.ValidationWarning;
import com.example.workflowguard.domain.Workflow;
import com.example.workflowguard.expression.ExpressionAnalyzer;
import com.example.workflowguard.validation.ParameterText;
import com.example.workflowguard.validation.ValidationRules;
import com.example.workflowguard.validation.WorkflowValidator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.example.workflowguard.TestWorkflows.AGENT;
import static com.example.workflowguard.TestWorkflows.CODE;
import static com.example.workflowguard.TestWorkflows.MANUAL_TRIGGER;
import static com.example.workflowguard.TestWorkflows.SET;
import static com.example.workflowguard.TestWorkflows.WEBHOOK;
import static com.example.workflowguard.TestWorkflows.connect;
import static com.example.workflowguard.TestWorkflows.jsonMapper;
import static com.example.workflowguard.TestWorkflows.node;
import static com.example.workflowguard.TestWorkflows.params;
import static com.example.workflowguard.TestWorkflows.workflow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("AutofixEngine")
class AutofixEngineTest {

    private final ParameterText parameterText = new ParameterText(jsonMapper());
    private final WorkflowValidator validator = new WorkflowValidator(parameterText);
    private final AutofixEngine engine = new AutofixEngine(parameterText);
    private final ExpressionAnalyzer expressionAnalyzer = new ExpressionAnalyzer();

    private AutofixResult fix(Workflow workflow) {
        return engine.autofix(workflow, validator.validate(workflow).warnings());
    }

    private static Object parameter(Workflow workflow, String node, String key) {
        return workflow.findNode(node).orElseThrow().getParameters().get(key);
    }

    @Nested
    @DisplayName("renames")
    class Renames {

        @Test
        @DisplayName("normalizes workflow and node names and leaves nothing unfixable")
        void namesNormalized() {
            Workflow workflow = workflow("My-Workflow", node("MyTrigger", WEBHOOK));

            AutofixResult result = fix(workflow);

            assertEquals("my_workflow", result.workflow().getName());
            assertEquals("my_trigger", result.workflow().getNodes().get(0).getName());
            assertEquals(2, result.fixes().size());
            assertTrue(result.fixes().stream().allMatch(f -> f.type() == AutofixAction.Type.RENAME));
            assertEquals(AutofixAction.WORKFLOW_TARGET, result.fixes().get(0).target());
            assertEquals("node:MyTrigger", result.fixes().get(1).target());
            assertTrue(result.unfixable().isEmpty());
        }

        @Test
        @DisplayName("rewrites connection keys and targets for a renamed node")
        void connectionsFollowRename() {
            Workflow workflow = connect(connect(workflow("flow", node("trigger", MANUAL_TRIGGER), node("SetFields", SET),
                    node("done", SET)), "trigger", "SetFields"), "SetFields", "done");

            AutofixResult result = fix(workflow);

            assertEquals(List.of("trigger", "set_fields"), result.workflow().getConnections().edges().stream()
                    .map(e -> e.source()).toList());
            assertEquals(List.of("set_fields", "done"), result.workflow().getConnections().edges().stream()
                    .map(e -> e.target()).toList());
            assertEquals(workflow.getConnections().targetCount(), result.workflow().getConnections().targetCount());
        }

        @Test
        @DisplayName("refuses a rename that would collide with an existing node")
        void collision() {
            Workflow workflow = connect(workflow("flow", node("my_node", WEBHOOK), node("MyNode", SET)), "my_node", "MyNode");

            AutofixResult result = fix(workflow);

            assertTrue(result.fixes().isEmpty());
            assertEquals(1, result.unfixable().size());
            assertEquals(ValidationRules.SNAKE_CASE, result.unfixable().get(0).rule());
            assertEquals(List.of("my_node", "MyNode"), List.copyOf(result.workflow().nodeNames()));
        }

        @Test
        @DisplayName("points $('old') references in other nodes at the new name")
        void referencesFollowRename() {
            Map<String, Object> nested = params("ref", "{{ $(\"MyTrigger\").item.json.id }}");
            Workflow workflow = connect(workflow("flow", node("MyTrigger", WEBHOOK),
                    node("process", SET, params(
                            "value", "={{ $('MyTrigger').item.json.name }}",
                            "other", "={{ $('MyTriggerCopy').item.json.name }}",
                            "items", List.of(nested)))), "MyTrigger", "process");

            AutofixResult result = fix(workflow);

            assertEquals("={{ $('my_trigger').item.json.name }}", parameter(result.workflow(), "process", "value"));
            assertEquals("={{ $('MyTriggerCopy').item.json.name }}", parameter(result.workflow(), "process", "other"));
            assertEquals(List.of(Map.of("ref", "{{ $(\"my_trigger\").item.json.id }}")),
                    parameter(result.workflow(), "process", "items"));
            assertTrue(expressionAnalyzer.validateExpressions(result.workflow()).stream()
                    .noneMatch(i -> i.issue().contains("\"MyTrigger\"") || i.issue().contains("\"my_trigger\"")));
        }

        @Test
        @DisplayName("skips a name that normalizes to itself without reporting it")
        void alreadyNormalized() {
            Workflow workflow = connect(workflow("flow", node("trigger", MANUAL_TRIGGER), node("1abc", SET)), "trigger", "1abc");
            assertTrue(validator.validate(workflow).warnings().stream()
                    .anyMatch(w -> w.rule().equals(ValidationRules.SNAKE_CASE)));

            AutofixResult result = fix(workflow);

            assertTrue(result.fixes().isEmpty());
            assertTrue(result.unfixable().isEmpty());
            assertEquals(List.of("trigger", "1abc"), List.copyOf(result.workflow().nodeNames()));
        }
    }

    @Nested
    @DisplayName("explicit references")
    class References {

        @Test
        @DisplayName("binds $json to the first upstream node")
        void bindsUpstream() {
            Workflow workflow = connect(workflow("flow", node("trigger", MANUAL_TRIGGER),
                    node("process", SET, params("value", "={{ $json.field }}"))), "trigger", "process");

            AutofixResult result = fix(workflow);

            assertEquals("={{ $('trigger').item.json.field }}", parameter(result.workflow(), "process", "value"));
            AutofixAction action = result.fixes().get(0);
            assertEquals(AutofixAction.Type.EXPRESSION_FIX, action.type());
            assertEquals("node:process", action.target());
            assertEquals("$json.", action.before());
            assertEquals("$('trigger').item.json.", action.after());
        }

        @Test
        @DisplayName("uses the new name of an upstream node renamed earlier in the pass")
        void upstreamRenamedFirst() {
            Workflow workflow = connect(workflow("flow", node("MyTrigger", MANUAL_TRIGGER),
                    node("process", SET, params("value", "={{ $json.field }}"))), "MyTrigger", "process");

            AutofixResult result = fix(workflow);

            assertEquals("={{ $('my_trigger').item.json.field }}", parameter(result.workflow(), "process", "value"));
            assertTrue(result.unfixable().isEmpty());
        }

        @Test
        @DisplayName("finds a node renamed earlier in the pass")
        void nodeRenamedFirst() {
            Workflow workflow = connect(workflow("flow", node("trigger", MANUAL_TRIGGER),
                    node("ProcessItems", SET, params("value", "={{ $json.field }}"))), "trigger", "ProcessItems");

            AutofixResult result = fix(workflow);

            assertEquals("={{ $('trigger').item.json.field }}", parameter(result.workflow(), "process_items", "value"));
            assertEquals("node:process_items", result.fixes().get(1).target());
            assertTrue(result.unfixable().isEmpty());
        }

        @Test
        @DisplayName("leaves a reference unfixable when the node has no upstream")
        void noUpstream() {
            Workflow workflow = workflow("flow", node("process", SET, params("value", "={{ $json.field }}")));

            AutofixResult result = fix(workflow);

            assertEquals("={{ $json.field }}", parameter(result.workflow(), "process", "value"));
            assertTrue(result.unfixable().stream().anyMatch(w -> w.rule().equals(ValidationRules.EXPLICIT_REFERENCE)));
        }
    }

    @Nested
    @DisplayName("structured output")
    class StructuredOutput {

        @Test
        @DisplayName("sets promptType and hasOutputParser on an AI node")
        void setsFlags() {
            Workflow workflow = connect(workflow("flow", node("trigger", MANUAL_TRIGGER),
                    node("summarize", AGENT, params("text", "Summarize", "hasOutputParser", false))), "trigger", "summarize");

            AutofixResult result = fix(workflow);

            assertEquals("define", parameter(result.workflow(), "summarize", "promptType"));
            assertEquals(Boolean.TRUE, parameter(result.workflow(), "summarize", "hasOutputParser"));
            assertEquals("Summarize", parameter(result.workflow(), "summarize", "text"));
            assertEquals(AutofixAction.Type.PARAMETER_FIX, result.fixes().get(0).type());
            assertEquals("Added AI structured output settings: promptType: \"define\", hasOutputParser: true",
                    result.fixes().get(0).description());
        }

        @Test
        @DisplayName("sets the flags for a supplied warning even without an output parser key")
        void suppliedWarning() {
            Workflow workflow = workflow("flow", node("summarize", AGENT, params("text", "hi")));

            AutofixResult result = engine.autofix(workflow, List.of(structuredOutputWarning("summarize")));

            assertEquals(1, result.fixes().size());
            assertTrue(result.unfixable().isEmpty());
            assertEquals(Map.of("text", "hi", "promptType", "define", "hasOutputParser", true),
                    result.workflow().findNode("summarize").orElseThrow().getParameters());
        }

        @Test
        @DisplayName("reports the warning unfixable when both flags are already set")
        void alreadyCanonical() {
            Workflow workflow = workflow("flow", node("summarize", AGENT,
                    params("text", "hi", "promptType", "define", "hasOutputParser", true)));
            ValidationWarning warning = structuredOutputWarning("summarize");

            AutofixResult result = engine.autofix(workflow, List.of(warning));

            assertTrue(result.fixes().isEmpty());
            assertEquals(List.of(warning), result.unfixable());
        }

        private ValidationWarning structuredOutputWarning(String node) {
            return new ValidationWarning(ValidationRules.AI_STRUCTURED_OUTPUT, Severity.WARNING, node,
                    "Node \"" + node + "\" needs structured output settings", null);
        }
    }

    @Test
    @DisplayName("passes warnings without a fix through as unfixable")
    void unfixableRules() {
        Workflow workflow = workflow("flow", node("trigger", MANUAL_TRIGGER), node("transform", CODE));

        AutofixResult result = fix(workflow);

        assertTrue(result.fixes().isEmpty());
        List<String> rules = result.unfixable().stream().map(ValidationWarning::rule).toList();
        assertEquals(List.of(ValidationRules.CODE_NODE_USAGE, ValidationRules.ORPHAN_NODE), rules);
    }

    @Test
    @DisplayName("does not modify its input")
    void inputUntouched() {
        Node process = node("ProcessItems", SET, params("value", "={{ $json.field }}"));
        Workflow workflow = connect(workflow("My-Workflow", node("trigger", MANUAL_TRIGGER), process), "trigger", "ProcessItems");

        fix(workflow);

        assertEquals("My-Workflow", workflow.getName());
        assertEquals("ProcessItems", process.getName());
        assertEquals("={{ $json.field }}", process.getParameters().get("value"));
        assertEquals("ProcessItems", workflow.getConnections().edges().get(0).target());
    }
}
