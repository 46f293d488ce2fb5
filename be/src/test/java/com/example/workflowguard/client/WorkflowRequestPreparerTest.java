package com.example.workflowguard.client;

import com.example.workflowguard.domain.Workflow;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.workflowguard.TestWorkflows.MANUAL_TRIGGER;
import static com.example.workflowguard.TestWorkflows.SET;
import static com.example.workflowguard.TestWorkflows.connect;
import static com.example.workflowguard.TestWorkflows.jsonMapper;
import static com.example.workflowguard.TestWorkflows.node;
import static com.example.workflowguard.TestWorkflows.workflow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

@DisplayName("WorkflowRequestPreparer")
class WorkflowRequestPreparerTest {

    private final WorkflowRequestPreparer preparer = new WorkflowRequestPreparer(jsonMapper());

    @Test
    @DisplayName("sends only the writable fields")
    void writableFieldsOnly() {
        Workflow workflow = connect(workflow("flow", node("trigger", MANUAL_TRIGGER), node("process", SET)), "trigger", "process");
        workflow.setActive(true);
        workflow.setUpdatedAt("2026-03-01T10:00:00.000Z");
        workflow.setAdditionalProperty("tags", List.of());
        workflow.setAdditionalProperty(WorkflowRequestPreparer.STATIC_DATA, Map.of("lastId", 7));

        Map<String, Object> body = preparer.prepare(workflow);

        assertEquals(List.of("name", "nodes", "connections", "staticData"), List.copyOf(body.keySet()));
        assertEquals(Map.of("trigger", Map.of("main", List.of(List.of(
                Map.of("node", "process", "type", "main", "index", 0))))), body.get("connections"));
        assertEquals(2, ((List<?>) body.get("nodes")).size());
    }

    @Test
    @DisplayName("drops unknown settings and settings of the wrong kind")
    void filtersSettings() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("executionOrder", "v1");
        settings.put("timezone", "Europe/Berlin");
        settings.put("saveManualExecutions", "yes");
        settings.put("callerPolicy", "workflowsFromSameOwner");
        settings.put("saveDataErrorExecution", "sometimes");
        settings.put("binaryMode", "separate");
        settings.put("executionTimeout", 3600);

        Map<String, Object> filtered = WorkflowRequestPreparer.filterSettings(settings);

        assertEquals(List.of("executionOrder", "timezone", "callerPolicy", "executionTimeout"), List.copyOf(filtered.keySet()));
    }

    @Test
    @DisplayName("omits settings when the workflow has none")
    void noSettings() {
        assertFalse(preparer.prepare(workflow("flow")).containsKey("settings"));
    }
}
