package com.example.workflowguard.service;

import com.example.workflowguard.domain.Workflow;
import com.example.workflowguard.validation.ValidationRules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static com.example.workflowguard.TestWorkflows.CODE;
import static com.example.workflowguard.TestWorkflows.MANUAL_TRIGGER;
import static com.example.workflowguard.TestWorkflows.SET;
import static com.example.workflowguard.TestWorkflows.connect;
import static com.example.workflowguard.TestWorkflows.node;
import static com.example.workflowguard.TestWorkflows.workflow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("WorkflowCleanupService")
class WorkflowCleanupServiceTest {

    @TempDir
    Path storageDir;

    private ServiceFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new ServiceFixture(storageDir);
    }

    @Test
    @DisplayName("writes nothing when cleanup leaves the stored workflow as it is")
    void unchanged() {
        Workflow tidy = fixture.formatter.formatWorkflow(
                connect(workflow("flow", node("trigger", MANUAL_TRIGGER), node("process", SET)), "trigger", "process"));
        fixture.store.seed(tidy);

        CleanupResult result = fixture.cleanupService.cleanup(tidy, tidy);

        assertFalse(result.persisted());
        assertTrue(result.valid());
        assertTrue(result.autoFixed().isEmpty());
        assertTrue(fixture.store.calls().isEmpty());
    }

    @Test
    @DisplayName("writes the fixed and formatted workflow and reports what it could not fix")
    void persists() {
        Workflow original = connect(workflow("Flow", node("trigger", MANUAL_TRIGGER), node("transform", CODE)),
                "trigger", "transform");
        fixture.store.seed(original);

        CleanupResult result = fixture.cleanupService.cleanup(original, original);

        assertTrue(result.persisted());
        assertTrue(result.valid());
        assertEquals(List.of("Renamed workflow to snake_case"), result.autoFixed());
        assertEquals(List.of(ValidationRules.CODE_NODE_USAGE), result.warnings().stream().map(w -> w.rule()).toList());
        assertEquals("flow", fixture.store.stored("wf-1").getName());
        assertEquals(List.of("update:wf-1"), fixture.store.calls());
    }
}
