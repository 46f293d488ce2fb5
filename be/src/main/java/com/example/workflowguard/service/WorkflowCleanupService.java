package com.example.workflowguard.service;

import com.example.workflowguard.autofix.AutofixEngine;
import com.example.workflowguard.autofix.AutofixResult;
import com.example.workflowguard.client.WorkflowStore;
import com.example.workflowguard.domain.AutofixAction;
import com.example.workflowguard.domain.ValidationWarning;
import com.example.workflowguard.domain.Workflow;
import com.example.workflowguard.layout.WorkflowFormatter;
import com.example.workflowguard.validation.ValidationResult;
import com.example.workflowguard.validation.WorkflowValidator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import tools.jackson.databind.json.JsonMapper;

import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs validate, auto-fix and format over a candidate workflow and writes the result back to the
 * store when it differs from what the store currently holds.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowCleanupService {

    private final WorkflowValidator validator;
    private final AutofixEngine autofixEngine;
    private final WorkflowFormatter formatter;
    private final WorkflowStore store;
    private final JsonMapper jsonMapper;

    /**
     * @param original  the workflow as currently stored
     * @param candidate the workflow to clean up; not modified
     */
    public CleanupResult cleanup(Workflow original, Workflow candidate) {
        ValidationResult validation = validator.validate(candidate);
        AutofixResult fixed = autofixEngine.autofix(candidate, validation.warnings());
        Workflow formatted = formatter.formatWorkflow(fixed.workflow());

        boolean valid = fixed.unfixable().stream().noneMatch(ValidationWarning::isError);
        List<String> autoFixed = fixed.fixes().stream().map(AutofixAction::description).toList();

        if (sameContent(original, formatted)) {
            log.debug("Cleanup left workflow id={} unchanged fixes={}", original.getId(), autoFixed.size());
            return new CleanupResult(formatted, valid, fixed.unfixable(), autoFixed, false);
        }
        Workflow stored = store.update(original.getId(), formatted);
        log.debug("Cleanup persisted workflow id={} fixes={} unfixable={}", original.getId(), autoFixed.size(), fixed.unfixable().size());
        return new CleanupResult(stored, valid, fixed.unfixable(), autoFixed, true);
    }

    private boolean sameContent(Workflow a, Workflow b) {
        return jsonMapper.valueToTree(a).equals(jsonMapper.valueToTree(b));
    }
}
