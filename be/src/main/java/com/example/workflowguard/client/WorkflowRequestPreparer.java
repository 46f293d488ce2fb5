package com.example.workflowguard.client;

import com.example.workflowguard.domain.Workflow;

import lombok.extern.slf4j.Slf4j;

import tools.jackson.databind.json.JsonMapper;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Shapes a workflow into a create/update request body the remote store accepts.
 * <p>
 * Only {@code name, nodes, connections, settings, staticData} are sent. The store rejects unknown
 * settings, so settings keys outside the known set, and known keys whose value has the wrong JSON
 * kind, are dropped (logged at debug) instead of failing the request.
 * </p>
 */
@Slf4j
public class WorkflowRequestPreparer {

    static final String STATIC_DATA = "staticData";

    private static final Predicate<Object> BOOLEAN = Boolean.class::isInstance;
    private static final Predicate<Object> NUMBER = Number.class::isInstance;
    private static final Predicate<Object> STRING = String.class::isInstance;

    private static final Map<String, Predicate<Object>> KNOWN_SETTINGS = Map.ofEntries(
            Map.entry("saveExecutionProgress", BOOLEAN),
            Map.entry("saveManualExecutions", BOOLEAN),
            Map.entry("saveDataErrorExecution", oneOf(Set.of("all", "none"))),
            Map.entry("saveDataSuccessExecution", oneOf(Set.of("all", "none"))),
            Map.entry("executionTimeout", NUMBER),
            Map.entry("errorWorkflow", STRING),
            Map.entry("timezone", STRING),
            Map.entry("executionOrder", STRING),
            Map.entry("callerPolicy", oneOf(Set.of("any", "none", "workflowsFromAList", "workflowsFromSameOwner"))),
            Map.entry("callerIds", STRING),
            Map.entry("timeSavedPerExecution", NUMBER),
            Map.entry("availableInMCP", BOOLEAN)
    );

    private final JsonMapper jsonMapper;

    public WorkflowRequestPreparer(JsonMapper jsonMapper) {
        this.jsonMapper = jsonMapper;
    }

    public Map<String, Object> prepare(Workflow workflow) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (workflow.getName() != null) {
            body.put("name", workflow.getName());
        }
        body.put("nodes", jsonMapper.convertValue(workflow.getNodes(), Object.class));
        body.put("connections", jsonMapper.convertValue(workflow.getConnections(), Object.class));
        if (workflow.getSettings() != null) {
            body.put("settings", filterSettings(workflow.getSettings()));
        }
        Object staticData = workflow.getAdditionalProperties().get(STATIC_DATA);
        if (staticData != null) {
            body.put(STATIC_DATA, staticData);
        }
        return body;
    }

    static Map<String, Object> filterSettings(Map<String, Object> settings) {
        Map<String, Object> filtered = new LinkedHashMap<>();
        settings.forEach((key, value) -> {
            Predicate<Object> accepts = KNOWN_SETTINGS.get(key);
            if (accepts == null) {
                log.debug("Dropping unknown workflow setting {}", key);
            } else if (value == null || !accepts.test(value)) {
                log.debug("Dropping workflow setting {} with unexpected value type", key);
            } else {
                filtered.put(key, value);
            }
        });
        return filtered;
    }

    private static Predicate<Object> oneOf(Set<String> values) {
        return value -> value instanceof String s && values.contains(s);
    }
}
