package com.example.workflowguard.validation;

import java.util.List;
import java.util.Set;

/**
 * Rule ids and the node-type allow-lists the rules match against.
 */
public final class ValidationRules {

    public static final String SNAKE_CASE = "snake_case";
    public static final String EXPLICIT_REFERENCE = "explicit_reference";
    public static final String NO_HARDCODED_IDS = "no_hardcoded_ids";
    public static final String NO_HARDCODED_SECRETS = "no_hardcoded_secrets";
    public static final String CODE_NODE_USAGE = "code_node_usage";
    public static final String AI_STRUCTURED_OUTPUT = "ai_structured_output";
    public static final String IN_MEMORY_STORAGE = "in_memory_storage";
    public static final String ORPHAN_NODE = "orphan_node";
    public static final String NODE_EXISTS = "node_exists";
    public static final String PARAMETER_PRESERVATION = "parameter_preservation";

    public static final Set<String> CODE_NODE_TYPES = Set.of(
            "n8n-nodes-base.code",
            "n8n-nodes-base.function",
            "n8n-nodes-base.functionItem",
            "@n8n/n8n-nodes-langchain.code"
    );

    public static final Set<String> AI_NODE_TYPES = Set.of(
            "@n8n/n8n-nodes-langchain.agent",
            "@n8n/n8n-nodes-langchain.chainLlm",
            "@n8n/n8n-nodes-langchain.openAi"
    );

    /** Parameters whose presence means the node is expected to produce structured output. */
    public static final List<String> OUTPUT_PARSER_KEYS = List.of(
            "outputParser",
            "hasOutputParser",
            "schemaType",
            "jsonSchemaExample",
            "inputSchema"
    );

    public static final String PROMPT_TYPE = "promptType";
    public static final String PROMPT_TYPE_DEFINE = "define";
    public static final String HAS_OUTPUT_PARSER = "hasOutputParser";

    public static final Set<String> EPHEMERAL_STORAGE_TYPES = Set.of(
            "@n8n/n8n-nodes-langchain.memoryBufferWindow",
            "@n8n/n8n-nodes-langchain.memoryBuffer",
            "@n8n/n8n-nodes-langchain.vectorStoreInMemory",
            "@n8n/n8n-nodes-langchain.vectorStoreInMemoryInsert",
            "@n8n/n8n-nodes-langchain.vectorStoreInMemoryLoad"
    );

    /** Matched against the type with {@code contains}; triggers have no inbound edge. */
    public static final List<String> TRIGGER_MARKERS = List.of(
            "webhook",
            "scheduleTrigger",
            "manualTrigger",
            "emailTrigger",
            "chatTrigger",
            "formTrigger",
            "errorTrigger",
            "executeWorkflowTrigger",
            "cron",
            "interval"
    );

    private ValidationRules() {
    }

    public static boolean isTrigger(String nodeType) {
        if (nodeType == null) {
            return false;
        }
        for (String marker : TRIGGER_MARKERS) {
            if (nodeType.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
