package com.example.workflowguard.validation;

import com.example.workflowguard.domain.Node;
import com.example.workflowguard.domain.Severity;
import com.example.workflowguard.domain.ValidationWarning;
import com.example.workflowguard.domain.Workflow;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import static com.example.workflowguard.validation.ValidationRules.AI_NODE_TYPES;
import static com.example.workflowguard.validation.ValidationRules.CODE_NODE_TYPES;
import static com.example.workflowguard.validation.ValidationRules.EPHEMERAL_STORAGE_TYPES;
import static com.example.workflowguard.validation.ValidationRules.HAS_OUTPUT_PARSER;
import static com.example.workflowguard.validation.ValidationRules.OUTPUT_PARSER_KEYS;
import static com.example.workflowguard.validation.ValidationRules.PROMPT_TYPE;
import static com.example.workflowguard.validation.ValidationRules.PROMPT_TYPE_DEFINE;

/**
 * Static best-practice checks over a workflow graph and the text of its node parameters.
 * <p>
 * Every rule runs on every call and only reports; nothing is thrown for a rule violation. A result
 * is valid when no warning has {@link Severity#ERROR} severity.
 * </p>
 */
@Slf4j
public class WorkflowValidator {

    /** {@code $json.} not already part of an explicit {@code $('node').item} chain. */
    static final Pattern IMPLICIT_REFERENCE = Pattern.compile("(?<!\\)\\.)\\$json\\.");

    private static final List<Pattern> ID_PATTERNS = List.of(
            Pattern.compile("[\"']\\d{17,19}[\"']"),
            Pattern.compile("[\"'][0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}[\"']", Pattern.CASE_INSENSITIVE),
            Pattern.compile("[\"'][0-9a-f]{24}[\"']", Pattern.CASE_INSENSITIVE)
    );

    // Values starting with '=' or '{' are expressions, not literals.
    private static final List<Pattern> SECRET_PATTERNS = List.of(
            Pattern.compile("(?:api[_-]?key|secret|password)[\"']\\s*:\\s*[\"'](?![={])[^\"']{8,}[\"']", Pattern.CASE_INSENSITIVE),
            Pattern.compile("token[\"']\\s*:\\s*[\"'][a-z0-9]{20,}[\"']", Pattern.CASE_INSENSITIVE)
    );

    private final ParameterText parameterText;

    public WorkflowValidator(ParameterText parameterText) {
        this.parameterText = parameterText;
    }

    public ValidationResult validate(Workflow workflow) {
        List<ValidationWarning> warnings = new ArrayList<>();
        checkName(workflow.getName(), null, warnings);
        for (Node node : workflow.getNodes()) {
            checkNode(node, warnings);
        }
        checkConnectivity(workflow, warnings);
        ValidationResult result = ValidationResult.of(warnings);
        log.debug("Validated workflow id={} nodes={} warnings={} valid={}", workflow.getId(), workflow.getNodes().size(), warnings.size(), result.valid());
        return result;
    }

    /**
     * Checks a proposed full replacement of one node's parameters before it is sent.
     */
    public List<ValidationWarning> validatePartialUpdate(Workflow workflow, String nodeName, Map<String, Object> newParameters) {
        Node node = workflow.findNode(nodeName).orElse(null);
        if (node == null) {
            return List.of(new ValidationWarning(ValidationRules.NODE_EXISTS, Severity.ERROR, nodeName,
                    "Node \"" + nodeName + "\" not found in workflow", null));
        }
        List<String> dropped = droppedParameterKeys(node.getParameters(), newParameters);
        if (dropped.isEmpty()) {
            return List.of();
        }
        return List.of(new ValidationWarning(ValidationRules.PARAMETER_PRESERVATION, Severity.ERROR, nodeName,
                "Update will remove parameters: " + String.join(", ", dropped) + ". Include all existing parameters to preserve them.",
                "Include " + String.join(", ", dropped) + " in the new parameters"));
    }

    /**
     * Keys of {@code current} that {@code replacement} does not carry, in current order.
     */
    public static List<String> droppedParameterKeys(Map<String, Object> current, Map<String, Object> replacement) {
        List<String> dropped = new ArrayList<>();
        if (current == null) {
            return dropped;
        }
        for (String key : current.keySet()) {
            if (replacement == null || !replacement.containsKey(key)) {
                dropped.add(key);
            }
        }
        return dropped;
    }

    private void checkNode(Node node, List<ValidationWarning> warnings) {
        checkName(node.getName(), node.getName(), warnings);

        String text = parameterText.serialize(node.getParameters());
        if (IMPLICIT_REFERENCE.matcher(text).find()) {
            warnings.add(new ValidationWarning(ValidationRules.EXPLICIT_REFERENCE, Severity.WARNING, node.getName(),
                    "Node \"" + node.getName() + "\" uses $json - use explicit $('node_name').item.json.field instead",
                    "Reference the upstream node explicitly with $('node_name').item.json"));
        }
        if (anyMatch(ID_PATTERNS, text)) {
            warnings.add(new ValidationWarning(ValidationRules.NO_HARDCODED_IDS, Severity.INFO, node.getName(),
                    "Node \"" + node.getName() + "\" may contain hardcoded IDs - consider using config nodes or environment variables",
                    null));
        }
        if (anyMatch(SECRET_PATTERNS, text)) {
            warnings.add(new ValidationWarning(ValidationRules.NO_HARDCODED_SECRETS, Severity.INFO, node.getName(),
                    "Node \"" + node.getName() + "\" may contain hardcoded secrets",
                    "Use $env.VAR_NAME or a credential instead of a literal value"));
        }

        String type = node.getType() != null ? node.getType() : "";
        if (CODE_NODE_TYPES.contains(type)) {
            warnings.add(new ValidationWarning(ValidationRules.CODE_NODE_USAGE, Severity.INFO, node.getName(),
                    "Node \"" + node.getName() + "\" runs custom code - prefer built-in nodes where one exists",
                    null));
        }
        if (AI_NODE_TYPES.contains(type) && needsStructuredOutputFlags(node.getParameters())) {
            warnings.add(new ValidationWarning(ValidationRules.AI_STRUCTURED_OUTPUT, Severity.WARNING, node.getName(),
                    "Node \"" + node.getName() + "\" configures an output parser without promptType=\"define\" and hasOutputParser=true",
                    "Set promptType to \"define\" and hasOutputParser to true"));
        }
        if (EPHEMERAL_STORAGE_TYPES.contains(type)) {
            warnings.add(new ValidationWarning(ValidationRules.IN_MEMORY_STORAGE, Severity.WARNING, node.getName(),
                    "Node \"" + node.getName() + "\" keeps data in memory - it is lost on restart",
                    "Use a persistent memory or vector store"));
        }
    }

    /**
     * True when an output-parser parameter is present but the two companion flags are not both canonical.
     */
    public static boolean needsStructuredOutputFlags(Map<String, Object> parameters) {
        if (parameters == null || OUTPUT_PARSER_KEYS.stream().noneMatch(parameters::containsKey)) {
            return false;
        }
        return !(PROMPT_TYPE_DEFINE.equals(parameters.get(PROMPT_TYPE)) && Boolean.TRUE.equals(parameters.get(HAS_OUTPUT_PARSER)));
    }

    private void checkName(String name, String nodeName, List<ValidationWarning> warnings) {
        if (name == null || name.isBlank() || SnakeCase.isValid(name)) {
            return;
        }
        String suggestion = SnakeCase.normalize(name);
        String subject = nodeName != null ? "Node \"" + nodeName + "\"" : "Workflow name";
        warnings.add(new ValidationWarning(ValidationRules.SNAKE_CASE, Severity.WARNING, nodeName,
                subject + " should use snake_case naming: \"" + name + "\" -> \"" + suggestion + "\"",
                suggestion));
    }

    private void checkConnectivity(Workflow workflow, List<ValidationWarning> warnings) {
        Set<String> connected = workflow.getConnections().connectedNodeNames();
        for (Node node : workflow.getNodes()) {
            if (!ValidationRules.isTrigger(node.getType()) && !connected.contains(node.getName())) {
                warnings.add(new ValidationWarning(ValidationRules.ORPHAN_NODE, Severity.WARNING, node.getName(),
                        "Node \"" + node.getName() + "\" has no connections - may be orphaned",
                        null));
            }
        }
    }

    private static boolean anyMatch(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }
}
