package com.example.workflowguard.autofix;

import com.example.workflowguard.domain.AutofixAction;
import com.example.workflowguard.domain.Node;
import com.example.workflowguard.domain.ValidationWarning;
import com.example.workflowguard.domain.Workflow;
import com.example.workflowguard.validation.ParameterText;
import com.example.workflowguard.validation.SnakeCase;
import com.example.workflowguard.validation.ValidationRules;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Repairs the violations that have a deterministic fix: snake_case names, implicit {@code $json}
 * references and missing structured-output flags. Every other warning is returned as unfixable.
 * <p>
 * Fixes are applied one warning at a time to a single copy, so a later fix sees the effect of an
 * earlier one (a reference fix after a rename binds to the new upstream name).
 * </p>
 */
@Slf4j
public class AutofixEngine {

    private static final Pattern TEMPLATE_REFERENCE = Pattern.compile("\\{\\{\\s*\\$json\\.");
    private static final Pattern PLAIN_REFERENCE = Pattern.compile("(?<!\\)\\.)\\$json\\.");
    private static final String NODE_REFERENCE = "\\$\\(\\s*(['\"])%s\\1\\s*\\)";

    private final ParameterText parameterText;

    public AutofixEngine(ParameterText parameterText) {
        this.parameterText = parameterText;
    }

    public AutofixResult autofix(Workflow workflow, List<ValidationWarning> warnings) {
        Workflow fixed = workflow.copy();
        List<AutofixAction> fixes = new ArrayList<>();
        List<ValidationWarning> unfixable = new ArrayList<>();
        // Warnings name nodes as they were before any rename in this pass.
        Map<String, String> renamed = new HashMap<>();

        for (ValidationWarning warning : warnings) {
            switch (warning.rule()) {
                case ValidationRules.SNAKE_CASE -> {
                    if (alreadyNormalized(fixed, warning)) {
                        continue;
                    }
                    collect(fixName(fixed, warning, renamed), warning, fixes, unfixable);
                }
                case ValidationRules.EXPLICIT_REFERENCE ->
                        collect(fixExplicitReference(fixed, find(fixed, warning, renamed)), warning, fixes, unfixable);
                case ValidationRules.AI_STRUCTURED_OUTPUT ->
                        collect(fixStructuredOutput(find(fixed, warning, renamed)), warning, fixes, unfixable);
                default -> unfixable.add(warning);
            }
        }
        log.debug("Autofix workflow id={} fixes={} unfixable={}", workflow.getId(), fixes.size(), unfixable.size());
        return new AutofixResult(fixed, fixes, unfixable);
    }

    private static void collect(Optional<AutofixAction> fix, ValidationWarning warning,
                                List<AutofixAction> fixes, List<ValidationWarning> unfixable) {
        if (fix.isPresent()) {
            fixes.add(fix.get());
        } else {
            unfixable.add(warning);
        }
    }

    private static boolean alreadyNormalized(Workflow workflow, ValidationWarning warning) {
        String current = warning.node() == null
                ? workflow.getName()
                : workflow.findNode(warning.node()).map(Node::getName).orElse(null);
        return current != null && SnakeCase.normalize(current).equals(current);
    }

    private static Optional<Node> find(Workflow workflow, ValidationWarning warning, Map<String, String> renamed) {
        if (warning.node() == null) {
            return Optional.empty();
        }
        return workflow.findNode(renamed.getOrDefault(warning.node(), warning.node()));
    }

    private Optional<AutofixAction> fixName(Workflow workflow, ValidationWarning warning, Map<String, String> renamed) {
        if (warning.node() == null) {
            String oldName = workflow.getName();
            String newName = SnakeCase.normalize(oldName);
            if (newName.isEmpty()) {
                return Optional.empty();
            }
            workflow.setName(newName);
            return Optional.of(new AutofixAction(AutofixAction.Type.RENAME, AutofixAction.WORKFLOW_TARGET,
                    "Renamed workflow to snake_case", oldName, newName));
        }

        Optional<Node> found = workflow.findNode(warning.node());
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Node node = found.get();
        String oldName = node.getName();
        String newName = SnakeCase.normalize(oldName);
        // Node names key the connection map and must stay unique.
        if (newName.isEmpty() || workflow.findNode(newName).isPresent()) {
            return Optional.empty();
        }
        node.setName(newName);
        renamed.put(oldName, newName);
        int rewritten = workflow.getConnections().renameNode(oldName, newName);
        int references = renameReferences(workflow, oldName, newName);
        log.debug("Renamed node {} -> {} rewrote {} connection entries and {} expression references",
                oldName, newName, rewritten, references);
        return Optional.of(new AutofixAction(AutofixAction.Type.RENAME, AutofixAction.nodeTarget(oldName),
                "Renamed node to snake_case", oldName, newName));
    }

    /**
     * Points every {@code $('old')} / {@code $("old")} in any node's parameters at the new name.
     */
    private static int renameReferences(Workflow workflow, String oldName, String newName) {
        Pattern reference = Pattern.compile(String.format(NODE_REFERENCE, Pattern.quote(oldName)));
        String replacement = "\\$($1" + Matcher.quoteReplacement(newName) + "$1)";
        int[] count = {0};
        for (Node node : workflow.getNodes()) {
            node.setParameters(rewriteStrings(node.getParameters(), reference, replacement, count));
        }
        return count[0];
    }

    @SuppressWarnings("unchecked")
    private static <T> T rewriteStrings(T value, Pattern pattern, String replacement, int[] count) {
        if (value instanceof String text) {
            Matcher matcher = pattern.matcher(text);
            if (!matcher.find()) {
                return value;
            }
            count[0]++;
            return (T) matcher.replaceAll(replacement);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> rewritten = new LinkedHashMap<>();
            map.forEach((k, v) -> rewritten.put(String.valueOf(k), rewriteStrings(v, pattern, replacement, count)));
            return (T) rewritten;
        }
        if (value instanceof List<?> list) {
            List<Object> rewritten = new ArrayList<>(list.size());
            for (Object item : list) {
                rewritten.add(rewriteStrings(item, pattern, replacement, count));
            }
            return (T) rewritten;
        }
        return value;
    }

    private Optional<AutofixAction> fixExplicitReference(Workflow workflow, Optional<Node> found) {
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Node node = found.get();
        Optional<String> upstream = workflow.getConnections().findFirstSourceOf(node.getName());
        if (upstream.isEmpty()) {
            return Optional.empty();
        }

        String explicit = "$('" + upstream.get() + "').item.json.";
        String replacement = Matcher.quoteReplacement(parameterText.escape(explicit));
        String before = parameterText.serialize(node.getParameters());
        String after = TEMPLATE_REFERENCE.matcher(before).replaceAll("{{ " + replacement);
        after = PLAIN_REFERENCE.matcher(after).replaceAll(replacement);
        if (after.equals(before)) {
            return Optional.empty();
        }
        node.setParameters(parameterText.parse(after));
        return Optional.of(new AutofixAction(AutofixAction.Type.EXPRESSION_FIX, AutofixAction.nodeTarget(node.getName()),
                "Changed $json to explicit $('" + upstream.get() + "') reference", "$json.", explicit));
    }

    private Optional<AutofixAction> fixStructuredOutput(Optional<Node> found) {
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Node node = found.get();
        Map<String, Object> parameters = node.getParameters();
        List<String> changes = new ArrayList<>();
        if (!ValidationRules.PROMPT_TYPE_DEFINE.equals(parameters.get(ValidationRules.PROMPT_TYPE))) {
            parameters.put(ValidationRules.PROMPT_TYPE, ValidationRules.PROMPT_TYPE_DEFINE);
            changes.add("promptType: \"define\"");
        }
        if (!Boolean.TRUE.equals(parameters.get(ValidationRules.HAS_OUTPUT_PARSER))) {
            parameters.put(ValidationRules.HAS_OUTPUT_PARSER, Boolean.TRUE);
            changes.add("hasOutputParser: true");
        }
        if (changes.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new AutofixAction(AutofixAction.Type.PARAMETER_FIX, AutofixAction.nodeTarget(node.getName()),
                "Added AI structured output settings: " + String.join(", ", changes), null, null));
    }
}
