package com.example.workflowguard.expression;

import com.example.workflowguard.domain.ExpressionIssue;
import com.example.workflowguard.domain.Node;
import com.example.workflowguard.domain.Severity;
import com.example.workflowguard.domain.Workflow;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code {{ ... }}} expressions in node parameters and checks them for common mistakes.
 * <p>
 * Extraction is pattern based: a template is the shortest {@code {{...}}} run on one line, and a
 * string starting with <code>={{</code> is also taken whole. Nested braces and brace characters inside
 * string literals are not understood and can produce false positives or misses.
 * </p>
 */
@Slf4j
public class ExpressionAnalyzer {

    private static final String EXPRESSION_PREFIX = "={{";
    private static final Pattern TEMPLATE = Pattern.compile("\\{\\{.*?\\}\\}");
    private static final Pattern NODE_REFERENCE = Pattern.compile("\\$\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)");
    private static final Pattern EXPLICIT_CALL = Pattern.compile("\\$\\(['\"]");
    private static final Pattern IMPLICIT_JSON = Pattern.compile("\\$json\\.");
    private static final Pattern INPUT_ACCESSOR = Pattern.compile("\\$input\\.");
    private static final Pattern DEPRECATED_NODE = Pattern.compile("\\$node\\.");
    private static final Pattern DEEP_JSON_CHAIN = Pattern.compile("\\.json\\.[a-zA-Z_]+\\.[a-zA-Z_]+");

    public List<ExpressionIssue> validateExpressions(Workflow workflow) {
        Set<String> nodeNames = workflow.nodeNames();
        List<ExpressionIssue> issues = new ArrayList<>();
        for (Node node : workflow.getNodes()) {
            for (Extracted extracted : extract(node.getParameters())) {
                check(node.getName(), extracted, nodeNames, issues);
            }
        }
        log.debug("Expression check workflow id={} issues={}", workflow.getId(), issues.size());
        return issues;
    }

    /**
     * Node name to the distinct node names its expressions reference via {@code $('name')}, in
     * first-seen order. Nodes without references are absent.
     */
    public Map<String, List<String>> getReferencedNodes(Workflow workflow) {
        Map<String, List<String>> references = new LinkedHashMap<>();
        for (Node node : workflow.getNodes()) {
            List<String> referenced = new ArrayList<>();
            for (Extracted extracted : extract(node.getParameters())) {
                Matcher m = NODE_REFERENCE.matcher(extracted.expression());
                while (m.find()) {
                    if (!referenced.contains(m.group(1))) {
                        referenced.add(m.group(1));
                    }
                }
            }
            if (!referenced.isEmpty()) {
                references.put(node.getName(), referenced);
            }
        }
        return references;
    }

    /**
     * Cycles in the cross-node reference graph, each as the node path closed by its repeated first node
     * (e.g. {@code [a, b, a]}). Cycles over the same nodes are reported once.
     */
    public List<List<String>> checkCircularReferences(Workflow workflow) {
        Map<String, List<String>> references = getReferencedNodes(workflow);
        List<List<String>> cycles = new ArrayList<>();
        for (String start : references.keySet()) {
            walk(start, new ArrayList<>(), references, cycles);
        }

        List<List<String>> unique = new ArrayList<>();
        Set<Set<String>> seen = new HashSet<>();
        for (List<String> cycle : cycles) {
            if (seen.add(new TreeSet<>(cycle))) {
                unique.add(cycle);
            }
        }
        return unique;
    }

    private void walk(String current, List<String> path, Map<String, List<String>> references, List<List<String>> cycles) {
        int first = path.indexOf(current);
        if (first >= 0) {
            List<String> cycle = new ArrayList<>(path.subList(first, path.size()));
            cycle.add(current);
            cycles.add(cycle);
            return;
        }
        path.add(current);
        for (String next : references.getOrDefault(current, List.of())) {
            walk(next, path, references, cycles);
        }
        path.remove(path.size() - 1);
    }

    private void check(String nodeName, Extracted extracted, Set<String> nodeNames, List<ExpressionIssue> issues) {
        String expression = extracted.expression();
        String inner = strip(expression);

        if (IMPLICIT_JSON.matcher(inner).find() && !EXPLICIT_CALL.matcher(inner).find()) {
            issues.add(issue(nodeName, extracted, "Uses $json instead of explicit node reference", Severity.WARNING,
                    "Use $('node_name').item.json.field instead"));
        }
        if (INPUT_ACCESSOR.matcher(inner).find()) {
            issues.add(issue(nodeName, extracted, "$input reference found - ensure this is intentional", Severity.INFO,
                    "Consider explicit $('node_name') for clarity"));
        }
        Matcher ref = NODE_REFERENCE.matcher(inner);
        while (ref.find()) {
            String referenced = ref.group(1);
            if (!nodeNames.contains(referenced)) {
                issues.add(issue(nodeName, extracted, "References non-existent node \"" + referenced + "\"", Severity.ERROR,
                        "Check if the node exists or was renamed"));
            }
        }
        if (expression.contains("{{") && !expression.contains("}}")) {
            issues.add(issue(nodeName, extracted, "Missing closing }}", Severity.ERROR, null));
        }
        if (count(inner, '(') != count(inner, ')')) {
            issues.add(issue(nodeName, extracted, "Unmatched parentheses", Severity.ERROR, null));
        }
        if (count(inner, '[') != count(inner, ']')) {
            issues.add(issue(nodeName, extracted, "Unmatched brackets", Severity.ERROR, null));
        }
        if (DEPRECATED_NODE.matcher(inner).find()) {
            issues.add(issue(nodeName, extracted, "$node is deprecated", Severity.WARNING, "Use $('node_name') instead"));
        }
        if (DEEP_JSON_CHAIN.matcher(inner).find() && !inner.contains("?.")) {
            issues.add(issue(nodeName, extracted, "Deep property access without optional chaining", Severity.INFO,
                    "Consider using ?. for safer access: obj?.nested?.field"));
        }
    }

    private static ExpressionIssue issue(String nodeName, Extracted extracted, String text, Severity severity, String suggestion) {
        return new ExpressionIssue(nodeName, extracted.path(), extracted.expression(), text, severity, suggestion);
    }

    static String strip(String expression) {
        if (expression.startsWith(EXPRESSION_PREFIX)) {
            String body = expression.substring(EXPRESSION_PREFIX.length()).trim();
            return body.endsWith("}}") ? body.substring(0, body.length() - 2).trim() : body;
        }
        if (expression.startsWith("{{") && expression.endsWith("}}") && expression.length() >= 4) {
            return expression.substring(2, expression.length() - 2).trim();
        }
        return expression;
    }

    private static int count(String text, char c) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }

    static List<Extracted> extract(Map<String, Object> parameters) {
        List<Extracted> found = new ArrayList<>();
        if (parameters != null) {
            parameters.forEach((key, value) -> collect(value, key, found));
        }
        return found;
    }

    private static void collect(Object value, String path, List<Extracted> found) {
        if (value instanceof String text) {
            Matcher m = TEMPLATE.matcher(text);
            while (m.find()) {
                found.add(new Extracted(path, m.group()));
            }
            if (text.startsWith(EXPRESSION_PREFIX)) {
                found.add(new Extracted(path, text));
            }
        } else if (value instanceof Map<?, ?> map) {
            map.forEach((key, nested) -> collect(nested, path + "." + key, found));
        } else if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                collect(list.get(i), path + "[" + i + "]", found);
            }
        }
    }

    record Extracted(String path, String expression) {
    }
}
