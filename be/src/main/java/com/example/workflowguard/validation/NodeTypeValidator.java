package com.example.workflowguard.validation;

import com.example.workflowguard.domain.Node;
import com.example.workflowguard.domain.NodeTypeError;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Flags nodes whose type is not in a known-type set, with close matches as suggestions.
 */
public final class NodeTypeValidator {

    static final int MAX_SUGGESTIONS = 3;

    private NodeTypeValidator() {
    }

    public static List<NodeTypeError> validateNodeTypes(List<Node> nodes, Collection<String> knownTypes) {
        Set<String> known = new HashSet<>(knownTypes);
        List<NodeTypeError> errors = new ArrayList<>();
        for (Node node : nodes) {
            String type = node.getType();
            if (type != null && known.contains(type)) {
                continue;
            }
            List<String> suggestions = suggest(type, knownTypes);
            String message = "Unknown node type \"" + type + "\"" + (suggestions.isEmpty() ? "" : ". Did you mean: " + String.join(", ", suggestions) + "?");
            errors.add(new NodeTypeError(type, node.getName(), message, suggestions));
        }
        return errors;
    }

    /**
     * Up to {@link #MAX_SUGGESTIONS} known types, in the order given, whose unqualified name contains or is
     * contained in the unknown one, or lies within a small edit distance of it.
     */
    static List<String> suggest(String type, Collection<String> knownTypes) {
        List<String> suggestions = new ArrayList<>();
        String wanted = unqualified(type);
        if (wanted.isBlank()) {
            return suggestions;
        }
        for (String candidate : knownTypes) {
            String name = unqualified(candidate);
            if (name.isBlank()) {
                continue;
            }
            int threshold = Math.max(2, (int) Math.floor(0.2 * Math.max(wanted.length(), name.length())));
            if (name.contains(wanted) || wanted.contains(name) || levenshtein(wanted, name) <= threshold) {
                suggestions.add(candidate);
                if (suggestions.size() == MAX_SUGGESTIONS) {
                    break;
                }
            }
        }
        return suggestions;
    }

    private static String unqualified(String type) {
        if (type == null) {
            return "";
        }
        return type.substring(type.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
