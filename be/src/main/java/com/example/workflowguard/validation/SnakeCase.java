package com.example.workflowguard.validation;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * snake_case naming check and normalization for workflow and node names.
 */
public final class SnakeCase {

    private static final Pattern SNAKE_CASE = Pattern.compile("^[a-z][a-z0-9_]*$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LOWER_UPPER = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])");
    private static final Pattern ACRONYM_END = Pattern.compile("(?<=[A-Z])(?=[A-Z][a-z])");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");

    private SnakeCase() {
    }

    /**
     * True if the name is snake_case as written, or becomes snake_case once whitespace runs are
     * read as underscores ("send email" passes, "SendEmail" and "send-email" do not).
     */
    public static boolean isValid(String name) {
        if (name == null) {
            return false;
        }
        return SNAKE_CASE.matcher(name).matches()
                || SNAKE_CASE.matcher(WHITESPACE.matcher(name.trim()).replaceAll("_")).matches();
    }

    /**
     * "My-Workflow" → "my_workflow", "sendHTTPRequest" → "send_http_request". Idempotent.
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String split = LOWER_UPPER.matcher(name).replaceAll("_");
        split = ACRONYM_END.matcher(split).replaceAll("_");
        String lowered = NON_ALNUM.matcher(split.toLowerCase(Locale.ROOT)).replaceAll("_");
        int start = 0;
        int end = lowered.length();
        while (start < end && lowered.charAt(start) == '_') {
            start++;
        }
        while (end > start && lowered.charAt(end - 1) == '_') {
            end--;
        }
        return lowered.substring(start, end);
    }
}
