package com.keystone.core.worker;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code {{variable}}} interpolation for worker task contexts.
 */
public final class ContextTemplate {

    private static final Pattern VARIABLE = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_]+)\\s*}}");
    private static final Pattern UNCLOSED = Pattern.compile("\\{\\{[^}]*$|\\{\\{[^}]*\\{\\{");

    public static final String DEFAULT = """
            Workflow {{workflow_id}}, step {{step_id}} as {{role}}.
            Task ({{task_type}}/{{complexity}}): {{task}}
            Files: {{files}}
            """;

    private ContextTemplate() {}

    /**
     * Replaces every known variable; unknown variables are left in place for {@link #unresolved}.
     *
     * @throws IllegalArgumentException if the template has an unclosed {@code {{}
     */
    public static String render(String template, Map<String, String> variables) {
        if (UNCLOSED.matcher(template).find()) {
            throw new IllegalArgumentException("Unclosed template variable in: " + template);
        }
        Matcher m = VARIABLE.matcher(template);
        var out = new StringBuilder();
        while (m.find()) {
            String value = variables.get(m.group(1));
            m.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : m.group()));
        }
        m.appendTail(out);
        return out.toString();
    }

    /** Variables still present in {@code text}, in order of first appearance. */
    public static List<String> unresolved(String text) {
        var names = new LinkedHashSet<String>();
        Matcher m = VARIABLE.matcher(text);
        while (m.find()) {
            names.add(m.group(1));
        }
        return List.copyOf(names);
    }
}
