package io.warden.engine;

import io.warden.util.Jsons;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{...}}} references in task inputs.
 *
 * <p>{@code {{name.output.field}}} reads a field of an upstream task's output when {@code name}
 * is a task of the playbook; any other reference is a dotted path into the run context. Only
 * tasks in the transitive {@code needs} of the resolving task may be referenced. A string
 * that is exactly one reference takes the referenced value with its type intact; references
 * embedded in longer text are rendered as text (maps and lists as compact JSON). Nested maps and
 * lists are resolved recursively. A reference that cannot be resolved fails the whole task.
 */
public final class InputResolver {
    private static final Pattern REFERENCE = Pattern.compile("\\{\\{\\s*([^{}]+?)\\s*}}");
    private static final String OUTPUT_SEGMENT = "output";

    public Map<String, Object> resolve(
            String taskName,
            Map<String, Object> inputs,
            Set<String> taskNames,
            Set<String> upstream,
            Map<String, Map<String, Object>> outputs,
            Map<String, Object> context
    ) {
        Scope scope = new Scope(taskName, taskNames, upstream, outputs, context == null ? Map.of() : context);
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : inputs.entrySet()) {
            resolved.put(e.getKey(), resolveValue(e.getValue(), scope));
        }
        return resolved;
    }

    private Object resolveValue(Object value, Scope scope) {
        if (value instanceof String text) {
            return resolveText(text, scope);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                out.put(String.valueOf(e.getKey()), resolveValue(e.getValue(), scope));
            }
            return out;
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(resolveValue(item, scope));
            }
            return out;
        }
        return value;
    }

    private Object resolveText(String text, Scope scope) {
        Matcher whole = REFERENCE.matcher(text);
        if (whole.matches()) {
            return lookup(whole.group(1).trim(), scope);
        }
        Matcher m = REFERENCE.matcher(text);
        StringBuilder sb = new StringBuilder();
        boolean any = false;
        while (m.find()) {
            any = true;
            Object value = lookup(m.group(1).trim(), scope);
            m.appendReplacement(sb, Matcher.quoteReplacement(render(value)));
        }
        if (!any) {
            return text;
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private Object lookup(String reference, Scope scope) {
        String[] path = reference.split("\\.");
        if (path.length >= 2 && OUTPUT_SEGMENT.equals(path[1]) && scope.taskNames().contains(path[0])) {
            if (!scope.upstream().contains(path[0])) {
                throw new UnresolvedReferenceException(scope.taskName(), reference,
                        "task '" + path[0] + "' is not a dependency");
            }
            Map<String, Object> output = scope.outputs().get(path[0]);
            if (output == null) {
                throw new UnresolvedReferenceException(scope.taskName(), reference,
                        "task '" + path[0] + "' has produced no output");
            }
            return walk(output, path, 2, reference, scope);
        }
        return walk(scope.context(), path, 0, reference, scope);
    }

    private Object walk(Object root, String[] path, int start, String reference, Scope scope) {
        Object current = root;
        for (int i = start; i < path.length; i++) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(path[i])) {
                throw new UnresolvedReferenceException(scope.taskName(), reference,
                        "no value at '" + path[i] + "'");
            }
            current = map.get(path[i]);
        }
        return current;
    }

    private String render(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            return Jsons.toCompactJson(value);
        }
        return String.valueOf(value);
    }

    private record Scope(
            String taskName,
            Set<String> taskNames,
            Set<String> upstream,
            Map<String, Map<String, Object>> outputs,
            Map<String, Object> context
    ) {
    }
}
