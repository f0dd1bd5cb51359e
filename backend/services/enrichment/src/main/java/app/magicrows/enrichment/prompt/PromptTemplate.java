package app.magicrows.enrichment.prompt;

import app.magicrows.enrichment.error.TemplateException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Compiled prompt template. Supports {@code {{ name }}} substitution and
 * {@code {{#name}}...{{/name}}} / {@code {{^name}}...{{/name}}} sections. Every referenced
 * variable must be present in the render context, even when its value is {@code null}.
 */
public final class PromptTemplate {

    private static final Pattern TAG_PATTERN = Pattern.compile("\\{\\{(.*?)}}", Pattern.DOTALL);
    private static final Pattern NAME_PATTERN = Pattern.compile("[\\p{L}\\p{N}_][\\p{L}\\p{N}_ .-]*");

    private final List<Node> nodes;

    private PromptTemplate(List<Node> nodes) {
        this.nodes = nodes;
    }

    public static PromptTemplate compile(String source) {
        if (source == null) {
            throw new TemplateException("Template source is null");
        }
        Deque<Section> open = new ArrayDeque<>();
        List<Node> root = new ArrayList<>();
        Matcher matcher = TAG_PATTERN.matcher(source);
        int cursor = 0;
        while (matcher.find()) {
            appendText(source.substring(cursor, matcher.start()), target(root, open));
            cursor = matcher.end();
            String tag = matcher.group(1).trim();
            if (tag.isEmpty()) {
                throw new TemplateException("Empty tag at offset " + matcher.start());
            }
            char marker = tag.charAt(0);
            if (marker == '#' || marker == '^') {
                String name = requireName(tag.substring(1).trim(), matcher.start());
                Section section = new Section(name, marker == '^', new ArrayList<>());
                target(root, open).add(section);
                open.push(section);
            } else if (marker == '/') {
                String name = requireName(tag.substring(1).trim(), matcher.start());
                if (open.isEmpty()) {
                    throw new TemplateException("Closing tag {{/" + name + "}} has no matching section");
                }
                Section section = open.pop();
                if (!section.name().equals(name)) {
                    throw new TemplateException("Section {{#" + section.name() + "}} closed by {{/" + name + "}}");
                }
            } else {
                target(root, open).add(new Variable(requireName(tag, matcher.start())));
            }
        }
        appendText(source.substring(cursor), target(root, open));
        if (!open.isEmpty()) {
            throw new TemplateException("Section {{#" + open.peek().name() + "}} is never closed");
        }
        return new PromptTemplate(List.copyOf(root));
    }

    public String render(Map<String, ?> context) {
        StringBuilder out = new StringBuilder();
        renderNodes(nodes, context, out);
        return out.toString();
    }

    private static void renderNodes(List<Node> nodes, Map<String, ?> context, StringBuilder out) {
        for (Node node : nodes) {
            if (node instanceof Text text) {
                out.append(text.value());
            } else if (node instanceof Variable variable) {
                out.append(stringify(lookup(context, variable.name())));
            } else if (node instanceof Section section) {
                boolean truthy = isTruthy(lookup(context, section.name()));
                if (truthy != section.inverted()) {
                    renderNodes(section.children(), context, out);
                }
            }
        }
    }

    private static Object lookup(Map<String, ?> context, String name) {
        if (context == null || !context.containsKey(name)) {
            throw new TemplateException("Undefined variable '" + name + "'");
        }
        return context.get(name);
    }

    private static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().map(PromptTemplate::stringify).collect(Collectors.joining(", "));
        }
        return value.toString();
    }

    private static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof CharSequence text) {
            return !text.toString().isBlank();
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        return true;
    }

    private static String requireName(String name, int offset) {
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new TemplateException("Invalid variable name '" + name + "' at offset " + offset);
        }
        return name.trim();
    }

    private static void appendText(String text, List<Node> target) {
        if (text.isEmpty()) {
            return;
        }
        int stray = text.indexOf("{{");
        if (stray >= 0) {
            throw new TemplateException("Unterminated tag near '" + abbreviate(text.substring(stray)) + "'");
        }
        target.add(new Text(text));
    }

    private static List<Node> target(List<Node> root, Deque<Section> open) {
        return open.isEmpty() ? root : open.peek().children();
    }

    private static String abbreviate(String text) {
        return text.length() <= 30 ? text : text.substring(0, 30) + "...";
    }

    private sealed interface Node permits Text, Variable, Section {
    }

    private record Text(String value) implements Node {
    }

    private record Variable(String name) implements Node {
    }

    private record Section(String name, boolean inverted, List<Node> children) implements Node {
    }
}
