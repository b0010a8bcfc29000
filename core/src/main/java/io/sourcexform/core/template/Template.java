package io.sourcexform.core.template;

import io.sourcexform.core.error.TemplateSyntaxException;
import io.sourcexform.core.model.Variant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parsed variant template. Syntax:
 * <ul>
 * <li>{@code ${variant}} the current variant token, {@code ${index}} its 1-based position</li>
 * <li>{@code ${name}} a named template looked up in the {@link TemplateScope} and rendered for the
 * same variant</li>
 * <li>{@code ${join 'SEP' BODY}} BODY rendered once per variant, joined with SEP; BODY ends at
 * the first unmatched <code>}</code></li>
 * <li>{@code $$} a literal {@code $}; any other {@code $} is literal too</li>
 * </ul>
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class Template {

    private static final Pattern NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_-]*");
    private static final String JOIN = "join ";
    private static final int MAX_DEPTH = 16;

    private final String source;
    private final List<Segment> segments;

    private Template(String source, List<Segment> segments) {
        this.source = source;
        this.segments = segments;
    }

    /**
     * @throws TemplateSyntaxException on an unterminated or malformed {@code ${...}}
     */
    public static Template parse(String source) {
        Objects.requireNonNull(source, "template source must not be null");
        return new Template(source, List.copyOf(new Parser(source).segments()));
    }

    public String source() {
        return source;
    }

    /**
     * Renders the template.
     *
     * @param scope   names and variants
     * @param current the variant being rendered, or {@code null} outside any variant context
     * @throws TemplateSyntaxException on unknown or recursive names, or {@code ${variant}} without
     *                                 a variant context
     */
    public String render(TemplateScope scope, Variant current) {
        StringBuilder out = new StringBuilder();
        render(scope, current, out, 0);
        return out.toString();
    }

    /** Renders and splits into lines; one trailing newline is dropped first. */
    public List<String> renderLines(TemplateScope scope, Variant current) {
        String text = render(scope, current);
        if (text.endsWith("\n")) {
            text = text.substring(0, text.length() - 1);
        }
        return Arrays.asList(text.split("\n", -1));
    }

    private void render(TemplateScope scope, Variant current, StringBuilder out, int depth) {
        if (depth > MAX_DEPTH) {
            throw new TemplateSyntaxException("Recursive name reference in template: " + source);
        }
        for (Segment segment : segments) {
            if (segment instanceof Literal literal) {
                out.append(literal.text());
            } else if (segment instanceof Reference reference) {
                renderReference(reference.name(), scope, current, out, depth);
            } else if (segment instanceof Join join) {
                List<String> parts = new ArrayList<>();
                for (Variant variant : scope.variants()) {
                    StringBuilder part = new StringBuilder();
                    join.body().render(scope, variant, part, depth + 1);
                    parts.add(part.toString());
                }
                out.append(String.join(join.separator(), parts));
            }
        }
    }

    private void renderReference(String name, TemplateScope scope, Variant current, StringBuilder out, int depth) {
        switch (name) {
            case "variant" -> out.append(requireVariant(name, current).token());
            case "index" -> out.append(requireVariant(name, current).index());
            default -> {
                Template named = scope.lookup(name)
                        .orElseThrow(() ->
                                new TemplateSyntaxException("Unknown name '" + name + "' in template: " + source));
                named.render(scope, current, out, depth + 1);
            }
        }
    }

    private Variant requireVariant(String name, Variant current) {
        if (current == null) {
            throw new TemplateSyntaxException(
                    "${" + name + "} used outside a variant context (wrap it in ${join ...}): " + source);
        }
        return current;
    }

    @Override
    public String toString() {
        return source;
    }

    private sealed interface Segment permits Literal, Reference, Join {}

    private record Literal(String text) implements Segment {}

    private record Reference(String name) implements Segment {}

    private record Join(String separator, Template body) implements Segment {}

    private static final class Parser {

        private final String src;
        private int pos;

        Parser(String src) {
            this.src = src;
        }

        List<Segment> segments() {
            List<Segment> segments = new ArrayList<>();
            StringBuilder literal = new StringBuilder();
            while (pos < src.length()) {
                char c = src.charAt(pos);
                if (c == '$' && pos + 1 < src.length() && src.charAt(pos + 1) == '$') {
                    literal.append('$');
                    pos += 2;
                } else if (c == '$' && pos + 1 < src.length() && src.charAt(pos + 1) == '{') {
                    if (literal.length() > 0) {
                        segments.add(new Literal(literal.toString()));
                        literal.setLength(0);
                    }
                    pos += 2;
                    segments.add(expression());
                } else {
                    literal.append(c);
                    pos++;
                }
            }
            if (literal.length() > 0) {
                segments.add(new Literal(literal.toString()));
            }
            return segments;
        }

        private Segment expression() {
            if (src.startsWith(JOIN, pos)) {
                pos += JOIN.length();
                return join();
            }
            int close = src.indexOf('}', pos);
            if (close < 0) {
                throw error("Unterminated ${");
            }
            String name = src.substring(pos, close).strip();
            if (!NAME.matcher(name).matches()) {
                throw error("Invalid name '" + name + "'");
            }
            pos = close + 1;
            return new Reference(name);
        }

        private Segment join() {
            skipSpaces();
            if (pos >= src.length() || src.charAt(pos) != '\'') {
                throw error("Expected quoted separator after 'join'");
            }
            int end = src.indexOf('\'', pos + 1);
            if (end < 0) {
                throw error("Unterminated join separator");
            }
            String separator = src.substring(pos + 1, end);
            pos = end + 1;
            if (pos < src.length() && src.charAt(pos) == ' ') {
                pos++;
            }
            int bodyStart = pos;
            int depth = 0;
            while (pos < src.length()) {
                char c = src.charAt(pos);
                if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    if (depth == 0) {
                        break;
                    }
                    depth--;
                }
                pos++;
            }
            if (pos >= src.length()) {
                throw error("Unterminated ${join");
            }
            String body = src.substring(bodyStart, pos);
            pos++;
            return new Join(separator, Template.parse(body));
        }

        private void skipSpaces() {
            while (pos < src.length() && src.charAt(pos) == ' ') {
                pos++;
            }
        }

        private TemplateSyntaxException error(String message) {
            return new TemplateSyntaxException(message + " at offset " + pos + " in template: " + src);
        }
    }
}
