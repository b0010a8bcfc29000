package io.sourcexform.core.rule;

import io.sourcexform.core.buffer.SourceBuffer;
import io.sourcexform.core.error.TemplateSyntaxException;
import io.sourcexform.core.model.Variant;
import io.sourcexform.core.scan.Anchor;
import io.sourcexform.core.scan.MatchMode;
import io.sourcexform.core.scan.Region;
import io.sourcexform.core.spi.RuleContext;
import io.sourcexform.core.template.Template;
import io.sourcexform.core.template.TemplateScope;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves placeholder values left for not-yet-implemented variants. A line holding a variant's
 * key, followed by the placeholder literal and the marker annotation, has everything from the
 * placeholder to end of line replaced by that variant's replacement.
 *
 * <pre>
 * Scope1TonsCO2e: 0, // TODO: Implement Scope 1   becomes   Scope1TonsCO2e: scope1Total,
 * </pre>
 */
public final class PlaceholderRule extends AnchoredRule {

    public static final String TYPE = "placeholder";

    private final String placeholder;
    private final String marker;
    private final List<String> keys;
    private final List<String> replacements;

    /**
     * @param key         rendered per variant, located in the line
     * @param placeholder literal that must follow the key
     * @param marker      literal annotation that must follow the placeholder, or {@code null}
     * @param replacement rendered per variant, replaces placeholder and marker
     */
    public PlaceholderRule(
            String name,
            Template key,
            String placeholder,
            String marker,
            Template replacement,
            TemplateScope scope) {
        this(name, renderAll(key, scope), placeholder, marker, renderAll(replacement, scope));
    }

    private PlaceholderRule(
            String name, List<String> keys, String placeholder, String marker, List<String> replacements) {
        super(name, new Anchor(keys, MatchMode.CONTAINS));
        if (placeholder == null || placeholder.isEmpty()) {
            throw new IllegalArgumentException("placeholder must not be empty");
        }
        this.placeholder = placeholder;
        this.marker = marker == null || marker.isEmpty() ? null : marker;
        this.keys = keys;
        this.replacements = replacements;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Set<String> introducedNames() {
        return Set.of();
    }

    @Override
    public List<String> renderedText() {
        return replacements;
    }

    @Override
    protected Region bound(SourceBuffer buffer, int anchorLine, RuleContext context) {
        return new Region(anchorLine, anchorLine);
    }

    @Override
    protected boolean alreadyApplied(SourceBuffer buffer, int anchorLine, Region span, RuleContext context) {
        String text = buffer.text(anchorLine);
        int v = variantAt(text);
        return afterKey(text, v).stripLeading().startsWith(replacements.get(v));
    }

    @Override
    protected Step transform(SourceBuffer buffer, int anchorLine, Region span, RuleContext context) {
        String text = buffer.text(anchorLine);
        int v = variantAt(text);
        String tail = afterKey(text, v);
        String value = tail.stripLeading();
        boolean pending = value.startsWith(placeholder)
                && endsAtBoundary(value)
                && (marker == null || value.substring(placeholder.length()).contains(marker));
        if (!pending) {
            return Step.skipped(anchorLine + 1, "no placeholder after " + keys.get(v));
        }
        int keyEnd = text.length() - tail.length();
        String whitespace = tail.substring(0, tail.length() - value.length());
        buffer.setText(anchorLine, text.substring(0, keyEnd) + whitespace + replacements.get(v));
        return Step.applied(anchorLine + 1, "resolved " + keys.get(v));
    }

    private int variantAt(String text) {
        for (int v = 0; v < keys.size(); v++) {
            if (text.contains(keys.get(v))) {
                return v;
            }
        }
        throw new IllegalStateException("anchor matched a line holding no key: " + text);
    }

    private String afterKey(String text, int variant) {
        String key = keys.get(variant);
        return text.substring(text.indexOf(key) + key.length());
    }

    private static List<String> renderAll(Template template, TemplateScope scope) {
        Objects.requireNonNull(template, "template must not be null");
        List<String> rendered = new ArrayList<>();
        for (Variant variant : scope.variants()) {
            String value = template.render(scope, variant);
            if (value.isEmpty() || value.indexOf('\n') >= 0) {
                throw new TemplateSyntaxException(
                        "Placeholder key and replacement must render to one non-empty line: " + template.source());
            }
            rendered.add(value);
        }
        return List.copyOf(rendered);
    }

    /** A placeholder ending in a word character must not run on into a longer word or number. */
    private boolean endsAtBoundary(String value) {
        if (value.length() == placeholder.length() || !isWordChar(placeholder.charAt(placeholder.length() - 1))) {
            return true;
        }
        char next = value.charAt(placeholder.length());
        return !isWordChar(next) && next != '.';
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
