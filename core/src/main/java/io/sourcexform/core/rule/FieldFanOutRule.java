package io.sourcexform.core.rule;

import io.sourcexform.core.buffer.SourceBuffer;
import io.sourcexform.core.error.TemplateSyntaxException;
import io.sourcexform.core.model.Variant;
import io.sourcexform.core.scan.Anchor;
import io.sourcexform.core.scan.Region;
import io.sourcexform.core.spi.RuleContext;
import io.sourcexform.core.template.Template;
import io.sourcexform.core.template.TemplateScope;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Replaces a single-variant declaration inside a block with one declaration per variant.
 *
 * <p>
 * The anchor names the block opener, e.g. <code>type EmissionsHandler struct {</code>. Among the
 * block's top-level lines, seed lines (the legacy declaration) and variant lines (trimmed text
 * starting with a variant's key) are collected and replaced, at the position of the first one, by
 * the declarations of all variants in order. Variant lines already present are kept as they are;
 * missing ones are rendered with the indentation of the first collected line.
 */
public final class FieldFanOutRule extends AnchoredRule {

    public static final String TYPE = "field-fan-out";

    private final Anchor seed;
    private final List<String> declarations;
    private final List<String> keys;
    private final Set<String> introduced;

    /**
     * @param seed        legacy declaration, or {@code null} to collect variant lines only
     * @param declaration single-line declaration rendered per variant
     * @param key         per-variant key identifying a declaration, or {@code null} to use the
     *                    declaration's first token
     * @throws TemplateSyntaxException if a template fails to render, or a declaration spans lines
     */
    public FieldFanOutRule(
            String name, Anchor anchor, Anchor seed, Template declaration, Template key, TemplateScope scope) {
        super(name, anchor);
        Objects.requireNonNull(declaration, "declaration must not be null");
        this.seed = seed;
        List<String> decls = new ArrayList<>();
        List<String> keyList = new ArrayList<>();
        for (Variant variant : scope.variants()) {
            List<String> lines = declaration.renderLines(scope, variant);
            if (lines.size() != 1 || lines.get(0).isBlank()) {
                throw new TemplateSyntaxException(
                        "Declaration must render to exactly one non-blank line: " + declaration.source());
            }
            String decl = lines.get(0).strip();
            decls.add(decl);
            String k = key != null ? key.render(scope, variant).strip() : firstToken(decl);
            if (k.isEmpty()) {
                throw new TemplateSyntaxException("Declaration key renders empty: " + declaration.source());
            }
            keyList.add(k);
        }
        if (new LinkedHashSet<>(keyList).size() != keyList.size()) {
            throw new TemplateSyntaxException("Declaration keys are not distinct per variant: " + keyList);
        }
        this.declarations = List.copyOf(decls);
        this.keys = List.copyOf(keyList);
        this.introduced = Set.copyOf(keyList);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Set<String> introducedNames() {
        return introduced;
    }

    @Override
    public List<String> renderedText() {
        return declarations;
    }

    public List<String> keys() {
        return keys;
    }

    @Override
    protected Region bound(SourceBuffer buffer, int anchorLine, RuleContext context) {
        if (!context.extractor().opensBlock(buffer, anchorLine)) {
            return null;
        }
        return context.extractor().extract(buffer, anchorLine);
    }

    @Override
    protected boolean alreadyApplied(SourceBuffer buffer, int anchorLine, Region span, RuleContext context) {
        Collected found = collect(buffer, span, context);
        if (!found.seeds.isEmpty() || found.variantLines.size() != keys.size()) {
            return false;
        }
        for (int i = 0; i < keys.size(); i++) {
            if (found.variantLines.get(i).variant != i) {
                return false;
            }
        }
        return true;
    }

    @Override
    protected Step transform(SourceBuffer buffer, int anchorLine, Region span, RuleContext context) {
        Collected found = collect(buffer, span, context);
        if (found.lines.isEmpty()) {
            return Step.skipped(span.end() + 1, "no seed declaration in block");
        }
        int first = found.lines.get(0);
        int last = found.lines.get(found.lines.size() - 1);
        String indent = Indentation.of(buffer.text(first));

        List<String> fanOut = new ArrayList<>(keys.size());
        int kept = 0;
        for (int v = 0; v < keys.size(); v++) {
            String existing = found.firstTextFor(v);
            if (existing != null) {
                fanOut.add(existing);
                kept++;
            } else {
                fanOut.add(indent + declarations.get(v));
            }
        }
        List<String> replacement = new ArrayList<>(fanOut);
        for (int i = first; i <= last; i++) {
            if (!found.lines.contains(i)) {
                replacement.add(buffer.text(i));
            }
        }
        int written = buffer.replace(first, last, replacement);
        int newEnd = span.end() + written - (last - first + 1);
        return Step.applied(
                newEnd + 1,
                "fanned out to " + keys.size() + " variants (" + kept + " kept, " + (keys.size() - kept) + " added)");
    }

    private Collected collect(SourceBuffer buffer, Region block, RuleContext context) {
        Collected found = new Collected();
        int[] depths = context.extractor().depths(buffer, block);
        for (int i = block.start() + 1; i < block.end(); i++) {
            String text = buffer.text(i);
            if (depths[i - block.start()] == 1) {
                int variant = variantOf(text);
                if (variant >= 0) {
                    found.variantLines.add(new VariantLine(i, variant, text));
                    found.lines.add(i);
                } else if (seed != null && seed.matches(text)) {
                    found.seeds.add(i);
                    found.lines.add(i);
                }
            }
        }
        return found;
    }

    private int variantOf(String text) {
        String trimmed = text.strip();
        for (int v = 0; v < keys.size(); v++) {
            String key = keys.get(v);
            if (trimmed.startsWith(key)
                    && (trimmed.length() == key.length() || !isIdentifierChar(trimmed.charAt(key.length())))) {
                return v;
            }
        }
        return -1;
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static String firstToken(String declaration) {
        int end = 0;
        while (end < declaration.length()) {
            char c = declaration.charAt(end);
            if (Character.isWhitespace(c) || c == ':' || c == '=') {
                break;
            }
            end++;
        }
        return declaration.substring(0, end);
    }

    private record VariantLine(int line, int variant, String text) {}

    private static final class Collected {
        final List<Integer> lines = new ArrayList<>();
        final List<Integer> seeds = new ArrayList<>();
        final List<VariantLine> variantLines = new ArrayList<>();

        String firstTextFor(int variant) {
            for (VariantLine line : variantLines) {
                if (line.variant == variant) {
                    return line.text;
                }
            }
            return null;
        }
    }
}
