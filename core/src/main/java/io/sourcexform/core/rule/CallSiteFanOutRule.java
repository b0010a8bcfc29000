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
 * Replaces a single call statement, with the lines that must follow it, by one statement per
 * variant, optionally concatenating the per-variant results into a combined collection.
 *
 * <p>
 * Emitted in order: {@code header} once, then per variant {@code statement} and {@code after},
 * then {@code combine.init} once and {@code combine.append} per variant. Every emitted line takes
 * the indentation of the anchor line.
 */
public final class CallSiteFanOutRule extends AnchoredRule {

    public static final String TYPE = "call-site-fan-out";
    public static final int DEFAULT_WINDOW = 20;

    /**
     * Concatenation of per-variant collections.
     *
     * @param into   name of the combined collection
     * @param init   rendered once, declares {@code into}
     * @param append rendered per variant
     */
    public record Combine(String into, Template init, Template append) {

        public Combine {
            Objects.requireNonNull(into, "combine.into must not be null");
            Objects.requireNonNull(init, "combine.init must not be null");
            Objects.requireNonNull(append, "combine.append must not be null");
        }
    }

    private final List<Anchor> following;
    private final int window;
    private final List<String> lines;
    private final List<String> guardLines;
    private final Set<String> introduced;

    /**
     * @param following  anchors the lines after the anchor must match, in order
     * @param header     rendered once before the statements, or {@code null}
     * @param statement  rendered per variant
     * @param after      rendered per variant after its statement, or {@code null}
     * @param collection per-variant name of the statement's result, or {@code null}
     * @param combine    concatenation step, or {@code null}
     * @param window     lines searched on each side of the anchor by the guard
     */
    public CallSiteFanOutRule(
            String name,
            Anchor anchor,
            List<Anchor> following,
            Template header,
            Template statement,
            Template after,
            Template collection,
            Combine combine,
            int window,
            TemplateScope scope) {
        super(name, anchor);
        Objects.requireNonNull(statement, "statement must not be null");
        if (window < 0) {
            throw new IllegalArgumentException("window must be >= 0, was " + window);
        }
        this.following = List.copyOf(following);
        this.window = window;

        List<String> out = new ArrayList<>();
        List<String> firsts = new ArrayList<>();
        Set<String> names = new LinkedHashSet<>();
        if (header != null) {
            out.addAll(header.renderLines(scope, null));
        }
        for (Variant variant : scope.variants()) {
            List<String> stmt = statement.renderLines(scope, variant);
            if (stmt.get(0).isBlank()) {
                throw new TemplateSyntaxException(
                        "Statement must not start with a blank line: " + statement.source());
            }
            firsts.add(stmt.get(0));
            out.addAll(stmt);
            if (after != null) {
                out.addAll(after.renderLines(scope, variant));
            }
            if (collection != null) {
                names.add(collection.render(scope, variant).strip());
            }
        }
        if (combine != null) {
            out.addAll(combine.init().renderLines(scope, null));
            for (Variant variant : scope.variants()) {
                out.addAll(combine.append().renderLines(scope, variant));
            }
            names.add(combine.into());
        }
        this.lines = List.copyOf(out);
        this.guardLines = List.copyOf(firsts);
        this.introduced = Set.copyOf(names);
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
        return lines;
    }

    @Override
    protected Region bound(SourceBuffer buffer, int anchorLine, RuleContext context) {
        return StatementSpan.bound(buffer, anchorLine, following, context.extractor());
    }

    @Override
    protected boolean alreadyApplied(SourceBuffer buffer, int anchorLine, Region span, RuleContext context) {
        return windowContainsAll(buffer, span, window, guardLines, context.extractor());
    }

    @Override
    protected Step transform(SourceBuffer buffer, int anchorLine, Region span, RuleContext context) {
        String indent = Indentation.of(buffer.text(anchorLine));
        int written = buffer.replace(span.start(), span.end(), Indentation.apply(indent, lines));
        return Step.applied(span.start() + written, "fanned out to " + guardLines.size() + " variants");
    }
}
