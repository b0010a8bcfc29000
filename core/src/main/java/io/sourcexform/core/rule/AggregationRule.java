package io.sourcexform.core.rule;

import io.sourcexform.core.buffer.SourceBuffer;
import io.sourcexform.core.model.Variant;
import io.sourcexform.core.scan.Anchor;
import io.sourcexform.core.scan.Region;
import io.sourcexform.core.spi.RuleContext;
import io.sourcexform.core.template.Template;
import io.sourcexform.core.template.TemplateScope;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Synthesizes one accumulator per variant and the loops filling them. With
 * {@link Placement#REPLACE} the legacy accumulator and its loop are replaced; with
 * {@link Placement#AFTER} the new code follows the anchored statement, which is kept.
 *
 * <p>
 * The rule's own names {@code collection}, {@code accumulator}, {@code field} and {@code type} are
 * visible to its {@code declaration} and {@code loop} templates.
 */
public final class AggregationRule extends AnchoredRule {

    public static final String TYPE = "aggregation";
    public static final String DEFAULT_TYPE = "float64";
    public static final String DEFAULT_DECLARATION = "var ${join ', ' ${accumulator}} ${type}";
    public static final String DEFAULT_LOOP =
            "for _, rec := range ${collection} {\n\t${accumulator} += rec.${field}\n}";

    /** Where the synthesized code goes relative to the anchored span. */
    public enum Placement {
        REPLACE,
        AFTER
    }

    private final List<Anchor> following;
    private final Placement placement;
    private final int window;
    private final List<String> lines;
    private final List<String> guardLines;
    private final Set<String> introduced;
    private final int variantCount;

    /**
     * @param names       the rule's local names: {@code collection}, {@code accumulator},
     *                    optionally {@code field} and {@code type}
     * @param declaration declaration template, {@code null} for {@link #DEFAULT_DECLARATION}
     * @param loop        per-variant loop template, {@code null} for {@link #DEFAULT_LOOP}
     */
    public AggregationRule(
            String name,
            Anchor anchor,
            List<Anchor> following,
            Placement placement,
            Map<String, Template> names,
            Template declaration,
            Template loop,
            int window,
            TemplateScope scope) {
        super(name, anchor);
        this.following = List.copyOf(following);
        this.placement = Objects.requireNonNull(placement, "placement must not be null");
        this.window = window;

        Map<String, Template> local = new HashMap<>(names);
        local.putIfAbsent("type", Template.parse(DEFAULT_TYPE));
        TemplateScope ruleScope = scope.child(local);
        Template decl = declaration != null ? declaration : Template.parse(DEFAULT_DECLARATION);
        Template body = loop != null ? loop : Template.parse(DEFAULT_LOOP);

        List<String> out = new ArrayList<>(decl.renderLines(ruleScope, null));
        List<String> guard = new ArrayList<>(out);
        Template accumulator = local.get("accumulator");
        Set<String> accumulators = new LinkedHashSet<>();
        for (Variant variant : scope.variants()) {
            List<String> rendered = body.renderLines(ruleScope, variant);
            out.addAll(rendered);
            guard.add(rendered.get(0));
            if (accumulator != null) {
                accumulators.add(accumulator.render(ruleScope, variant).strip());
            }
        }
        this.lines = List.copyOf(out);
        this.guardLines = guard.stream().filter(l -> !l.isBlank()).toList();
        this.introduced = Set.copyOf(accumulators);
        this.variantCount = scope.variants().size();
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

    public Placement placement() {
        return placement;
    }

    @Override
    protected Region bound(SourceBuffer buffer, int anchorLine, RuleContext context) {
        return StatementSpan.bound(buffer, anchorLine, following, context.extractor());
    }

    @Override
    protected boolean alreadyApplied(SourceBuffer buffer, int anchorLine, Region span, RuleContext context) {
        return windowContainsAll(buffer, span, window + lines.size(), guardLines, context.extractor());
    }

    @Override
    protected Step transform(SourceBuffer buffer, int anchorLine, Region span, RuleContext context) {
        List<String> indented = Indentation.apply(Indentation.of(buffer.text(anchorLine)), lines);
        int variants = variantCount;
        if (placement == Placement.REPLACE) {
            int written = buffer.replace(span.start(), span.end(), indented);
            return Step.applied(span.start() + written, "aggregated " + variants + " variants");
        }
        int written = buffer.insertAfter(span.end(), indented);
        return Step.applied(span.end() + written + 1, "aggregated " + variants + " variants after statement");
    }
}
