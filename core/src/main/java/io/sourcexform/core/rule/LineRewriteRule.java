package io.sourcexform.core.rule;

import io.sourcexform.core.buffer.SourceBuffer;
import io.sourcexform.core.error.TemplateSyntaxException;
import io.sourcexform.core.scan.Anchor;
import io.sourcexform.core.scan.Region;
import io.sourcexform.core.spi.RuleContext;
import io.sourcexform.core.template.Template;
import io.sourcexform.core.template.TemplateScope;
import java.util.List;
import java.util.Set;

/** Replaces a literal within anchored lines, e.g. {@code len(records)} with {@code len(allRecords)}. */
public final class LineRewriteRule extends AnchoredRule {

    public static final String TYPE = "rewrite";

    private final String find;
    private final String replace;

    /**
     * @param anchor  lines to rewrite, or {@code null} for every line containing {@code find}
     * @param find    literal to replace, all occurrences in the line
     * @param replace rendered once, outside any variant context
     */
    public LineRewriteRule(String name, Anchor anchor, String find, Template replace, TemplateScope scope) {
        super(name, anchor != null ? anchor : Anchor.contains(requireFind(find)));
        this.find = requireFind(find);
        this.replace = replace.render(scope, null);
        if (this.replace.indexOf('\n') >= 0) {
            throw new TemplateSyntaxException("Rewrite replacement must render to one line: " + replace.source());
        }
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
        return List.of(replace);
    }

    @Override
    protected Region bound(SourceBuffer buffer, int anchorLine, RuleContext context) {
        return new Region(anchorLine, anchorLine);
    }

    @Override
    protected boolean alreadyApplied(SourceBuffer buffer, int anchorLine, Region span, RuleContext context) {
        return buffer.text(anchorLine).contains(replace);
    }

    @Override
    protected Step transform(SourceBuffer buffer, int anchorLine, Region span, RuleContext context) {
        String text = buffer.text(anchorLine);
        if (!text.contains(find)) {
            return Step.skipped(anchorLine + 1, "'" + find + "' not in line");
        }
        buffer.setText(anchorLine, text.replace(find, replace));
        return Step.applied(anchorLine + 1, null);
    }

    private static String requireFind(String find) {
        if (find == null || find.isEmpty()) {
            throw new IllegalArgumentException("find must not be empty");
        }
        return find;
    }
}
