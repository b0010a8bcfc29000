package io.sourcexform.core.rule;

import io.sourcexform.core.buffer.SourceBuffer;
import io.sourcexform.core.scan.Anchor;
import io.sourcexform.core.scan.AnchorScanner;
import io.sourcexform.core.scan.Region;
import io.sourcexform.core.scan.RegionExtractor;
import io.sourcexform.core.spi.MutationRule;
import io.sourcexform.core.spi.RuleContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for rules driven by an anchor. One pass locates each anchor occurrence from a
 * monotonically advancing cursor, bounds the code around it, asks the idempotency guard, and
 * transforms. Subclasses supply the three steps.
 */
public abstract class AnchoredRule implements MutationRule {

    private static final Logger LOG = LoggerFactory.getLogger(AnchoredRule.class);

    static final String ANCHOR_NOT_FOUND = "anchor not found";
    static final String ALREADY_APPLIED = "already applied";
    static final String SHAPE_MISMATCH = "statement shape mismatch";
    static final String IN_COMMENT = "anchor inside comment";

    private final String name;
    private final Anchor anchor;

    protected AnchoredRule(String name, Anchor anchor) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.anchor = Objects.requireNonNull(anchor, "anchor must not be null");
    }

    @Override
    public final String name() {
        return name;
    }

    public final Anchor anchor() {
        return anchor;
    }

    @Override
    public final void apply(SourceBuffer buffer, RuleContext context) {
        int cursor = 0;
        boolean matched = false;
        while (cursor < buffer.size()) {
            OptionalInt hit = AnchorScanner.find(buffer, cursor, anchor);
            if (hit.isEmpty()) {
                break;
            }
            matched = true;
            int line = hit.getAsInt();
            if (context.extractor().isCommentOnly(buffer, line)) {
                context.skipped(name, line, IN_COMMENT);
                cursor = line + 1;
                continue;
            }
            Region span = bound(buffer, line, context);
            if (span == null) {
                context.skipped(name, line, SHAPE_MISMATCH);
                cursor = line + 1;
                continue;
            }
            if (alreadyApplied(buffer, line, span, context)) {
                context.skipped(name, line, ALREADY_APPLIED);
                cursor = span.end() + 1;
                continue;
            }
            Step step = transform(buffer, line, span, context);
            if (step.applied()) {
                context.applied(name, line, step.detail());
            } else {
                context.skipped(name, line, step.detail());
            }
            cursor = Math.max(step.next(), line + 1);
        }
        if (!matched) {
            LOG.debug("Rule {}: {} ({})", name, ANCHOR_NOT_FOUND, anchor);
            context.skipped(name, -1, ANCHOR_NOT_FOUND);
        }
    }

    /**
     * Bounds the code the rule operates on.
     *
     * @return the span, or {@code null} when the code around the anchor has an unexpected shape
     * @throws io.sourcexform.core.error.UnbalancedRegionException if a block never closes
     */
    protected abstract Region bound(SourceBuffer buffer, int anchorLine, RuleContext context);

    /** Whether the span already holds this rule's output. */
    protected abstract boolean alreadyApplied(SourceBuffer buffer, int anchorLine, Region span, RuleContext context);

    /** Rewrites the span. The returned cursor must point past everything the rule wrote. */
    protected abstract Step transform(SourceBuffer buffer, int anchorLine, Region span, RuleContext context);

    /**
     * Result of one transformation.
     *
     * @param applied whether the buffer changed
     * @param next    line index the next anchor search starts from
     * @param detail  report reason
     */
    protected record Step(boolean applied, int next, String detail) {

        static Step applied(int next, String detail) {
            return new Step(true, next, detail);
        }

        static Step skipped(int next, String reason) {
            return new Step(false, next, reason);
        }
    }

    /**
     * Whether every expected line appears, whitespace-trimmed, between {@code window} lines before
     * the span and {@code window} lines after it. The window never leaves the innermost block
     * around the span, so code in a neighbouring function does not count.
     *
     * @throws io.sourcexform.core.error.UnbalancedRegionException if that block never closes
     */
    static boolean windowContainsAll(
            SourceBuffer buffer, Region span, int window, List<String> expected, RegionExtractor extractor) {
        Region block = extractor.enclosing(buffer, span.start());
        int lower = block == null ? 0 : block.start();
        int upper = block == null ? buffer.size() - 1 : block.end();
        int from = Math.max(lower, span.start() - window);
        int to = (int) Math.min(upper, (long) span.end() + window);
        List<String> present = new ArrayList<>();
        for (int i = from; i <= to; i++) {
            present.add(buffer.text(i).strip());
        }
        for (String line : expected) {
            if (!present.contains(line.strip())) {
                return false;
            }
        }
        return true;
    }
}
