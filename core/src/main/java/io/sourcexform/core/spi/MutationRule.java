package io.sourcexform.core.spi;

import io.sourcexform.core.buffer.SourceBuffer;
import java.util.List;
import java.util.Set;

/**
 * A named, ordered unit of structural change: an anchor, a way to bound the code around it, a
 * transformation, and a guard that recognises the already-transformed shape.
 *
 * <p>
 * Rules are immutable once built. All templates are rendered when the rule is constructed, so a
 * template error surfaces at load time and {@link #apply} only inserts pre-rendered text.
 * Implementations must be safe to apply to different buffers from different threads.
 */
public interface MutationRule {

    /** Unique name within a migration, used in reports and logs. */
    String name();

    /** Rule type as written in the migration spec, e.g. {@code field-fan-out}. */
    String type();

    /**
     * Runs one pass over the buffer, starting at line 0 and advancing monotonically. Records one
     * report entry per anchor occurrence, or a single {@code anchor not found} skip.
     *
     * @throws io.sourcexform.core.error.UnbalancedRegionException if a block cannot be bounded
     */
    void apply(SourceBuffer buffer, RuleContext context);

    /** Names this rule brings into existence; only later rules may reference them. */
    Set<String> introducedNames();

    /** Every piece of text this rule may emit, used for static ordering checks. */
    List<String> renderedText();
}
