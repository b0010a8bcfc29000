package io.sourcexform.core.rule;

import io.sourcexform.core.buffer.SourceBuffer;
import io.sourcexform.core.scan.Anchor;
import io.sourcexform.core.scan.Region;
import io.sourcexform.core.scan.RegionExtractor;
import java.util.List;

/**
 * Bounds a statement made of an anchor line and the lines that must follow it. Any line that
 * opens a block, the anchor included, absorbs the block up to its closer.
 */
final class StatementSpan {

    private StatementSpan() {}

    /**
     * @return the span, or {@code null} if a following line does not match its anchor
     */
    static Region bound(SourceBuffer buffer, int anchorLine, List<Anchor> following, RegionExtractor extractor) {
        int end = absorb(buffer, anchorLine, extractor);
        for (Anchor next : following) {
            int line = end + 1;
            if (line >= buffer.size() || !next.matches(buffer.text(line))) {
                return null;
            }
            end = absorb(buffer, line, extractor);
        }
        return new Region(anchorLine, end);
    }

    private static int absorb(SourceBuffer buffer, int line, RegionExtractor extractor) {
        if (extractor.lineBalance(buffer, line) > 0) {
            return extractor.extract(buffer, line).end();
        }
        return line;
    }
}
