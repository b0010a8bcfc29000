package io.sourcexform.core.scan;

import io.sourcexform.core.buffer.SourceBuffer;
import java.util.OptionalInt;

/** Forward linear search for anchor lines. Finding nothing is a normal result, not an error. */
public final class AnchorScanner {

    private AnchorScanner() {}

    /**
     * Returns the first line at or after {@code cursor} that satisfies the anchor.
     *
     * @param buffer buffer to scan
     * @param cursor index of the first line to examine; may equal {@code buffer.size()}
     * @param anchor anchor to satisfy
     * @return the matching line index, or empty if no line from the cursor onward matches
     */
    public static OptionalInt find(SourceBuffer buffer, int cursor, Anchor anchor) {
        return findWithin(buffer, cursor, buffer.size() - 1, anchor);
    }

    /** Like {@link #find} but stops after {@code toInclusive}, clamped to the buffer. */
    public static OptionalInt findWithin(SourceBuffer buffer, int from, int toInclusive, Anchor anchor) {
        if (from < 0) {
            throw new IllegalArgumentException("cursor must be >= 0, was " + from);
        }
        int last = Math.min(toInclusive, buffer.size() - 1);
        for (int i = from; i <= last; i++) {
            if (anchor.matches(buffer.text(i))) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }
}
