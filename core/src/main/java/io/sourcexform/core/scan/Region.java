package io.sourcexform.core.scan;

/**
 * Contiguous, inclusive line range. For regions produced by {@link RegionExtractor}, {@code start}
 * holds the opener and {@code end} its matching closer.
 */
public record Region(int start, int end) {

    public Region {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid region [" + start + ", " + end + "]");
        }
    }

    public int lineCount() {
        return end - start + 1;
    }

    public boolean contains(int line) {
        return line >= start && line <= end;
    }
}
