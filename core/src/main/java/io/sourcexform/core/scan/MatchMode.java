package io.sourcexform.core.scan;

/** How an {@link Anchor} pattern is compared against a line's text. */
public enum MatchMode {
    /** The line text contains the pattern. */
    CONTAINS,
    /** The line text equals the pattern. */
    EXACT,
    /** The line text, stripped of leading and trailing whitespace, equals the pattern. */
    TRIMMED;

    boolean test(String text, String pattern) {
        return switch (this) {
            case CONTAINS -> text.contains(pattern);
            case EXACT -> text.equals(pattern);
            case TRIMMED -> text.strip().equals(pattern);
        };
    }
}
