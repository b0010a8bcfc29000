package io.sourcexform.core.scan;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Literal line pattern, or a small alternation of them, locating where a rule applies. A line
 * matches when any pattern matches under the anchor's {@link MatchMode}.
 *
 * @param patterns non-empty alternation of literal patterns
 * @param mode     comparison mode
 */
public record Anchor(List<String> patterns, MatchMode mode) {

    public Anchor {
        Objects.requireNonNull(patterns, "patterns must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        if (patterns.isEmpty()) {
            throw new IllegalArgumentException("anchor must have at least one pattern");
        }
        for (String pattern : patterns) {
            if (pattern == null || pattern.isEmpty()) {
                throw new IllegalArgumentException("anchor patterns must be non-empty");
            }
        }
        patterns = List.copyOf(patterns);
    }

    public static Anchor contains(String... patterns) {
        return new Anchor(List.of(patterns), MatchMode.CONTAINS);
    }

    public static Anchor exact(String... patterns) {
        return new Anchor(List.of(patterns), MatchMode.EXACT);
    }

    public static Anchor trimmed(String... patterns) {
        return new Anchor(List.of(patterns), MatchMode.TRIMMED);
    }

    public boolean matches(String text) {
        for (String pattern : patterns) {
            if (mode.test(text, pattern)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return mode.name().toLowerCase(Locale.ROOT) + patterns;
    }
}
