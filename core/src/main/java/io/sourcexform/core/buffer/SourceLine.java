package io.sourcexform.core.buffer;

import java.util.Objects;

/**
 * One line of a {@link SourceBuffer}: its text without the terminator, and the terminator exactly
 * as it appeared in the input ({@code "\n"}, {@code "\r\n"}, {@code "\r"}, or empty for an
 * unterminated last line).
 *
 * @param text       line content, never containing a line terminator
 * @param terminator original line terminator, possibly empty
 */
public record SourceLine(String text, String terminator) {

    public SourceLine {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(terminator, "terminator must not be null");
    }

    /** Text followed by its terminator. */
    public String raw() {
        return text + terminator;
    }

    public boolean isTerminated() {
        return !terminator.isEmpty();
    }
}
