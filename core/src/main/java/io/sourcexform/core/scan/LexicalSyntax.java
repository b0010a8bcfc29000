package io.sourcexform.core.scan;

import java.util.Objects;

/**
 * Lexical conventions the {@link RegionExtractor} needs to tell structural delimiters from text.
 * Every character in {@code quotes} starts a literal that honours backslash escapes and ends at
 * the same character or at end of line; every character in {@code rawQuotes} starts a literal
 * without escapes that may span lines.
 *
 * @param open              block opener, e.g. <code>{</code>
 * @param close             block closer, e.g. <code>}</code>
 * @param lineComment       line comment introducer, or empty if none
 * @param blockCommentStart block comment start, or empty if none
 * @param blockCommentEnd   block comment end, or empty if none
 * @param quotes            escaping quote characters
 * @param rawQuotes         raw (multi-line, non-escaping) quote characters
 */
public record LexicalSyntax(
        String open,
        String close,
        String lineComment,
        String blockCommentStart,
        String blockCommentEnd,
        String quotes,
        String rawQuotes) {

    /** C, Go, Java and JavaScript conventions; Go raw strings use backticks. */
    public static final LexicalSyntax C_FAMILY = new LexicalSyntax("{", "}", "//", "/*", "*/", "\"'", "`");

    public LexicalSyntax {
        Objects.requireNonNull(open, "open must not be null");
        Objects.requireNonNull(close, "close must not be null");
        Objects.requireNonNull(lineComment, "lineComment must not be null");
        Objects.requireNonNull(blockCommentStart, "blockCommentStart must not be null");
        Objects.requireNonNull(blockCommentEnd, "blockCommentEnd must not be null");
        Objects.requireNonNull(quotes, "quotes must not be null");
        Objects.requireNonNull(rawQuotes, "rawQuotes must not be null");
        if (open.isEmpty() || close.isEmpty() || open.equals(close)) {
            throw new IllegalArgumentException("open and close must be non-empty and distinct");
        }
        if (blockCommentStart.isEmpty() != blockCommentEnd.isEmpty()) {
            throw new IllegalArgumentException("block comment start and end must be given together");
        }
    }
}
