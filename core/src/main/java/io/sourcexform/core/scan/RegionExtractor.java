package io.sourcexform.core.scan;

import io.sourcexform.core.buffer.SourceBuffer;
import io.sourcexform.core.error.UnbalancedRegionException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Bounds a brace-delimited block by counting openers and closers outside of string literals,
 * character literals, raw strings and comments. Lexical state (open block comment, open raw
 * string) carries across lines; escaping literals end at end of line.
 *
 * <p>
 * Stateless apart from its {@link LexicalSyntax}; safe to share between sessions.
 */
public final class RegionExtractor {

    private final LexicalSyntax syntax;

    public RegionExtractor() {
        this(LexicalSyntax.C_FAMILY);
    }

    public RegionExtractor(LexicalSyntax syntax) {
        this.syntax = Objects.requireNonNull(syntax, "syntax must not be null");
    }

    public LexicalSyntax syntax() {
        return syntax;
    }

    /**
     * Finds the region opened on {@code openerLine}. Counting starts at the first structural
     * opener on that line, so a leading closer (as in <code>} else {</code>) is ignored. The region
     * ends on the line where the balance returns to zero.
     *
     * @throws UnbalancedRegionException if the line holds no opener, or the buffer ends first
     */
    public Region extract(SourceBuffer buffer, int openerLine) {
        Lexer lexer = new Lexer();
        int balance = 0;
        boolean started = false;
        for (int i = openerLine; i < buffer.size(); i++) {
            String text = buffer.text(i);
            int pos = 0;
            while (pos < text.length()) {
                int token = lexer.next(text, pos);
                if (token < 0) {
                    break;
                }
                if (text.startsWith(syntax.open(), token)) {
                    balance++;
                    started = true;
                    pos = token + syntax.open().length();
                } else {
                    if (started) {
                        balance--;
                        if (balance == 0) {
                            return new Region(openerLine, i);
                        }
                    }
                    pos = token + syntax.close().length();
                }
            }
            if (!started) {
                throw new UnbalancedRegionException(
                        "No '" + syntax.open() + "' on line " + (openerLine + 1) + ": " + buffer.text(openerLine),
                        openerLine);
            }
        }
        throw new UnbalancedRegionException(
                "Block opened on line " + (openerLine + 1) + " is not closed before end of file", openerLine);
    }

    /**
     * Finds the innermost block that contains {@code line}, lexing from the top of the buffer.
     * A line that itself opens a block belongs to the block around it.
     *
     * @return the block from its opener line to its closer line, or {@code null} at top level
     * @throws UnbalancedRegionException if the containing block is not closed before end of file
     */
    public Region enclosing(SourceBuffer buffer, int line) {
        if (line < 0 || line >= buffer.size()) {
            throw new IndexOutOfBoundsException("line " + line + " outside 0.." + (buffer.size() - 1));
        }
        Lexer lexer = new Lexer();
        Deque<Integer> openers = new ArrayDeque<>();
        int depth = -1;
        int start = line;
        for (int i = 0; i < buffer.size(); i++) {
            if (i == line) {
                if (openers.isEmpty()) {
                    return null;
                }
                depth = openers.size();
                start = openers.peek();
            }
            String text = buffer.text(i);
            int pos = 0;
            while (pos < text.length()) {
                int token = lexer.next(text, pos);
                if (token < 0) {
                    break;
                }
                if (text.startsWith(syntax.open(), token)) {
                    openers.push(i);
                    pos = token + syntax.open().length();
                } else {
                    if (!openers.isEmpty()) {
                        openers.pop();
                        if (depth > 0 && openers.size() < depth) {
                            return new Region(start, i);
                        }
                    }
                    pos = token + syntax.close().length();
                }
            }
        }
        throw new UnbalancedRegionException(
                "Block opened on line " + (start + 1) + " is not closed before end of file", start);
    }

    /**
     * Whether everything on the line sits inside comments, taking block comments and raw strings
     * opened on earlier lines into account. Blank lines are not comment-only.
     */
    public boolean isCommentOnly(SourceBuffer buffer, int index) {
        String text = buffer.text(index);
        if (text.isBlank()) {
            return false;
        }
        Lexer lexer = lexerBefore(buffer, index);
        lexer.sawCode = false;
        drain(lexer, text);
        return !lexer.sawCode;
    }

    /** Whether the line holds a structural opener outside literals and comments. */
    public boolean opensBlock(SourceBuffer buffer, int index) {
        Lexer lexer = lexerBefore(buffer, index);
        String text = buffer.text(index);
        int pos = 0;
        while (pos < text.length()) {
            int token = lexer.next(text, pos);
            if (token < 0) {
                return false;
            }
            if (text.startsWith(syntax.open(), token)) {
                return true;
            }
            pos = token + syntax.close().length();
        }
        return false;
    }

    /**
     * Net opener/closer delta of a single line, with the line lexed in isolation.
     *
     * @return openers minus closers found outside literals and comments
     */
    public int lineBalance(SourceBuffer buffer, int index) {
        return delta(new Lexer(), buffer.text(index), false);
    }

    /**
     * Nesting depth at the start of each line of a region, lexed as one unit so that comments and
     * raw strings spanning lines are honoured. The opener line is at depth 0 and closers before
     * its first opener are ignored, so direct children of the block are at depth 1.
     *
     * @return depths indexed from {@code region.start()}
     */
    public int[] depths(SourceBuffer buffer, Region region) {
        Lexer lexer = new Lexer();
        int[] depths = new int[region.lineCount()];
        int depth = 0;
        for (int i = region.start(); i <= region.end(); i++) {
            depths[i - region.start()] = depth;
            depth += delta(lexer, buffer.text(i), i == region.start());
        }
        return depths;
    }

    private Lexer lexerBefore(SourceBuffer buffer, int index) {
        Lexer lexer = new Lexer();
        for (int i = 0; i < index; i++) {
            drain(lexer, buffer.text(i));
        }
        return lexer;
    }

    private void drain(Lexer lexer, String text) {
        int pos = 0;
        while (pos < text.length()) {
            int token = lexer.next(text, pos);
            if (token < 0) {
                return;
            }
            pos = token + (text.startsWith(syntax.open(), token) ? syntax.open() : syntax.close()).length();
        }
    }

    private int delta(Lexer lexer, String text, boolean skipLeadingClosers) {
        int delta = 0;
        boolean opened = false;
        int pos = 0;
        while (pos < text.length()) {
            int token = lexer.next(text, pos);
            if (token < 0) {
                break;
            }
            if (text.startsWith(syntax.open(), token)) {
                delta++;
                opened = true;
                pos = token + syntax.open().length();
            } else {
                if (opened || !skipLeadingClosers) {
                    delta--;
                }
                pos = token + syntax.close().length();
            }
        }
        return delta;
    }

    /** Scans one line at a time, remembering constructs that span lines. */
    private final class Lexer {

        private boolean inBlockComment;
        private char rawQuote;
        private boolean sawCode;

        /**
         * Returns the position of the next structural opener or closer at or after {@code from},
         * or -1 if the rest of the line holds none.
         */
        int next(String text, int from) {
            int i = from;
            int n = text.length();
            while (i < n) {
                if (inBlockComment) {
                    int end = text.indexOf(syntax.blockCommentEnd(), i);
                    if (end < 0) {
                        return -1;
                    }
                    inBlockComment = false;
                    i = end + syntax.blockCommentEnd().length();
                    continue;
                }
                if (rawQuote != 0) {
                    sawCode = true;
                    int end = text.indexOf(rawQuote, i);
                    if (end < 0) {
                        return -1;
                    }
                    rawQuote = 0;
                    i = end + 1;
                    continue;
                }
                char c = text.charAt(i);
                if (!syntax.lineComment().isEmpty() && text.startsWith(syntax.lineComment(), i)) {
                    return -1;
                }
                if (!syntax.blockCommentStart().isEmpty() && text.startsWith(syntax.blockCommentStart(), i)) {
                    inBlockComment = true;
                    i += syntax.blockCommentStart().length();
                    continue;
                }
                if (!Character.isWhitespace(c)) {
                    sawCode = true;
                }
                if (syntax.rawQuotes().indexOf(c) >= 0) {
                    rawQuote = c;
                    i++;
                    continue;
                }
                if (syntax.quotes().indexOf(c) >= 0) {
                    i = skipQuoted(text, i + 1, c);
                    continue;
                }
                if (text.startsWith(syntax.open(), i) || text.startsWith(syntax.close(), i)) {
                    return i;
                }
                i++;
            }
            return -1;
        }

        private int skipQuoted(String text, int from, char quote) {
            int i = from;
            while (i < text.length()) {
                char c = text.charAt(i);
                if (c == '\\') {
                    i += 2;
                } else if (c == quote) {
                    return i + 1;
                } else {
                    i++;
                }
            }
            return text.length();
        }
    }
}
