package io.sourcexform.core.buffer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, line-indexed view of a source file that preserves every byte of the input.
 * Concatenating {@link SourceLine#raw()} over all lines reproduces the original text exactly as
 * long as no mutation has occurred.
 *
 * <p>
 * Mutations assign new lines the terminator of the line they replace, except that the last new
 * line inherits the terminator of the last replaced line so that a missing final newline stays
 * missing. Not thread-safe: a buffer is owned by exactly one patch session.
 */
public final class SourceBuffer {

    private static final String FALLBACK_TERMINATOR = "\n";

    private final List<SourceLine> lines;
    private final String defaultTerminator;
    private boolean modified;

    private SourceBuffer(List<SourceLine> lines) {
        this.lines = lines;
        this.defaultTerminator = lines.stream()
                .map(SourceLine::terminator)
                .filter(t -> !t.isEmpty())
                .findFirst()
                .orElse(FALLBACK_TERMINATOR);
    }

    /**
     * Splits the given text into lines, keeping each terminator.
     *
     * @param content the full file content
     * @return a new, unmodified buffer
     */
    public static SourceBuffer of(String content) {
        Objects.requireNonNull(content, "content must not be null");
        List<SourceLine> lines = new ArrayList<>();
        int length = content.length();
        int start = 0;
        int i = 0;
        while (i < length) {
            char c = content.charAt(i);
            if (c == '\n') {
                lines.add(new SourceLine(content.substring(start, i), "\n"));
                i++;
                start = i;
            } else if (c == '\r') {
                boolean crlf = i + 1 < length && content.charAt(i + 1) == '\n';
                lines.add(new SourceLine(content.substring(start, i), crlf ? "\r\n" : "\r"));
                i += crlf ? 2 : 1;
                start = i;
            } else {
                i++;
            }
        }
        if (start < length) {
            lines.add(new SourceLine(content.substring(start), ""));
        }
        return new SourceBuffer(lines);
    }

    public int size() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public SourceLine line(int index) {
        return lines.get(index);
    }

    /** Text of the line at {@code index}, without its terminator. */
    public String text(int index) {
        return lines.get(index).text();
    }

    /** Unmodifiable snapshot of the current lines. */
    public List<SourceLine> lines() {
        return Collections.unmodifiableList(new ArrayList<>(lines));
    }

    /** Terminator used for lines that have none of their own: the first one found in the input. */
    public String defaultTerminator() {
        return defaultTerminator;
    }

    /** Whether any mutation has been applied since the buffer was created. */
    public boolean isModified() {
        return modified;
    }

    /** Concatenation of every line and its terminator. */
    public String serialize() {
        StringBuilder out = new StringBuilder();
        for (SourceLine line : lines) {
            out.append(line.text()).append(line.terminator());
        }
        return out.toString();
    }

    /**
     * Replaces the text of one line, keeping its terminator.
     *
     * @param index line index
     * @param text  new text, must not contain line terminators
     */
    public void setText(int index, String text) {
        requireSingleLine(text);
        SourceLine current = lines.get(index);
        if (!current.text().equals(text)) {
            lines.set(index, new SourceLine(text, current.terminator()));
            modified = true;
        }
    }

    /**
     * Replaces the lines {@code [start, endInclusive]} with the given texts.
     *
     * @return the number of lines written in place of the replaced range
     */
    public int replace(int start, int endInclusive, List<String> texts) {
        checkRange(start, endInclusive);
        String interior = interiorTerminator(start);
        String last = lines.get(endInclusive).terminator();
        List<SourceLine> replacement = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            String text = texts.get(i);
            requireSingleLine(text);
            replacement.add(new SourceLine(text, i == texts.size() - 1 ? last : interior));
        }
        splice(start, endInclusive, replacement);
        return replacement.size();
    }

    /**
     * Replaces the lines {@code [start, endInclusive]} with already-built lines, keeping their
     * terminators as given. Used when part of the replacement is original lines moved around.
     */
    public void splice(int start, int endInclusive, List<SourceLine> replacement) {
        checkRange(start, endInclusive);
        List<SourceLine> range = lines.subList(start, endInclusive + 1);
        if (range.equals(replacement)) {
            return;
        }
        range.clear();
        range.addAll(replacement);
        modified = true;
    }

    /**
     * Inserts texts after the line at {@code index}. If that line was the unterminated last line,
     * it receives the default terminator and the last inserted line becomes unterminated.
     *
     * @return the number of lines inserted
     */
    public int insertAfter(int index, List<String> texts) {
        if (texts.isEmpty()) {
            return 0;
        }
        List<String> merged = new ArrayList<>(texts.size() + 1);
        merged.add(text(index));
        merged.addAll(texts);
        replace(index, index, merged);
        return texts.size();
    }

    /** Terminator a newly written line inherits when replacing lines starting at {@code start}. */
    public String interiorTerminator(int start) {
        String terminator = lines.get(start).terminator();
        return terminator.isEmpty() ? defaultTerminator : terminator;
    }

    private void checkRange(int start, int endInclusive) {
        if (start < 0 || endInclusive >= lines.size() || start > endInclusive) {
            throw new IndexOutOfBoundsException("Invalid line range [" + start + ", " + endInclusive
                    + "] for buffer of " + lines.size() + " lines");
        }
    }

    private static void requireSingleLine(String text) {
        Objects.requireNonNull(text, "text must not be null");
        if (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Line text must not contain line terminators: " + text);
        }
    }
}
