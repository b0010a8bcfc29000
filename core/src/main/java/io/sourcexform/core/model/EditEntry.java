package io.sourcexform.core.model;

import java.util.Objects;

/**
 * One rule outcome in an {@link EditReport}.
 *
 * @param ruleName rule that produced the entry
 * @param outcome  applied or skipped
 * @param line     1-based line of the anchor, or 0 when the rule matched no line
 * @param reason   short explanation; {@code null} for plain applications
 */
public record EditEntry(String ruleName, Outcome outcome, int line, String reason) {

    /** What a rule did at one anchor. */
    public enum Outcome {
        APPLIED,
        SKIPPED
    }

    public EditEntry {
        Objects.requireNonNull(ruleName, "ruleName must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
    }

    public static EditEntry applied(String ruleName, int line, String reason) {
        return new EditEntry(ruleName, Outcome.APPLIED, line, reason);
    }

    public static EditEntry skipped(String ruleName, int line, String reason) {
        return new EditEntry(ruleName, Outcome.SKIPPED, line, reason);
    }

    /** Single report line, e.g. {@code "SKIPPED summary-calls (line 41): already applied"}. */
    public String format() {
        StringBuilder out = new StringBuilder();
        out.append(outcome.name()).append(' ').append(ruleName);
        if (line > 0) {
            out.append(" (line ").append(line).append(')');
        }
        if (reason != null && !reason.isEmpty()) {
            out.append(": ").append(reason);
        }
        return out.toString();
    }
}
