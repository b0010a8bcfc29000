package io.sourcexform.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Append-only log of rule outcomes for one patch session. A report with zero applied entries is a
 * valid outcome: the file already carried every change.
 */
public final class EditReport {

    private final String target;
    private final List<EditEntry> entries = new ArrayList<>();

    public EditReport(String target) {
        this.target = Objects.requireNonNull(target, "target must not be null");
    }

    public String target() {
        return target;
    }

    public void add(EditEntry entry) {
        entries.add(Objects.requireNonNull(entry, "entry must not be null"));
    }

    public List<EditEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public List<EditEntry> entriesFor(String ruleName) {
        return entries.stream().filter(e -> e.ruleName().equals(ruleName)).toList();
    }

    public long appliedCount() {
        return entries.stream()
                .filter(e -> e.outcome() == EditEntry.Outcome.APPLIED)
                .count();
    }

    public long skippedCount() {
        return entries.stream()
                .filter(e -> e.outcome() == EditEntry.Outcome.SKIPPED)
                .count();
    }

    /** {@code "<target>: N applied, M skipped"}. */
    public String summary() {
        return target + ": " + appliedCount() + " applied, " + skippedCount() + " skipped";
    }

    /** One indented line per entry, followed by the summary line. */
    public List<String> formatLines() {
        List<String> lines = new ArrayList<>(entries.size() + 1);
        for (EditEntry entry : entries) {
            lines.add("  " + entry.format());
        }
        lines.add(summary());
        return lines;
    }
}
