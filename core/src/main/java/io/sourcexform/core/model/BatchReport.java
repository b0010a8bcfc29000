package io.sourcexform.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate of the sessions of one batch run, in target order.
 *
 * @param migrationId migration that was applied
 * @param dryRun      whether writes were suppressed
 * @param results     per-target results
 */
public record BatchReport(String migrationId, boolean dryRun, List<SessionResult> results) {

    public BatchReport {
        results = List.copyOf(results);
    }

    /** 0 when every session completed, 1 when any session aborted. */
    public int exitCode() {
        return results.stream().anyMatch(SessionResult::isAborted) ? 1 : 0;
    }

    public long completedCount() {
        return results.stream().filter(r -> !r.isAborted()).count();
    }

    public long abortedCount() {
        return results.stream().filter(SessionResult::isAborted).count();
    }

    public long changedCount() {
        return results.stream().filter(SessionResult::changed).count();
    }

    public String summary() {
        return String.format(
                "%s%s: %d file(s), %d completed, %d changed, %d aborted",
                migrationId,
                dryRun ? " (dry run)" : "",
                results.size(),
                completedCount(),
                changedCount(),
                abortedCount());
    }

    /** Every session's report lines, abort reasons, and the batch summary last. */
    public List<String> formatLines() {
        List<String> lines = new ArrayList<>();
        for (SessionResult result : results) {
            lines.addAll(result.report().formatLines());
            if (result.isAborted()) {
                String where = result.failedRule() != null ? " in rule " + result.failedRule() : "";
                lines.add(result.target() + ": ABORTED" + where + ": "
                        + result.failure().getMessage());
            } else if (result.changed() && !result.written()) {
                lines.add(result.target() + ": would change (not written)");
            }
        }
        lines.add(summary());
        return lines;
    }
}
