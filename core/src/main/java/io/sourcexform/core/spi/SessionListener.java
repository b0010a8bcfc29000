package io.sourcexform.core.spi;

import java.nio.file.Path;

/**
 * Observability hook for patch sessions.
 *
 * <p>
 * Events are immutable. Implementations must be thread-safe because sessions of one batch may run
 * in parallel. Exceptions thrown by a listener are caught and logged by the session; they never
 * change its outcome.
 */
public interface SessionListener {

    /** Called before the target file is loaded. */
    void onSessionStarted(SessionStartedEvent event);

    /** Called each time a rule transforms one anchor occurrence. */
    void onRuleApplied(RuleAppliedEvent event);

    /** Called each time a rule declines an anchor occurrence, or finds none. */
    void onRuleSkipped(RuleSkippedEvent event);

    /** Called when every rule has run, after the file was written (or not). */
    void onSessionCompleted(SessionCompletedEvent event);

    /** Called when the session aborts; the target file is untouched. */
    void onSessionAborted(SessionAbortedEvent event);

    // --- Event records ---

    /** Event emitted when a session starts. */
    record SessionStartedEvent(String migrationId, Path target) {}

    /** Event emitted when a rule is applied at one anchor. Line is 1-based. */
    record RuleAppliedEvent(String migrationId, Path target, String ruleName, int line, String detail) {}

    /** Event emitted when a rule is skipped. Line is 1-based, 0 when no anchor matched. */
    record RuleSkippedEvent(String migrationId, Path target, String ruleName, int line, String reason) {}

    /** Event emitted when a session completes. */
    record SessionCompletedEvent(
            String migrationId,
            Path target,
            long applied,
            long skipped,
            boolean changed,
            boolean written,
            long durationMs) {}

    /** Event emitted when a session aborts. */
    record SessionAbortedEvent(
            String migrationId, Path target, String ruleName, String errorDetail, long durationMs) {}
}
