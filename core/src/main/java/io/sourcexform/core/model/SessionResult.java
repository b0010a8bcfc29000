package io.sourcexform.core.model;

import io.sourcexform.core.error.PatchSessionException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of one patch session.
 *
 * @param target     the session's target file
 * @param status     completed or aborted
 * @param report     rule outcomes recorded up to completion or abort
 * @param changed    whether the rules produced content different from the input
 * @param written    whether the file was replaced on disk
 * @param failedRule rule running when the session aborted, or {@code null}
 * @param failure    the abort cause, or {@code null}
 */
public record SessionResult(
        Path target,
        Status status,
        EditReport report,
        boolean changed,
        boolean written,
        String failedRule,
        PatchSessionException failure) {

    /** Terminal state of a session. */
    public enum Status {
        COMPLETED,
        ABORTED
    }

    public SessionResult {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(report, "report must not be null");
    }

    public static SessionResult completed(Path target, EditReport report, boolean changed, boolean written) {
        return new SessionResult(target, Status.COMPLETED, report, changed, written, null, null);
    }

    public static SessionResult aborted(
            Path target, EditReport report, String failedRule, PatchSessionException failure) {
        return new SessionResult(target, Status.ABORTED, report, false, false, failedRule, failure);
    }

    public boolean isAborted() {
        return status == Status.ABORTED;
    }
}
