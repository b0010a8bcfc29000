package io.sourcexform.core.engine;

import io.sourcexform.core.buffer.SourceBuffer;
import io.sourcexform.core.buffer.SourceLoader;
import io.sourcexform.core.buffer.SourceWriter;
import io.sourcexform.core.error.PatchSessionException;
import io.sourcexform.core.model.EditEntry;
import io.sourcexform.core.model.EditReport;
import io.sourcexform.core.model.SessionResult;
import io.sourcexform.core.scan.RegionExtractor;
import io.sourcexform.core.spec.MigrationSpec;
import io.sourcexform.core.spi.MutationRule;
import io.sourcexform.core.spi.RuleContext;
import io.sourcexform.core.spi.SessionListener;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Applies a migration to one target file: load, run every rule in order against the same buffer,
 * persist once. A {@link PatchSessionException} aborts the session and leaves the file untouched.
 *
 * <p>
 * A session instance is stateless between runs; {@link #run} may be called concurrently for
 * different targets.
 */
public final class PatchSession {

    private static final Logger LOG = LoggerFactory.getLogger(PatchSession.class);

    /** MDC key holding the session's target file. */
    public static final String MDC_FILE = "file";
    /** MDC key holding the rule currently running. */
    public static final String MDC_RULE = "rule";

    private final MigrationSpec migration;
    private final SessionListener listener;
    private final RegionExtractor extractor;
    private final SourceLoader loader;
    private final SourceWriter writer;

    public PatchSession(MigrationSpec migration) {
        this(migration, null);
    }

    /**
     * @param migration the migration to apply
     * @param listener  optional listener for session events, may be {@code null}
     */
    public PatchSession(MigrationSpec migration, SessionListener listener) {
        this.migration = Objects.requireNonNull(migration, "migration must not be null");
        this.listener = listener; // nullable
        this.extractor = new RegionExtractor(migration.syntax());
        this.loader = new SourceLoader(migration.charset());
        this.writer = new SourceWriter(migration.charset());
    }

    public MigrationSpec migration() {
        return migration;
    }

    /**
     * Runs every rule against an in-memory buffer, mutating it. No listener is notified.
     *
     * @param buffer buffer to patch
     * @param label  name used for the report's target
     * @return the report of the rule outcomes
     * @throws io.sourcexform.core.error.UnbalancedRegionException if a rule cannot bound a block
     */
    public EditReport apply(SourceBuffer buffer, String label) {
        EditReport report = new EditReport(label);
        RuleContext context = new RuleContext(report, extractor);
        for (MutationRule rule : migration.rules()) {
            rule.apply(buffer, context);
        }
        return report;
    }

    /**
     * Patches the target file.
     *
     * @param target file to patch
     * @param dryRun compute and report without writing
     * @return the session outcome; aborts are reported, never thrown
     */
    public SessionResult run(Path target, boolean dryRun) {
        Objects.requireNonNull(target, "target must not be null");
        long start = System.nanoTime();
        EditReport report = new EditReport(target.toString());
        String currentRule = null;
        MDC.put(MDC_FILE, target.toString());
        try {
            notifyStarted(target);
            SourceBuffer buffer = loader.load(target);
            String original = buffer.serialize();
            RuleContext context = new RuleContext(report, extractor, entry -> notifyEntry(target, entry));
            for (MutationRule rule : migration.rules()) {
                currentRule = rule.name();
                MDC.put(MDC_RULE, currentRule);
                rule.apply(buffer, context);
            }
            MDC.remove(MDC_RULE);
            currentRule = null;

            boolean changed = buffer.isModified() && !buffer.serialize().equals(original);
            boolean written = false;
            if (changed && !dryRun) {
                writer.write(target, buffer);
                written = true;
            }
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            LOG.info(
                    "Session completed: migration={}, file={}, applied={}, skipped={}, changed={}, written={},"
                            + " duration_ms={}",
                    migration.displayName(),
                    target,
                    report.appliedCount(),
                    report.skippedCount(),
                    changed,
                    written,
                    durationMs);
            notifyCompleted(target, report, changed, written, durationMs);
            return SessionResult.completed(target, report, changed, written);
        } catch (PatchSessionException e) {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            LOG.warn(
                    "Session aborted: migration={}, file={}, rule={}, reason={}",
                    migration.displayName(),
                    target,
                    currentRule,
                    e.getMessage());
            notifyAborted(target, currentRule, e, durationMs);
            return SessionResult.aborted(target, report, currentRule, e);
        } finally {
            MDC.remove(MDC_RULE);
            MDC.remove(MDC_FILE);
        }
    }

    // --- Listener notification ---

    private void notifyStarted(Path target) {
        if (listener == null) return;
        try {
            listener.onSessionStarted(new SessionListener.SessionStartedEvent(migration.id(), target));
        } catch (Exception e) {
            LOG.warn("SessionListener.onSessionStarted failed", e);
        }
    }

    private void notifyEntry(Path target, EditEntry entry) {
        if (listener == null) return;
        try {
            if (entry.outcome() == EditEntry.Outcome.APPLIED) {
                listener.onRuleApplied(new SessionListener.RuleAppliedEvent(
                        migration.id(), target, entry.ruleName(), entry.line(), entry.reason()));
            } else {
                listener.onRuleSkipped(new SessionListener.RuleSkippedEvent(
                        migration.id(), target, entry.ruleName(), entry.line(), entry.reason()));
            }
        } catch (Exception e) {
            LOG.warn("SessionListener rule notification failed", e);
        }
    }

    private void notifyCompleted(Path target, EditReport report, boolean changed, boolean written, long durationMs) {
        if (listener == null) return;
        try {
            listener.onSessionCompleted(new SessionListener.SessionCompletedEvent(
                    migration.id(),
                    target,
                    report.appliedCount(),
                    report.skippedCount(),
                    changed,
                    written,
                    durationMs));
        } catch (Exception e) {
            LOG.warn("SessionListener.onSessionCompleted failed", e);
        }
    }

    private void notifyAborted(Path target, String rule, PatchSessionException cause, long durationMs) {
        if (listener == null) return;
        try {
            listener.onSessionAborted(new SessionListener.SessionAbortedEvent(
                    migration.id(), target, rule, cause.getMessage(), durationMs));
        } catch (Exception e) {
            LOG.warn("SessionListener.onSessionAborted failed", e);
        }
    }
}
