package io.sourcexform.cli.app;

import io.sourcexform.core.spi.SessionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes session events to the log: applications at INFO, skips and starts at DEBUG. */
final class LoggingSessionListener implements SessionListener {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingSessionListener.class);

    @Override
    public void onSessionStarted(SessionStartedEvent event) {
        LOG.debug("Patching {} with {}", event.target(), event.migrationId());
    }

    @Override
    public void onRuleApplied(RuleAppliedEvent event) {
        LOG.info(
                "Applied {} at {}:{}{}",
                event.ruleName(),
                event.target().getFileName(),
                event.line(),
                event.detail() != null ? " (" + event.detail() + ")" : "");
    }

    @Override
    public void onRuleSkipped(RuleSkippedEvent event) {
        LOG.debug(
                "Skipped {} at {}:{}: {}",
                event.ruleName(),
                event.target().getFileName(),
                event.line(),
                event.reason());
    }

    @Override
    public void onSessionCompleted(SessionCompletedEvent event) {
        LOG.debug("Finished {} in {} ms", event.target(), event.durationMs());
    }

    @Override
    public void onSessionAborted(SessionAbortedEvent event) {
        LOG.error("Aborted {} in rule {}: {}", event.target(), event.ruleName(), event.errorDetail());
    }
}
