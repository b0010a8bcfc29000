package io.sourcexform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.sourcexform.core.rule.AnchoredRule;
import io.sourcexform.core.spec.MigrationSpec;
import io.sourcexform.core.spec.MigrationSpecParser;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/** Verifies session log lines and the file/rule MDC keys. */
@DisplayName("SessionLoggingTest")
class SessionLoggingTest {

    private final MigrationSpec migration = new MigrationSpecParser().parse(PatchSessionTest.MIGRATION, "inline");

    private Logger sessionLogger;
    private Logger ruleLogger;
    private Level ruleLevel;
    private ListAppender<ILoggingEvent> logAppender;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        sessionLogger = (Logger) LoggerFactory.getLogger(PatchSession.class);
        ruleLogger = (Logger) LoggerFactory.getLogger(AnchoredRule.class);
        ruleLevel = ruleLogger.getLevel();
        ruleLogger.setLevel(Level.DEBUG);

        // MDC is read lazily; snapshot it before the session clears its keys
        logAppender = new ListAppender<>() {
            @Override
            protected void append(ILoggingEvent event) {
                event.prepareForDeferredProcessing();
                super.append(event);
            }
        };
        logAppender.start();
        sessionLogger.addAppender(logAppender);
        ruleLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        sessionLogger.detachAppender(logAppender);
        ruleLogger.detachAppender(logAppender);
        ruleLogger.setLevel(ruleLevel);
        logAppender.stop();
        MDC.clear();
    }

    private ILoggingEvent event(String fragment) {
        return logAppender.list.stream()
                .filter(e -> e.getMessage() != null && e.getFormattedMessage().contains(fragment))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No log event containing: " + fragment));
    }

    @Test
    @DisplayName("Completed session → INFO summary with counts and the file MDC key")
    void completedSummary() throws IOException {
        Path file = tempDir.resolve("config.go");
        Files.writeString(file, PatchSessionTest.LEGACY);

        new PatchSession(migration).run(file, false);

        ILoggingEvent completed = event("Session completed");
        assertThat(completed.getLevel()).isEqualTo(Level.INFO);
        assertThat(completed.getFormattedMessage())
                .contains("migration=config-scopes@1.0.0")
                .contains("applied=1")
                .contains("skipped=1")
                .contains("written=true");
        assertThat(completed.getMDCPropertyMap()).containsEntry(PatchSession.MDC_FILE, file.toString());
        assertThat(MDC.get(PatchSession.MDC_FILE)).isNull();
    }

    @Test
    @DisplayName("Rule without a matching anchor → DEBUG line carrying the rule MDC key")
    void anchorNotFoundDebug() throws IOException {
        Path file = tempDir.resolve("config.go");
        Files.writeString(file, PatchSessionTest.LEGACY);

        new PatchSession(migration).run(file, false);

        ILoggingEvent notFound = event("Rule count: anchor not found");
        assertThat(notFound.getLevel()).isEqualTo(Level.DEBUG);
        assertThat(notFound.getMDCPropertyMap())
                .containsEntry(PatchSession.MDC_RULE, "count")
                .containsEntry(PatchSession.MDC_FILE, file.toString());
    }

    @Test
    @DisplayName("Aborted session → WARN naming the rule and reason")
    void abortedWarning() throws IOException {
        Path file = tempDir.resolve("broken.go");
        Files.writeString(file, "type Config struct {\n");

        new PatchSession(migration).run(file, false);

        ILoggingEvent aborted = event("Session aborted");
        assertThat(aborted.getLevel()).isEqualTo(Level.WARN);
        assertThat(aborted.getFormattedMessage())
                .contains("rule=config-fields")
                .contains("not closed before end of file");
    }
}
