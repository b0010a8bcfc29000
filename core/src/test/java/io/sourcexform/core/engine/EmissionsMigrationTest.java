package io.sourcexform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.sourcexform.core.model.EditEntry;
import io.sourcexform.core.model.EditReport;
import io.sourcexform.core.model.SessionResult;
import io.sourcexform.core.spec.MigrationSpec;
import io.sourcexform.core.spec.MigrationSpecParser;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * End-to-end run of the scope fan-out migration over a Go handler that only implements scope 2.
 * The handler has two functions calling the calculator, so the fan-out must happen once in each.
 */
@DisplayName("EmissionsMigrationTest")
class EmissionsMigrationTest {

    private MigrationSpec migration;
    private Path target;

    @TempDir
    Path tempDir;

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(EmissionsMigrationTest.class.getClassLoader().getResource(name).toURI());
    }

    @BeforeEach
    void setUp() throws Exception {
        migration = new MigrationSpecParser().parse(resource("migrations/emissions-scopes.yaml"));
        target = tempDir.resolve("emissions_handler.go");
        Files.copy(resource("fixtures/emissions_handler.go"), target);
    }

    @Test
    @DisplayName("First run → file equals the hand-migrated handler")
    void migratesHandler() throws Exception {
        SessionResult result = new PatchSession(migration).run(target, false);

        assertThat(result.isAborted()).isFalse();
        assertThat(result.written()).isTrue();
        assertThat(Files.readString(target))
                .isEqualTo(Files.readString(resource("fixtures/emissions_handler.expected.go")));
    }

    @Test
    @DisplayName("First run → every rule reported, placeholders resolved for scopes 1 and 3 only")
    void reportsEveryRule() {
        EditReport report = new PatchSession(migration).run(target, false).report();

        for (String rule : new String[] {
            "config-fields",
            "handler-fields",
            "constructor-fields",
            "summary-totals",
            "list-response",
            "list-loop",
            "list-page-info"
        }) {
            assertThat(report.entriesFor(rule))
                    .as(rule)
                    .singleElement()
                    .extracting(EditEntry::outcome)
                    .isEqualTo(EditEntry.Outcome.APPLIED);
        }
        assertThat(report.entriesFor("summary-calls"))
                .as("ListEmissions and Summary each fanned out")
                .extracting(EditEntry::outcome)
                .containsExactly(EditEntry.Outcome.APPLIED, EditEntry.Outcome.APPLIED);
        assertThat(report.entriesFor("summary-placeholders"))
                .extracting(EditEntry::outcome)
                .containsExactly(EditEntry.Outcome.APPLIED, EditEntry.Outcome.SKIPPED, EditEntry.Outcome.APPLIED);
        assertThat(report.entriesFor("summary-placeholders").get(1).reason()).isEqualTo("already applied");
        assertThat(report.entriesFor("summary-grand-total")).hasSize(1);
        assertThat(report.entriesFor("summary-count")).hasSize(1);
        assertThat(report.entriesFor("csrd-calls"))
                .containsExactly(EditEntry.skipped("csrd-calls", 0, "anchor not found"));
    }

    @Test
    @DisplayName("Second run → no rule applies, file not rewritten")
    void secondRunIsNoOp() throws IOException {
        new PatchSession(migration).run(target, false);
        String migrated = Files.readString(target);

        SessionResult second = new PatchSession(migration).run(target, false);

        assertThat(second.isAborted()).isFalse();
        assertThat(second.changed()).isFalse();
        assertThat(second.written()).isFalse();
        assertThat(second.report().appliedCount()).isZero();
        assertThat(Files.readString(target)).isEqualTo(migrated);
    }

    @Test
    @DisplayName("Dry run → reports the changes, leaves the handler as it was")
    void dryRun() throws Exception {
        String before = Files.readString(target);

        SessionResult result = new PatchSession(migration).run(target, true);

        assertThat(result.changed()).isTrue();
        assertThat(result.report().appliedCount()).isGreaterThanOrEqualTo(13);
        assertThat(Files.readString(target)).isEqualTo(before);
    }
}
