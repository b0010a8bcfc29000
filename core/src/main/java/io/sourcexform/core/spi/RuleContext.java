package io.sourcexform.core.spi;

import io.sourcexform.core.model.EditEntry;
import io.sourcexform.core.model.EditReport;
import io.sourcexform.core.scan.RegionExtractor;
import java.util.Objects;
import java.util.function.Consumer;

/** Per-session services handed to a {@link MutationRule}: region extraction and outcome recording. */
public final class RuleContext {

    private final EditReport report;
    private final RegionExtractor extractor;
    private final Consumer<EditEntry> observer;

    public RuleContext(EditReport report, RegionExtractor extractor) {
        this(report, extractor, entry -> {});
    }

    public RuleContext(EditReport report, RegionExtractor extractor, Consumer<EditEntry> observer) {
        this.report = Objects.requireNonNull(report, "report must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.observer = Objects.requireNonNull(observer, "observer must not be null");
    }

    public EditReport report() {
        return report;
    }

    public RegionExtractor extractor() {
        return extractor;
    }

    /**
     * @param line 0-based anchor line; stored 1-based
     */
    public void applied(String ruleName, int line, String reason) {
        record(EditEntry.applied(ruleName, line + 1, reason));
    }

    /**
     * @param line 0-based anchor line, or -1 when no line matched
     */
    public void skipped(String ruleName, int line, String reason) {
        record(EditEntry.skipped(ruleName, line + 1, reason));
    }

    private void record(EditEntry entry) {
        report.add(entry);
        observer.accept(entry);
    }
}
