package io.sourcexform.cli.app;

import io.sourcexform.core.model.BatchReport;
import java.io.PrintStream;

/** Prints a batch report: one line per rule outcome, a summary per file, and a batch summary. */
final class ReportPrinter {

    private ReportPrinter() {}

    static void print(BatchReport report, PrintStream out) {
        report.formatLines().forEach(out::println);
        out.flush();
    }
}
