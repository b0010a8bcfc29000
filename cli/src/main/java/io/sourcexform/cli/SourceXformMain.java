package io.sourcexform.cli;

import io.sourcexform.cli.app.PatchApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the {@code source-xform} command.
 *
 * <p>
 * Delegates to {@link PatchApp#run(String[])} and exits with its status. Unexpected failures are
 * logged and exit with status 1.
 */
public final class SourceXformMain {

    private static final Logger LOG = LoggerFactory.getLogger(SourceXformMain.class);

    private SourceXformMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments, e.g. {@code --spec migration.yaml src/handler.go}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status;
        try {
            status = new PatchApp(System.out).run(args);
        } catch (Exception e) {
            LOG.error("Run failed: {}", e.getMessage(), e);
            status = PatchApp.EXIT_ABORTED;
        }
        System.exit(status);
    }
}
