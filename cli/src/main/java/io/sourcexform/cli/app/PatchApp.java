package io.sourcexform.cli.app;

import io.sourcexform.cli.config.CliArguments;
import io.sourcexform.cli.config.CliConfig;
import io.sourcexform.cli.config.ConfigLoadException;
import io.sourcexform.cli.config.ConfigLoader;
import io.sourcexform.core.engine.PatchEngine;
import io.sourcexform.core.error.MigrationLoadException;
import io.sourcexform.core.model.BatchReport;
import io.sourcexform.core.model.RunOptions;
import io.sourcexform.core.spec.MigrationSpec;
import io.sourcexform.core.spec.MigrationSpecParser;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates one batch run.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Parse the command line</li>
 * <li>Load configuration from YAML + env overlay, then apply command-line overrides</li>
 * <li>Configure Logback from {@code logging.format} and {@code logging.level}</li>
 * <li>Load and validate the migration spec</li>
 * <li>Resolve targets: command line, else configuration, else the migration spec</li>
 * <li>Run one session per target and print the report</li>
 * </ol>
 *
 * <p>
 * Separate from {@link io.sourcexform.cli.SourceXformMain} so tests can run the whole sequence
 * without {@code System.exit}.
 */
public final class PatchApp {

    private static final Logger LOG = LoggerFactory.getLogger(PatchApp.class);

    /** All sessions completed. */
    public static final int EXIT_OK = 0;
    /** At least one session aborted. */
    public static final int EXIT_ABORTED = 1;
    /** Usage, configuration or migration spec error; no file was touched. */
    public static final int EXIT_USAGE = 2;

    private final Function<String, String> envLookup;
    private final Path workingDir;
    private final PrintStream out;

    public PatchApp(PrintStream out) {
        this(System::getenv, Path.of(""), out);
    }

    /**
     * @param envLookup  environment variable lookup
     * @param workingDir directory the default configuration file is looked up in
     * @param out        destination of the edit report
     */
    public PatchApp(Function<String, String> envLookup, Path workingDir, PrintStream out) {
        this.envLookup = Objects.requireNonNull(envLookup, "envLookup must not be null");
        this.workingDir = Objects.requireNonNull(workingDir, "workingDir must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    /**
     * Runs the batch.
     *
     * @return the process exit status
     */
    public int run(String[] args) {
        CliArguments arguments;
        try {
            arguments = CliArguments.parse(args);
        } catch (IllegalArgumentException e) {
            out.println("error: " + e.getMessage());
            out.println(CliArguments.USAGE);
            return EXIT_USAGE;
        }
        if (arguments.help()) {
            out.println(CliArguments.USAGE);
            return EXIT_OK;
        }

        try {
            CliConfig config = resolveConfig(arguments);
            LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());

            if (config.specPath() == null || config.specPath().isBlank()) {
                throw new IllegalArgumentException(
                        "No migration spec given: use --spec, migration.spec or SOURCEXFORM_SPEC");
            }
            PatchEngine engine = new PatchEngine(new MigrationSpecParser(), new LoggingSessionListener());
            MigrationSpec migration = engine.loadMigration(Path.of(config.specPath()));

            List<Path> targets = resolveTargets(arguments, config, migration);
            BatchReport report =
                    engine.run(migration, targets, new RunOptions(config.dryRun(), config.parallelism()));
            ReportPrinter.print(report, out);
            return report.exitCode() == 0 ? EXIT_OK : EXIT_ABORTED;
        } catch (ConfigLoadException | MigrationLoadException | IllegalArgumentException e) {
            LOG.error("{}", e.getMessage());
            out.println("error: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    private CliConfig resolveConfig(CliArguments arguments) {
        CliConfig base;
        if (arguments.configPath() != null) {
            base = ConfigLoader.load(arguments.configPath(), envLookup);
        } else {
            Path defaultPath = workingDir.resolve(ConfigLoader.DEFAULT_CONFIG_FILE);
            base = Files.exists(defaultPath)
                    ? ConfigLoader.load(defaultPath, envLookup)
                    : ConfigLoader.defaults(envLookup);
        }
        return CliConfig.builder()
                .specPath(arguments.specPath() != null ? arguments.specPath() : base.specPath())
                .baseDir(arguments.baseDir() != null ? arguments.baseDir() : base.baseDir())
                .targets(base.targets())
                .dryRun(arguments.dryRun() || base.dryRun())
                .parallelism(arguments.parallelism() != null ? arguments.parallelism() : base.parallelism())
                .loggingFormat(base.loggingFormat())
                .loggingLevel(base.loggingLevel())
                .build();
    }

    private static List<Path> resolveTargets(CliArguments arguments, CliConfig config, MigrationSpec migration) {
        List<String> names;
        if (!arguments.targets().isEmpty()) {
            names = arguments.targets();
        } else if (!config.targets().isEmpty()) {
            names = config.targets();
        } else {
            names = migration.targets();
        }
        if (names.isEmpty()) {
            throw new IllegalArgumentException("No target files: pass them as arguments or list them in"
                    + " migration.targets or the migration spec's targets");
        }
        Path baseDir = Path.of(config.baseDir());
        return names.stream().map(baseDir::resolve).toList();
    }
}
