package io.sourcexform.cli.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line. Options override the configuration file and the environment.
 *
 * @param configPath  {@code --config}, or {@code null}
 * @param specPath    {@code --spec}, or {@code null}
 * @param baseDir     {@code --base-dir}, or {@code null}
 * @param dryRun      {@code --dry-run} given
 * @param parallelism {@code --parallelism}, or {@code null}
 * @param help        {@code --help} given
 * @param targets     positional target files
 */
public record CliArguments(
        Path configPath,
        String specPath,
        String baseDir,
        boolean dryRun,
        Integer parallelism,
        boolean help,
        List<String> targets) {

    public static final String USAGE = String.join(
            System.lineSeparator(),
            "Usage: source-xform [--config FILE] [--spec FILE] [--dry-run] [--parallelism N]"
                    + " [--base-dir DIR] [TARGET...]",
            "",
            "  --config FILE      YAML configuration (default: ./" + ConfigLoader.DEFAULT_CONFIG_FILE + " if present)",
            "  --spec FILE        migration spec to apply",
            "  --dry-run          report changes without writing files",
            "  --parallelism N    number of files patched concurrently",
            "  --base-dir DIR     directory relative targets resolve against",
            "  --help             print this help",
            "",
            "Exit status: 0 all files completed, 1 a file was aborted, 2 usage or configuration error.");

    public CliArguments {
        targets = List.copyOf(targets);
    }

    /**
     * @throws IllegalArgumentException on an unknown option, a missing option value, or a
     *                                  non-numeric parallelism
     */
    public static CliArguments parse(String[] args) {
        Path config = null;
        String spec = null;
        String baseDir = null;
        boolean dryRun = false;
        Integer parallelism = null;
        boolean help = false;
        List<String> targets = new ArrayList<>();
        boolean optionsEnded = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (optionsEnded || !arg.startsWith("--")) {
                targets.add(arg);
                continue;
            }
            switch (arg) {
                case "--" -> optionsEnded = true;
                case "--config" -> config = Path.of(value(args, ++i, arg));
                case "--spec" -> spec = value(args, ++i, arg);
                case "--base-dir" -> baseDir = value(args, ++i, arg);
                case "--dry-run" -> dryRun = true;
                case "--help" -> help = true;
                case "--parallelism" -> {
                    String value = value(args, ++i, arg);
                    try {
                        parallelism = Integer.parseInt(value);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("--parallelism requires an integer, was '" + value + "'");
                    }
                    if (parallelism < 1) {
                        throw new IllegalArgumentException("--parallelism must be >= 1, was " + parallelism);
                    }
                }
                default -> throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }
        return new CliArguments(config, spec, baseDir, dryRun, parallelism, help, targets);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }
}
