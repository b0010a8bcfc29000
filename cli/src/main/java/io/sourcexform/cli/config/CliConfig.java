package io.sourcexform.cli.config;

import java.util.List;

/**
 * Configuration of a batch run. Use {@link #builder()} to construct instances with defaults.
 *
 * @param specPath      migration spec file, or {@code null} if not configured
 * @param baseDir       directory relative targets resolve against
 * @param targets       target files; empty means the migration spec's own list
 * @param dryRun        report without writing
 * @param parallelism   sessions run concurrently
 * @param loggingFormat {@code text} or {@code json}
 * @param loggingLevel  root log level
 */
public record CliConfig(
        String specPath,
        String baseDir,
        List<String> targets,
        boolean dryRun,
        int parallelism,
        String loggingFormat,
        String loggingLevel) {

    public CliConfig {
        targets = List.copyOf(targets);
    }

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CliConfig}. */
    public static final class Builder {

        private String specPath;
        private String baseDir = ".";
        private List<String> targets = List.of();
        private boolean dryRun;
        private int parallelism = 1;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        private Builder() {}

        public Builder specPath(String specPath) {
            this.specPath = specPath;
            return this;
        }

        public Builder baseDir(String baseDir) {
            this.baseDir = baseDir;
            return this;
        }

        public Builder targets(List<String> targets) {
            this.targets = targets;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public CliConfig build() {
            if (parallelism < 1) {
                throw new ConfigLoadException("run.parallelism must be >= 1, was " + parallelism);
            }
            return new CliConfig(specPath, baseDir, targets, dryRun, parallelism, loggingFormat, loggingLevel);
        }
    }
}
