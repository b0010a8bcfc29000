package io.sourcexform.core.model;

/**
 * Batch run options.
 *
 * @param dryRun      compute and report without writing any file
 * @param parallelism number of sessions run concurrently, at least 1
 */
public record RunOptions(boolean dryRun, int parallelism) {

    public static final RunOptions DEFAULT = new RunOptions(false, 1);

    public RunOptions {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, was " + parallelism);
        }
    }
}
