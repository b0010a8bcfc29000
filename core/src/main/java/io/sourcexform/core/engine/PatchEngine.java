package io.sourcexform.core.engine;

import io.sourcexform.core.error.MigrationLoadException;
import io.sourcexform.core.model.BatchReport;
import io.sourcexform.core.model.RunOptions;
import io.sourcexform.core.model.SessionResult;
import io.sourcexform.core.spec.MigrationSpec;
import io.sourcexform.core.spec.MigrationSpecParser;
import io.sourcexform.core.spi.SessionListener;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads migration specs and runs them over batches of target files, one {@link PatchSession} per
 * file. Sessions share no mutable state, so a batch may run on a fixed thread pool; results are
 * always returned in target order, and an aborted session never stops the others.
 *
 * <p>
 * Thread-safe.
 */
public final class PatchEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PatchEngine.class);

    private final MigrationSpecParser parser;
    private final SessionListener listener;
    private final Map<String, MigrationSpec> migrations = new ConcurrentHashMap<>();

    public PatchEngine(MigrationSpecParser parser) {
        this(parser, null);
    }

    /**
     * @param parser   migration spec parser
     * @param listener optional listener passed to every session, may be {@code null}
     */
    public PatchEngine(MigrationSpecParser parser, SessionListener listener) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.listener = listener; // nullable
    }

    /**
     * Loads and registers a migration spec, replacing any earlier one with the same id.
     *
     * @throws MigrationLoadException if the spec is invalid
     */
    public MigrationSpec loadMigration(Path path) {
        try {
            MigrationSpec spec = parser.parse(path);
            migrations.put(spec.id(), spec);
            LOG.info(
                    "Loaded migration: id={}, version={}, variants={}, rules={}, source={}",
                    spec.id(),
                    spec.version(),
                    spec.variants(),
                    spec.rules().size(),
                    path);
            return spec;
        } catch (MigrationLoadException e) {
            LOG.error("Rejected migration {}: {}", path, e.getMessage());
            throw e;
        }
    }

    public Optional<MigrationSpec> migration(String id) {
        return Optional.ofNullable(migrations.get(id));
    }

    public int migrationCount() {
        return migrations.size();
    }

    /**
     * Runs a migration over the given targets.
     *
     * @param migration migration to apply
     * @param targets   target files
     * @param options   dry-run and parallelism
     * @return one result per target, in the given order
     */
    public BatchReport run(MigrationSpec migration, List<Path> targets, RunOptions options) {
        Objects.requireNonNull(migration, "migration must not be null");
        Objects.requireNonNull(options, "options must not be null");
        PatchSession session = new PatchSession(migration, listener);
        LOG.info(
                "Running migration {} over {} file(s): dry_run={}, parallelism={}",
                migration.displayName(),
                targets.size(),
                options.dryRun(),
                options.parallelism());

        List<SessionResult> results;
        if (options.parallelism() == 1 || targets.size() <= 1) {
            results = new ArrayList<>(targets.size());
            for (Path target : targets) {
                results.add(session.run(target, options.dryRun()));
            }
        } else {
            results = runParallel(session, targets, options);
        }
        BatchReport report = new BatchReport(migration.id(), options.dryRun(), results);
        LOG.info(report.summary());
        return report;
    }

    private List<SessionResult> runParallel(PatchSession session, List<Path> targets, RunOptions options) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(options.parallelism(), targets.size()));
        try {
            List<Future<SessionResult>> futures = new ArrayList<>(targets.size());
            for (Path target : targets) {
                futures.add(pool.submit(() -> session.run(target, options.dryRun())));
            }
            List<SessionResult> results = new ArrayList<>(targets.size());
            for (Future<SessionResult> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for patch sessions", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Patch session failed unexpectedly", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }
}
