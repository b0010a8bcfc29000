package io.sourcexform.core.error;

/**
 * Abstract base for all source-xform exceptions. Never thrown directly: use the concrete
 * subclasses under {@link MigrationLoadException} or {@link PatchSessionException}.
 */
public abstract class SourceXformException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        SESSION
    }

    private final String migrationId;
    private final Phase phase;

    protected SourceXformException(String message, String migrationId, Phase phase) {
        super(message);
        this.migrationId = migrationId;
        this.phase = phase;
    }

    protected SourceXformException(String message, Throwable cause, String migrationId, Phase phase) {
        super(message, cause);
        this.migrationId = migrationId;
        this.phase = phase;
    }

    /** The migration that triggered the error, or {@code null} if not yet identified. */
    public String migrationId() {
        return migrationId;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
