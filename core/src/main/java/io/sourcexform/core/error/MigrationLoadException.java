package io.sourcexform.core.error;

/**
 * Abstract parent for load-time errors. Thrown while a migration spec is parsed and validated,
 * before any session runs. Carries the file or resource that caused the error.
 */
public abstract class MigrationLoadException extends SourceXformException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected MigrationLoadException(String message, String migrationId, String source) {
        super(message, migrationId, Phase.LOAD);
        this.source = source;
    }

    protected MigrationLoadException(String message, Throwable cause, String migrationId, String source) {
        super(message, cause, migrationId, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
