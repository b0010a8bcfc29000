package io.sourcexform.core.error;

/** Thrown when a migration spec YAML file has invalid syntax, unknown keys or missing fields. */
public final class MigrationSpecParseException extends MigrationLoadException {

    private static final long serialVersionUID = 1L;

    public MigrationSpecParseException(String message, String migrationId, String source) {
        super(message, migrationId, source);
    }

    public MigrationSpecParseException(String message, Throwable cause, String migrationId, String source) {
        super(message, cause, migrationId, source);
    }
}
