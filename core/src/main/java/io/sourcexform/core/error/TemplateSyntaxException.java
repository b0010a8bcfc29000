package io.sourcexform.core.error;

/**
 * Thrown when a variant template cannot be parsed or rendered: unterminated {@code ${...}},
 * unknown names, recursive names, or {@code ${variant}} used outside a variant context.
 */
public final class TemplateSyntaxException extends MigrationLoadException {

    private static final long serialVersionUID = 1L;

    public TemplateSyntaxException(String message) {
        super(message, null, null);
    }

    public TemplateSyntaxException(String message, Throwable cause, String migrationId, String source) {
        super(message, cause, migrationId, source);
    }
}
