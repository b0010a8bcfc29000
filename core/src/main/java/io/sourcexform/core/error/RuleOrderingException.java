package io.sourcexform.core.error;

/**
 * Thrown at load time when a rule references a name that only a later rule introduces. Running
 * such a migration would emit a reference to an undeclared name, so it is rejected before any
 * session starts.
 */
public final class RuleOrderingException extends MigrationLoadException {

    private static final long serialVersionUID = 1L;

    private final String ruleName;
    private final String referencedName;

    public RuleOrderingException(
            String message, String migrationId, String source, String ruleName, String referencedName) {
        super(message, migrationId, source);
        this.ruleName = ruleName;
        this.referencedName = referencedName;
    }

    /** The rule holding the premature reference. */
    public String ruleName() {
        return ruleName;
    }

    /** The name referenced before it was introduced. */
    public String referencedName() {
        return referencedName;
    }
}
