package io.sourcexform.core.error;

/**
 * Thrown when a structural block never closes before the end of the buffer, or when the line
 * expected to open a block holds no opener. The migration's structural assumptions no longer
 * hold, so no further rule may run against the buffer.
 */
public final class UnbalancedRegionException extends PatchSessionException {

    private static final long serialVersionUID = 1L;

    private final int openerLine;

    public UnbalancedRegionException(String message, int openerLine) {
        super(message, null);
        this.openerLine = openerLine;
    }

    /** Zero-based index of the line the extraction started from. */
    public int openerLine() {
        return openerLine;
    }
}
