package io.sourcexform.core.error;

import java.nio.file.Path;

/**
 * Abstract parent for errors that abort a patch session. The session's target file is never
 * written once one of these is thrown; other sessions of the same batch continue.
 */
public abstract class PatchSessionException extends SourceXformException {

    private static final long serialVersionUID = 1L;

    private final transient Path path;

    protected PatchSessionException(String message, Path path) {
        super(message, null, Phase.SESSION);
        this.path = path;
    }

    protected PatchSessionException(String message, Throwable cause, Path path) {
        super(message, cause, null, Phase.SESSION);
        this.path = path;
    }

    /** The target file of the aborted session, or {@code null} for in-memory buffers. */
    public Path path() {
        return path;
    }
}
