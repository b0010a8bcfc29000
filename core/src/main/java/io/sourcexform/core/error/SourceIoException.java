package io.sourcexform.core.error;

import java.nio.file.Path;

/** Thrown when a target file cannot be read, decoded or atomically replaced. */
public final class SourceIoException extends PatchSessionException {

    private static final long serialVersionUID = 1L;

    public SourceIoException(String message, Throwable cause, Path path) {
        super(message, cause, path);
    }
}
