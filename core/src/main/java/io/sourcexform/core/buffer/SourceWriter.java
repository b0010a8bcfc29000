package io.sourcexform.core.buffer;

import io.sourcexform.core.error.SourceIoException;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists a {@link SourceBuffer} with atomic-replace semantics: the content is written to a
 * temporary file next to the target, then moved over it. A failure at any point leaves the
 * original file untouched.
 */
public final class SourceWriter {

    private static final Logger LOG = LoggerFactory.getLogger(SourceWriter.class);

    private final Charset charset;

    public SourceWriter() {
        this(StandardCharsets.UTF_8);
    }

    public SourceWriter(Charset charset) {
        this.charset = Objects.requireNonNull(charset, "charset must not be null");
    }

    /**
     * @param target file to replace
     * @param buffer content to write
     * @throws SourceIoException if the temporary file cannot be written or moved into place
     */
    public void write(Path target, SourceBuffer buffer) {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(buffer, "buffer must not be null");
        Path absolute = target.toAbsolutePath();
        Path temp = null;
        try {
            temp = Files.createTempFile(absolute.getParent(), "." + absolute.getFileName() + ".", ".tmp");
            Files.write(temp, buffer.serialize().getBytes(charset));
            copyPermissions(absolute, temp);
            moveIntoPlace(temp, absolute);
        } catch (IOException e) {
            SourceIoException failure =
                    new SourceIoException("Failed to write " + target + ": " + e.getMessage(), e, target);
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported for {}, falling back to replacing move", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    // Temp files are created owner-only; the replaced file keeps the target's permissions.
    private static void copyPermissions(Path from, Path to) throws IOException {
        if (!Files.exists(from)) {
            return;
        }
        PosixFileAttributeView view = Files.getFileAttributeView(from, PosixFileAttributeView.class);
        if (view != null) {
            Files.setPosixFilePermissions(to, view.readAttributes().permissions());
        }
    }
}
