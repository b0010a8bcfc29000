package io.sourcexform.core.buffer;

import io.sourcexform.core.error.SourceIoException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads a file into a {@link SourceBuffer}. Decoding is strict: malformed input is reported rather
 * than replaced, because a lossy decode would break the byte-identical round trip.
 */
public final class SourceLoader {

    private final Charset charset;

    public SourceLoader() {
        this(StandardCharsets.UTF_8);
    }

    public SourceLoader(Charset charset) {
        this.charset = Objects.requireNonNull(charset, "charset must not be null");
    }

    /**
     * @param path file to read
     * @return a buffer whose serialization equals the file content
     * @throws SourceIoException if the file cannot be read or is not valid in the configured charset
     */
    public SourceBuffer load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        try {
            byte[] bytes = Files.readAllBytes(path);
            String content = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return SourceBuffer.of(content);
        } catch (CharacterCodingException e) {
            throw new SourceIoException("File is not valid " + charset.name() + ": " + path, e, path);
        } catch (IOException e) {
            throw new SourceIoException("Failed to read " + path + ": " + e.getMessage(), e, path);
        }
    }
}
