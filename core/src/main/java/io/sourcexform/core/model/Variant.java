package io.sourcexform.core.model;

import java.util.Objects;

/**
 * One member of a {@link VariantSet}.
 *
 * @param token the text substituted for {@code ${variant}}, e.g. {@code "2"}
 * @param index 1-based position in the set, substituted for {@code ${index}}
 */
public record Variant(String token, int index) {

    public Variant {
        Objects.requireNonNull(token, "token must not be null");
        if (index < 1) {
            throw new IllegalArgumentException("index must be >= 1, was " + index);
        }
    }
}
