package io.sourcexform.core.spec;

import io.sourcexform.core.model.VariantSet;
import io.sourcexform.core.scan.LexicalSyntax;
import io.sourcexform.core.spi.MutationRule;
import java.nio.charset.Charset;
import java.util.List;
import java.util.Objects;

/**
 * A parsed, validated migration: the variants to fan out to and the ordered rules that do it.
 * Immutable; shared by every session of a batch.
 *
 * @param id          migration identifier
 * @param version     migration version
 * @param description optional human-readable description
 * @param variants    variants in fan-out order
 * @param syntax      lexical conventions of the target files
 * @param charset     encoding of the target files
 * @param rules       rules in execution order
 * @param targets     default target files, relative to the base directory; may be empty
 * @param source      file or resource the migration was loaded from
 */
public record MigrationSpec(
        String id,
        String version,
        String description,
        VariantSet variants,
        LexicalSyntax syntax,
        Charset charset,
        List<MutationRule> rules,
        List<String> targets,
        String source) {

    public MigrationSpec {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(variants, "variants must not be null");
        Objects.requireNonNull(syntax, "syntax must not be null");
        Objects.requireNonNull(charset, "charset must not be null");
        rules = List.copyOf(rules);
        targets = List.copyOf(targets);
    }

    /** {@code id@version}. */
    public String displayName() {
        return id + "@" + version;
    }
}
