package io.sourcexform.core.template;

import io.sourcexform.core.model.VariantSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Names visible to a {@link Template} while rendering. A rule's own names shadow the
 * migration-level {@code names} map; the variant set is shared by every level.
 */
public final class TemplateScope {

    private final VariantSet variants;
    private final Map<String, Template> names;
    private final TemplateScope parent;

    private TemplateScope(VariantSet variants, Map<String, Template> names, TemplateScope parent) {
        this.variants = Objects.requireNonNull(variants, "variants must not be null");
        this.names = Map.copyOf(names);
        this.parent = parent;
    }

    public static TemplateScope root(VariantSet variants, Map<String, Template> names) {
        return new TemplateScope(variants, names, null);
    }

    public TemplateScope child(Map<String, Template> names) {
        return new TemplateScope(variants, names, this);
    }

    public VariantSet variants() {
        return variants;
    }

    public Optional<Template> lookup(String name) {
        Template local = names.get(name);
        if (local != null) {
            return Optional.of(local);
        }
        return parent == null ? Optional.empty() : parent.lookup(name);
    }
}
