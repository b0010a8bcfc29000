package io.sourcexform.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/** Ordered, non-empty, duplicate-free list of variants a migration fans out to. */
public final class VariantSet implements Iterable<Variant> {

    private final List<Variant> variants;

    private VariantSet(List<Variant> variants) {
        this.variants = Collections.unmodifiableList(variants);
    }

    /**
     * @param tokens variant tokens in fan-out order
     * @throws IllegalArgumentException if the list is empty, or holds blank or duplicate tokens
     */
    public static VariantSet of(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            throw new IllegalArgumentException("variant set must not be empty");
        }
        Set<String> seen = new HashSet<>();
        List<Variant> variants = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            if (token == null || token.isBlank()) {
                throw new IllegalArgumentException("variant tokens must not be blank");
            }
            if (!seen.add(token)) {
                throw new IllegalArgumentException("duplicate variant: " + token);
            }
            variants.add(new Variant(token, variants.size() + 1));
        }
        return new VariantSet(variants);
    }

    public static VariantSet of(String... tokens) {
        return of(List.of(tokens));
    }

    public List<Variant> asList() {
        return variants;
    }

    public List<String> tokens() {
        return variants.stream().map(Variant::token).toList();
    }

    public int size() {
        return variants.size();
    }

    public Variant get(int position) {
        return variants.get(position);
    }

    @Override
    public Iterator<Variant> iterator() {
        return variants.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof VariantSet other && variants.equals(other.variants);
    }

    @Override
    public int hashCode() {
        return variants.hashCode();
    }

    @Override
    public String toString() {
        return tokens().toString();
    }
}
