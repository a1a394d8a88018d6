package com.hcltech.causal.calculus.dsep;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/** Is X independent of Y given Z? The three sets are expected to be disjoint but this is not checked. */
public record DSeparationQuery(Set<String> x, Set<String> y, Set<String> z) {
    public DSeparationQuery {
        x = ordered(Objects.requireNonNull(x, "x"));
        y = ordered(Objects.requireNonNull(y, "y"));
        z = z == null ? Set.of() : ordered(z);
    }

    public static DSeparationQuery of(Collection<String> x, Collection<String> y, Collection<String> z) {
        return new DSeparationQuery(new LinkedHashSet<>(x), new LinkedHashSet<>(y), new LinkedHashSet<>(z));
    }

    public static DSeparationQuery unconditional(Collection<String> x, Collection<String> y) {
        return of(x, y, Set.of());
    }

    private static Set<String> ordered(Set<String> s) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(s));
    }
}
