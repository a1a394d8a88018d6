package com.hcltech.causal.calculus.dsep;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Verdict of a d-separation query. The path lists are only filled when
 * {@link DSeparationOptions#includePathDetails()} was set.
 */
public record DSeparationResult(
        boolean separated,
        Set<String> conditioningSet,
        List<PathStatus> blockingPaths,
        List<PathStatus> openPaths,
        String explanation
) {
    public DSeparationResult {
        conditioningSet = Collections.unmodifiableSet(new LinkedHashSet<>(conditioningSet));
        blockingPaths = List.copyOf(blockingPaths);
        openPaths = List.copyOf(openPaths);
    }
}
