package com.hcltech.causal.calculus.dsep;

import com.hcltech.causal.calculus.config.EngineConfig;

/**
 * @param includePathDetails whether {@link DSeparationResult} lists every path with its status
 * @param maxPathLength      path length limit in edges; 0 means no limit
 */
public record DSeparationOptions(boolean includePathDetails, int maxPathLength) {
    public DSeparationOptions {
        if (maxPathLength < 0) throw new IllegalArgumentException("maxPathLength must be >= 0 but was " + maxPathLength);
    }

    public static DSeparationOptions defaults() {
        return new DSeparationOptions(false, 0);
    }

    public static DSeparationOptions from(EngineConfig config) {
        return new DSeparationOptions(false, config.maxPathLength());
    }

    public DSeparationOptions withPathDetails() {
        return new DSeparationOptions(true, maxPathLength);
    }
}
