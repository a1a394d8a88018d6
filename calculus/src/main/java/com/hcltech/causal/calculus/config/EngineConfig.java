package com.hcltech.causal.calculus.config;

import com.hcltech.causal.common.IEnvGetter;
import com.hcltech.causal.graph.PathFinder;

/**
 * Limits on the exponential searches the engine performs.
 *
 * @param maxPathLength          longest path, in edges, considered by d-separation; 0 means no limit
 * @param maxAdjustmentSetSize   largest backdoor or mediator set tried
 * @param maxSeparatorSize       largest set tried by the minimal separator search
 * @param maxConditioningSetSize largest conditioning set listed by implied independencies
 */
public record EngineConfig(
        int maxPathLength,
        int maxAdjustmentSetSize,
        int maxSeparatorSize,
        int maxConditioningSetSize
) {
    public static final String MAX_PATH_LENGTH_ENV = "CAUSAL_MAX_PATH_LENGTH";
    public static final String MAX_ADJUSTMENT_SET_SIZE_ENV = "CAUSAL_MAX_ADJUSTMENT_SET_SIZE";
    public static final String MAX_SEPARATOR_SIZE_ENV = "CAUSAL_MAX_SEPARATOR_SIZE";
    public static final String MAX_CONDITIONING_SET_SIZE_ENV = "CAUSAL_MAX_CONDITIONING_SET_SIZE";

    public EngineConfig {
        if (maxPathLength < 0) throw new IllegalArgumentException("maxPathLength must be >= 0 but was " + maxPathLength);
        if (maxAdjustmentSetSize < 0)
            throw new IllegalArgumentException("maxAdjustmentSetSize must be >= 0 but was " + maxAdjustmentSetSize);
        if (maxSeparatorSize < 0)
            throw new IllegalArgumentException("maxSeparatorSize must be >= 0 but was " + maxSeparatorSize);
        if (maxConditioningSetSize < 0)
            throw new IllegalArgumentException("maxConditioningSetSize must be >= 0 but was " + maxConditioningSetSize);
    }

    public static EngineConfig defaults() {
        return new EngineConfig(0, 5, 5, 3);
    }

    public static EngineConfig fromEnv(IEnvGetter env) {
        EngineConfig d = defaults();
        return new EngineConfig(
                IEnvGetter.getIntOr(env, MAX_PATH_LENGTH_ENV, d.maxPathLength()),
                IEnvGetter.getIntOr(env, MAX_ADJUSTMENT_SET_SIZE_ENV, d.maxAdjustmentSetSize()),
                IEnvGetter.getIntOr(env, MAX_SEPARATOR_SIZE_ENV, d.maxSeparatorSize()),
                IEnvGetter.getIntOr(env, MAX_CONDITIONING_SET_SIZE_ENV, d.maxConditioningSetSize()));
    }

    /** {@link #maxPathLength} in the form {@link PathFinder} takes. */
    public int pathLimit() {
        return maxPathLength == 0 ? PathFinder.UNBOUNDED : maxPathLength;
    }
}
