package com.hcltech.causal.graph;

import java.util.Objects;

/**
 * do(variable = value). Graph surgery only looks at {@code variable}; the value is carried for callers.
 */
public record Intervention(String variable, Object value, InterventionType type) {
    public Intervention {
        Objects.requireNonNull(variable, "variable");
        if (type == null) type = InterventionType.ATOMIC;
    }

    public static Intervention atomic(String variable) {
        return new Intervention(variable, 0, InterventionType.ATOMIC);
    }

    public static Intervention atomic(String variable, Object value) {
        return new Intervention(variable, value, InterventionType.ATOMIC);
    }
}
