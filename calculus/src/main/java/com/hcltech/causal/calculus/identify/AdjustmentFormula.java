package com.hcltech.causal.calculus.identify;

import java.util.List;
import java.util.Objects;

/**
 * An estimand for a causal effect.
 *
 * @param adjustmentSet the variables summed over: the backdoor set, the mediators, or the instrument
 */
public record AdjustmentFormula(
        IdentificationMethod type,
        List<String> adjustmentSet,
        String latex,
        String plainText,
        boolean valid
) {
    public AdjustmentFormula {
        Objects.requireNonNull(type, "type");
        adjustmentSet = List.copyOf(adjustmentSet);
        Objects.requireNonNull(latex, "latex");
        Objects.requireNonNull(plainText, "plainText");
    }
}
