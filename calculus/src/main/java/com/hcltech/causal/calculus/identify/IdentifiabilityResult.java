package com.hcltech.causal.calculus.identify;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/** Whether P(Y | do(X)) can be computed from observational data; when it can, how and with what formula. */
public record IdentifiabilityResult(
        boolean identifiable,
        @Nullable IdentificationMethod method,
        String reason,
        @Nullable AdjustmentFormula formula
) {
    public IdentifiabilityResult {
        Objects.requireNonNull(reason, "reason");
        if (identifiable && (method == null || formula == null))
            throw new IllegalArgumentException("An identifiable result needs a method and a formula");
    }

    public static IdentifiabilityResult identified(AdjustmentFormula formula) {
        return new IdentifiabilityResult(true, formula.type(), formula.type().successReason(), formula);
    }

    public static IdentifiabilityResult notIdentifiable(String reason) {
        return new IdentifiabilityResult(false, null, reason, null);
    }
}
