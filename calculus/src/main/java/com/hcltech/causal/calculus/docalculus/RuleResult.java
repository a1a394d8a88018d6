package com.hcltech.causal.calculus.docalculus;

import org.jetbrains.annotations.Nullable;

/**
 * Outcome of one do-calculus rule. When applicable, {@code result} is the rewritten expression in plain form
 * and {@code latex} the same in display form.
 */
public record RuleResult(int rule, boolean applicable, @Nullable String result, @Nullable String latex, String explanation) {

    static RuleResult applied(int rule, String result, String latex, String explanation) {
        return new RuleResult(rule, true, result, latex, explanation);
    }

    static RuleResult inapplicable(int rule, String explanation) {
        return new RuleResult(rule, false, null, null, explanation);
    }
}
