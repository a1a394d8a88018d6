package com.hcltech.causal.calculus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** Text for probability expressions, in a compact plain form and a spaced LaTeX form. */
public final class Notation {

    private Notation() {
    }

    /** {@code P(y|do(x),z)}. Empty parts are left out, so no conditioning at all gives {@code P(y)}. */
    public static String plain(Collection<String> outcomes, Collection<String> interventions, Collection<String> conditions) {
        return expression(outcomes, interventions, conditions, ",", "|");
    }

    /** {@code P(y | do(x), z)}. */
    public static String latex(Collection<String> outcomes, Collection<String> interventions, Collection<String> conditions) {
        return expression(outcomes, interventions, conditions, ", ", " | ");
    }

    /** {@code P(Y | do(X))}, as shown to people reading an analysis. */
    public static String interventional(Collection<String> outcomes, Collection<String> interventions) {
        return latex(outcomes, interventions, List.of());
    }

    public static String join(Collection<String> ids) {
        return String.join(", ", ids);
    }

    private static String expression(Collection<String> outcomes, Collection<String> interventions,
                                     Collection<String> conditions, String comma, String bar) {
        List<String> given = new ArrayList<>();
        if (!interventions.isEmpty()) given.add("do(" + String.join(comma, interventions) + ")");
        if (!conditions.isEmpty()) given.add(String.join(comma, conditions));
        String head = "P(" + String.join(comma, outcomes);
        return given.isEmpty() ? head + ")" : head + bar + String.join(comma, given) + ")";
    }
}
