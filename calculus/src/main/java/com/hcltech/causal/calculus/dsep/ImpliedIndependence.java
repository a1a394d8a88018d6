package com.hcltech.causal.calculus.dsep;

import java.util.List;

/** {@code x} is d-separated from {@code y} given {@code given}. */
public record ImpliedIndependence(String x, String y, List<String> given) {
    public ImpliedIndependence {
        given = List.copyOf(given);
    }

    @Override
    public String toString() {
        return given.isEmpty() ? x + " _||_ " + y : x + " _||_ " + y + " | " + String.join(", ", given);
    }
}
