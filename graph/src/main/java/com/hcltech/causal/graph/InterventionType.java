package com.hcltech.causal.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum InterventionType {
    ATOMIC,
    STOCHASTIC,
    CONDITIONAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static InterventionType parse(String value) {
        if (value == null || value.isBlank()) return ATOMIC;
        return InterventionType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
