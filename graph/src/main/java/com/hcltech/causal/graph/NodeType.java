package com.hcltech.causal.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Role a caller assigned to a variable. Informational only: no algorithm reads it. */
public enum NodeType {
    OBSERVED,
    LATENT,
    INTERVENTION,
    OUTCOME;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NodeType parse(String value) {
        if (value == null || value.isBlank()) return null;
        return NodeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
