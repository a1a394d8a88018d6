package com.hcltech.causal.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How an edge relates its two endpoints. A bidirected edge stands for a latent common cause
 * and carries an arrowhead at both ends; an undirected edge carries none.
 */
public enum EdgeKind {
    DIRECTED,
    BIDIRECTED,
    UNDIRECTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Case-insensitive; {@code null} means directed, the usual case in user-authored graphs. */
    @JsonCreator
    public static EdgeKind parse(String value) {
        if (value == null || value.isBlank()) return DIRECTED;
        return EdgeKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
