package com.hcltech.causal.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A variable in a causal graph. {@code type} may be null. */
public record Node(String id, String name, NodeType type, Map<String, Object> metadata) {
    public Node {
        Objects.requireNonNull(id, "id");
        if (name == null) name = id;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Node of(String id) {
        return new Node(id, id, null, Map.of());
    }

    public static Node of(String id, String name) {
        return new Node(id, name, null, Map.of());
    }
}
