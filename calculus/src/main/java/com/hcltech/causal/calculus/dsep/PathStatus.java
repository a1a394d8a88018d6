package com.hcltech.causal.calculus.dsep;

import com.hcltech.causal.graph.Path;

public record PathStatus(Path path, boolean blocked, String reason) {
    static PathStatus of(Path path, BlockingResult result) {
        return new PathStatus(path, result.blocked(), result.reason());
    }
}
