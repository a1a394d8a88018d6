package com.hcltech.causal.calculus.dsep;

/** Outcome of testing one path. {@code reason} names the deciding node, and is empty for an open path. */
public record BlockingResult(boolean blocked, String reason) {
    static final BlockingResult OPEN = new BlockingResult(false, "");

    public BlockingResult {
        if (reason == null) reason = "";
    }

    static BlockingResult nonColliderConditioned(String node) {
        return new BlockingResult(true, "Non-collider " + node + " is conditioned");
    }

    static BlockingResult colliderNotConditioned(String node) {
        return new BlockingResult(true, "Collider " + node + " not conditioned");
    }
}
