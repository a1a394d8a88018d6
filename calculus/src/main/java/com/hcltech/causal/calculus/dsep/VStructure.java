package com.hcltech.causal.calculus.dsep;

/** An unshielded collider {@code left -> collider <- right} where left and right are not adjacent. */
public record VStructure(String left, String collider, String right) {
    @Override
    public String toString() {
        return left + " -> " + collider + " <- " + right;
    }
}
