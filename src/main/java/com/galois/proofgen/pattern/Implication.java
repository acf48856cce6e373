package com.galois.proofgen.pattern;

import java.util.Map;

/**
 * Implication between two patterns.
 */
public final class Implication extends Pattern {
    private final Pattern left;
    private final Pattern right;

    public Implication(Pattern left, Pattern right) {
        if (left == null) throw new NullPointerException("left");
        if (right == null) throw new NullPointerException("right");
        this.left = left;
        this.right = right;
    }

    public Pattern left() {
        return left;
    }

    public Pattern right() {
        return right;
    }

    public Pattern instantiate(Map<Integer, Pattern> plugs) {
        Pattern l = left.instantiate(plugs);
        Pattern r = right.instantiate(plugs);
        if (l == left && r == right) return this;
        return new Implication(l, r);
    }

    boolean sameShape(Pattern other) {
        Implication o = (Implication) other;
        return left.equals(o.left) && right.equals(o.right);
    }

    int shapeHash() {
        return (31 * 6 + left.hashCode()) * 31 + right.hashCode();
    }

    public String toString() {
        return "(" + left + " -> " + right + ")";
    }
}
