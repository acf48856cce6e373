package com.galois.proofgen.pattern;

import java.util.Map;

/**
 * Application of one pattern to another.  Applications of a symbol to
 * several arguments are written as left-nested binary applications, see
 * {@link Patterns#chain}.
 */
public final class Application extends Pattern {
    private final Pattern left;
    private final Pattern right;

    public Application(Pattern left, Pattern right) {
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
        return new Application(l, r);
    }

    boolean sameShape(Pattern other) {
        Application o = (Application) other;
        return left.equals(o.left) && right.equals(o.right);
    }

    int shapeHash() {
        return (31 * 5 + left.hashCode()) * 31 + right.hashCode();
    }

    public String toString() {
        return "app(" + left + ", " + right + ")";
    }
}
