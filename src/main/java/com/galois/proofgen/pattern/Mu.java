package com.galois.proofgen.pattern;

import java.util.Map;

/**
 * Least fixed point binding a set variable.
 */
public final class Mu extends Pattern {
    private final int var;
    private final Pattern body;

    /**
     * @param var the id of the bound variable
     * @param body the pattern in which <code>var</code> is bound
     */
    public Mu(int var, Pattern body) {
        if (var < 0) throw new IllegalArgumentException("Variable id must be non-negative.");
        if (body == null) throw new NullPointerException("body");
        this.var = var;
        this.body = body;
    }

    public int var() {
        return var;
    }

    public Pattern body() {
        return body;
    }

    public Pattern instantiate(Map<Integer, Pattern> plugs) {
        Pattern b = body.instantiate(plugs);
        if (b == body) return this;
        return new Mu(var, b);
    }

    boolean sameShape(Pattern other) {
        Mu o = (Mu) other;
        return var == o.var && body.equals(o.body);
    }

    int shapeHash() {
        return (31 * 8 + var) * 31 + body.hashCode();
    }

    public String toString() {
        return "(mu X" + var + " . " + body + ")";
    }
}
