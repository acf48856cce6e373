package com.galois.proofgen.pattern;

import java.util.HashMap;
import java.util.Map;

/**
 * An element variable.
 */
public final class EVar extends Pattern {
    private final int id;

    // Cache of variables by id.
    private static Map<Integer, EVar> vars = new HashMap<Integer, EVar>();

    private EVar(int id) {
        this.id = id;
    }

    /**
     * Return the variable with the given id.
     *
     * @param id non-negative id of the variable
     * @return the variable
     */
    public static EVar of(int id) {
        if (id < 0) {
            throw new IllegalArgumentException("Variable id must be non-negative.");
        }
        synchronized (vars) {
            EVar r = vars.get(id);
            if (r == null) {
                r = new EVar(id);
                vars.put(id, r);
            }
            return r;
        }
    }

    public int id() {
        return id;
    }

    public Pattern instantiate(Map<Integer, Pattern> plugs) {
        return this;
    }

    boolean sameShape(Pattern other) {
        return id == ((EVar) other).id;
    }

    int shapeHash() {
        return 31 * 2 + id;
    }

    public String toString() {
        return "x" + id;
    }
}
