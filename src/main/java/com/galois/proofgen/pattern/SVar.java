package com.galois.proofgen.pattern;

import java.util.HashMap;
import java.util.Map;

/**
 * A set variable.
 */
public final class SVar extends Pattern {
    private final int id;

    // Cache of variables by id.
    private static Map<Integer, SVar> vars = new HashMap<Integer, SVar>();

    private SVar(int id) {
        this.id = id;
    }

    /**
     * Return the variable with the given id.
     *
     * @param id non-negative id of the variable
     * @return the variable
     */
    public static SVar of(int id) {
        if (id < 0) {
            throw new IllegalArgumentException("Variable id must be non-negative.");
        }
        synchronized (vars) {
            SVar r = vars.get(id);
            if (r == null) {
                r = new SVar(id);
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
        return id == ((SVar) other).id;
    }

    int shapeHash() {
        return 31 * 3 + id;
    }

    public String toString() {
        return "X" + id;
    }
}
