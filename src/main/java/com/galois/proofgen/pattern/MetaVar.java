package com.galois.proofgen.pattern;

import java.util.HashMap;
import java.util.Map;

/**
 * A metavariable, standing for an arbitrary pattern until it is instantiated.
 */
public final class MetaVar extends Pattern {
    private final int id;

    // Cache of metavariables by id.
    private static Map<Integer, MetaVar> vars = new HashMap<Integer, MetaVar>();

    private MetaVar(int id) {
        this.id = id;
    }

    /**
     * Return the variable with the given id.
     *
     * @param id non-negative id of the variable
     * @return the variable
     */
    public static MetaVar of(int id) {
        if (id < 0) {
            throw new IllegalArgumentException("Variable id must be non-negative.");
        }
        synchronized (vars) {
            MetaVar r = vars.get(id);
            if (r == null) {
                r = new MetaVar(id);
                vars.put(id, r);
            }
            return r;
        }
    }

    public int id() {
        return id;
    }

    public Pattern instantiate(Map<Integer, Pattern> plugs) {
        Pattern plug = plugs.get(id);
        return plug == null ? this : plug;
    }

    boolean sameShape(Pattern other) {
        return id == ((MetaVar) other).id;
    }

    int shapeHash() {
        return 31 * 4 + id;
    }

    public String toString() {
        return "phi" + id;
    }
}
