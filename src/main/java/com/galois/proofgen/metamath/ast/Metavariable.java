package com.galois.proofgen.metamath.ast;

/**
 * A Metamath variable.
 */
public final class Metavariable extends Term {
    private final String name;

    public Metavariable(String name) {
        if (name == null) throw new NullPointerException("name");
        this.name = name;
    }

    public String name() {
        return name;
    }

    public boolean equals(Object o) {
        return o instanceof Metavariable && name.equals(((Metavariable) o).name);
    }

    public int hashCode() {
        return name.hashCode();
    }

    public String toString() {
        return name;
    }
}
