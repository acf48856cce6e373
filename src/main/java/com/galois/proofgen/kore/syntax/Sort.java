package com.galois.proofgen.kore.syntax;

/**
 * A Kore sort.
 */
public final class Sort {
    private final String name;

    public Sort(String name) {
        if (name == null) throw new NullPointerException("name");
        this.name = name;
    }

    public String name() {
        return name;
    }

    public boolean equals(Object o) {
        if (!(o instanceof Sort)) return false;
        return name.equals(((Sort) o).name);
    }

    public int hashCode() {
        return name.hashCode();
    }

    public String toString() {
        return name + "{}";
    }
}
