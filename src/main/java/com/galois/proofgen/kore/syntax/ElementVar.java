package com.galois.proofgen.kore.syntax;

/**
 * An element variable <code>X : s</code>.
 */
public final class ElementVar extends KorePattern {
    private final String name;
    private final Sort sort;

    public ElementVar(String name, Sort sort) {
        if (name == null) throw new NullPointerException("name");
        if (sort == null) throw new NullPointerException("sort");
        this.name = name;
        this.sort = sort;
    }

    public String name() {
        return name;
    }

    public Sort sort() {
        return sort;
    }

    public <R> R accept(Visitor<R> v) {
        return v.visitElementVar(this);
    }

    Object[] components() {
        return new Object[] { name, sort };
    }

    public String toString() {
        return name + ":" + sort;
    }
}
