package com.galois.proofgen.kore.syntax;

/**
 * A set variable <code>@X : s</code>.
 */
public final class SetVar extends KorePattern {
    private final String name;
    private final Sort sort;

    public SetVar(String name, Sort sort) {
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
        return v.visitSetVar(this);
    }

    Object[] components() {
        return new Object[] { name, sort };
    }

    public String toString() {
        return name + ":" + sort;
    }
}
