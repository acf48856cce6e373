package com.galois.proofgen.kore.syntax;

/**
 * <code>\bottom{s}()</code>.
 */
public final class Bottom extends KorePattern {
    private final Sort sort;

    public Bottom(Sort sort) {
        if (sort == null) throw new NullPointerException("sort");
        this.sort = sort;
    }

    public Sort sort() {
        return sort;
    }

    public <R> R accept(Visitor<R> v) {
        return v.visitBottom(this);
    }

    Object[] components() {
        return new Object[] { sort };
    }

    public String toString() {
        return "\\bottom{" + sort + "}()";
    }
}
