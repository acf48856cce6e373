package com.galois.proofgen.kore.syntax;

/**
 * <code>\top{s}()</code>.
 */
public final class Top extends KorePattern {
    private final Sort sort;

    public Top(Sort sort) {
        if (sort == null) throw new NullPointerException("sort");
        this.sort = sort;
    }

    public Sort sort() {
        return sort;
    }

    public <R> R accept(Visitor<R> v) {
        return v.visitTop(this);
    }

    Object[] components() {
        return new Object[] { sort };
    }

    public String toString() {
        return "\\top{" + sort + "}()";
    }
}
