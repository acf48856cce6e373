package com.galois.proofgen.kore.syntax;

/**
 * <code>\rewrites{s}(l, r)</code>: one step of execution.
 */
public final class Rewrites extends KorePattern {
    private final Sort sort;
    private final KorePattern left;
    private final KorePattern right;

    public Rewrites(Sort sort, KorePattern left, KorePattern right) {
        if (sort == null) throw new NullPointerException("sort");
        if (left == null) throw new NullPointerException("left");
        if (right == null) throw new NullPointerException("right");
        this.sort = sort;
        this.left = left;
        this.right = right;
    }

    public Sort sort() {
        return sort;
    }

    public KorePattern left() {
        return left;
    }

    public KorePattern right() {
        return right;
    }

    public <R> R accept(Visitor<R> v) {
        return v.visitRewrites(this);
    }

    Object[] components() {
        return new Object[] { sort, left, right };
    }

    public String toString() {
        return String.format("\\rewrites{%s}(%s, %s)", sort, left, right);
    }
}
