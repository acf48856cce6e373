package com.galois.proofgen.kore.syntax;

/**
 * <code>\not{s}(p)</code>.
 */
public final class Not extends KorePattern {
    private final Sort sort;
    private final KorePattern pattern;

    public Not(Sort sort, KorePattern pattern) {
        if (sort == null) throw new NullPointerException("sort");
        if (pattern == null) throw new NullPointerException("pattern");
        this.sort = sort;
        this.pattern = pattern;
    }

    public Sort sort() {
        return sort;
    }

    public KorePattern pattern() {
        return pattern;
    }

    public <R> R accept(Visitor<R> v) {
        return v.visitNot(this);
    }

    Object[] components() {
        return new Object[] { sort, pattern };
    }

    public String toString() {
        return String.format("\\not{%s}(%s)", sort, pattern);
    }
}
