package com.galois.proofgen.kore.syntax;

/**
 * <code>\equals{operandSort, sort}(l, r)</code>.
 */
public final class Equals extends KorePattern {
    private final Sort operandSort;
    private final Sort sort;
    private final KorePattern left;
    private final KorePattern right;

    public Equals(Sort operandSort, Sort sort, KorePattern left, KorePattern right) {
        if (operandSort == null) throw new NullPointerException("operandSort");
        if (sort == null) throw new NullPointerException("sort");
        if (left == null) throw new NullPointerException("left");
        if (right == null) throw new NullPointerException("right");
        this.operandSort = operandSort;
        this.sort = sort;
        this.left = left;
        this.right = right;
    }

    /** Sort of the two sides. */
    public Sort operandSort() {
        return operandSort;
    }

    /** Sort of the equality itself. */
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
        return v.visitEquals(this);
    }

    Object[] components() {
        return new Object[] { operandSort, sort, left, right };
    }

    public String toString() {
        return String.format("\\equals{%s, %s}(%s, %s)", operandSort, sort, left, right);
    }
}
