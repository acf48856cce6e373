package com.galois.proofgen.kore.syntax;

/**
 * A domain value <code>\dv{s}("value")</code>.
 */
public final class DomainValue extends KorePattern {
    private final Sort sort;
    private final String value;

    public DomainValue(Sort sort, String value) {
        if (sort == null) throw new NullPointerException("sort");
        if (value == null) throw new NullPointerException("value");
        this.sort = sort;
        this.value = value;
    }

    public Sort sort() {
        return sort;
    }

    public String value() {
        return value;
    }

    public <R> R accept(Visitor<R> v) {
        return v.visitDomainValue(this);
    }

    Object[] components() {
        return new Object[] { sort, value };
    }

    public String toString() {
        return String.format("\\dv{%s}(\"%s\")", sort, value);
    }
}
