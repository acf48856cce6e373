package com.galois.proofgen.kore.syntax;

import java.util.Arrays;

/**
 * A pattern of the Kore surface syntax.
 *
 * <p>
 * Kore patterns carry explicit sorts.  They are only an input format;
 * {@link com.galois.proofgen.kore.KoreConverter} translates them into
 * matching logic patterns.
 */
public abstract class KorePattern {
    KorePattern() {}

    /**
     * Dispatch on the kind of pattern.
     */
    public interface Visitor<R> {
        R visitRewrites(Rewrites p);
        R visitAnd(And p);
        R visitOr(Or p);
        R visitImplies(Implies p);
        R visitEquals(Equals p);
        R visitApp(App p);
        R visitElementVar(ElementVar p);
        R visitSetVar(SetVar p);
        R visitTop(Top p);
        R visitBottom(Bottom p);
        R visitNot(Not p);
        R visitDomainValue(DomainValue p);
    }

    public abstract <R> R accept(Visitor<R> v);

    /** Fields that determine equality. */
    abstract Object[] components();

    public final boolean equals(Object o) {
        if (o == null || o.getClass() != getClass()) return false;
        return Arrays.equals(components(), ((KorePattern) o).components());
    }

    public final int hashCode() {
        return Arrays.hashCode(new Object[] { getClass().getName(), Arrays.hashCode(components()) });
    }
}
