package com.galois.proofgen.metamath.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A constant applied to subterms.  Constants are applications without
 * subterms.
 */
public final class Application extends Term {
    private final String symbol;
    private final List<Term> subterms;

    public Application(String symbol, List<Term> subterms) {
        if (symbol == null) throw new NullPointerException("symbol");
        this.symbol = symbol;
        this.subterms = Collections.unmodifiableList(new ArrayList<Term>(subterms));
    }

    public Application(String symbol, Term... subterms) {
        this(symbol, Arrays.asList(subterms));
    }

    public String symbol() {
        return symbol;
    }

    public List<Term> subterms() {
        return subterms;
    }

    public boolean equals(Object o) {
        if (!(o instanceof Application)) return false;
        Application other = (Application) o;
        return symbol.equals(other.symbol) && subterms.equals(other.subterms);
    }

    public int hashCode() {
        return Arrays.hashCode(new Object[] { symbol, subterms });
    }

    public String toString() {
        if (subterms.isEmpty()) return symbol;
        StringBuilder b = new StringBuilder("( ").append(symbol);
        for (Term t : subterms) {
            b.append(' ').append(t);
        }
        return b.append(" )").toString();
    }
}
