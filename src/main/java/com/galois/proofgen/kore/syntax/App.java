package com.galois.proofgen.kore.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Application of a symbol to sort parameters and arguments.
 */
public final class App extends KorePattern {
    private final String symbol;
    private final List<Sort> sorts;
    private final List<KorePattern> args;

    public App(String symbol, List<Sort> sorts, List<KorePattern> args) {
        if (symbol == null) throw new NullPointerException("symbol");
        this.symbol = symbol;
        this.sorts = Collections.unmodifiableList(new ArrayList<Sort>(sorts));
        this.args = Collections.unmodifiableList(new ArrayList<KorePattern>(args));
    }

    /** Application without sort parameters. */
    public App(String symbol, List<KorePattern> args) {
        this(symbol, Collections.<Sort>emptyList(), args);
    }

    public String symbol() {
        return symbol;
    }

    public List<Sort> sorts() {
        return sorts;
    }

    public List<KorePattern> args() {
        return args;
    }

    public <R> R accept(Visitor<R> v) {
        return v.visitApp(this);
    }

    Object[] components() {
        return new Object[] { symbol, sorts, args };
    }

    public String toString() {
        StringBuilder b = new StringBuilder(symbol);
        b.append('{');
        for (int i = 0; i != sorts.size(); ++i) {
            if (i > 0) b.append(", ");
            b.append(sorts.get(i));
        }
        b.append("}(");
        for (int i = 0; i != args.size(); ++i) {
            if (i > 0) b.append(", ");
            b.append(args.get(i));
        }
        return b.append(')').toString();
    }
}
