package com.galois.proofgen.kore.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A symbol declaration with its argument sorts, result sort and
 * attributes.
 */
public final class SymbolDecl {
    private final String symbol;
    private final List<Sort> argSorts;
    private final Sort resultSort;
    private final List<App> attrs;

    public SymbolDecl(String symbol, List<Sort> argSorts, Sort resultSort, List<App> attrs) {
        if (symbol == null) throw new NullPointerException("symbol");
        if (resultSort == null) throw new NullPointerException("resultSort");
        this.symbol = symbol;
        this.argSorts = Collections.unmodifiableList(new ArrayList<Sort>(argSorts));
        this.resultSort = resultSort;
        this.attrs = Collections.unmodifiableList(new ArrayList<App>(attrs));
    }

    public String symbol() {
        return symbol;
    }

    public List<Sort> argSorts() {
        return argSorts;
    }

    public Sort resultSort() {
        return resultSort;
    }

    public List<App> attrs() {
        return attrs;
    }

    /**
     * Return true if the declaration carries an attribute with the given name.
     */
    public boolean hasAttribute(String name) {
        for (App a : attrs) {
            if (a.symbol().equals(name)) return true;
        }
        return false;
    }
}
