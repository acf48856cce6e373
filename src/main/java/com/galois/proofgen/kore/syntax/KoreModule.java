package com.galois.proofgen.kore.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named module of sort declarations, symbol declarations and axioms.
 */
public final class KoreModule {
    private final String name;
    private final List<SortDecl> sorts;
    private final List<SymbolDecl> symbols;
    private final List<Axiom> axioms;

    public KoreModule(String name, List<SortDecl> sorts, List<SymbolDecl> symbols, List<Axiom> axioms) {
        if (name == null) throw new NullPointerException("name");
        this.name = name;
        this.sorts = Collections.unmodifiableList(new ArrayList<SortDecl>(sorts));
        this.symbols = Collections.unmodifiableList(new ArrayList<SymbolDecl>(symbols));
        this.axioms = Collections.unmodifiableList(new ArrayList<Axiom>(axioms));
    }

    public String name() {
        return name;
    }

    public List<SortDecl> sorts() {
        return sorts;
    }

    public List<SymbolDecl> symbols() {
        return symbols;
    }

    public List<Axiom> axioms() {
        return axioms;
    }
}
