package com.galois.proofgen.kore.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parsed Kore definition.
 *
 * <p>
 * Axiom ordinals index {@link #axioms()}, which lists the axioms of all
 * modules in declaration order.
 */
public final class Definition {
    private final List<KoreModule> modules;

    public Definition(List<KoreModule> modules) {
        this.modules = Collections.unmodifiableList(new ArrayList<KoreModule>(modules));
    }

    public List<KoreModule> modules() {
        return modules;
    }

    /** All axioms, ordered by ordinal. */
    public List<Axiom> axioms() {
        List<Axiom> r = new ArrayList<Axiom>();
        for (KoreModule m : modules) {
            r.addAll(m.axioms());
        }
        return r;
    }

    /** All symbol declarations. */
    public List<SymbolDecl> symbols() {
        List<SymbolDecl> r = new ArrayList<SymbolDecl>();
        for (KoreModule m : modules) {
            r.addAll(m.symbols());
        }
        return r;
    }
}
