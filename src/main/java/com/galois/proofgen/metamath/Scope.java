package com.galois.proofgen.metamath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.galois.proofgen.UnsupportedPatternException;
import com.galois.proofgen.metamath.ast.Metavariable;
import com.galois.proofgen.pattern.EVar;
import com.galois.proofgen.pattern.MetaVar;
import com.galois.proofgen.pattern.Pattern;
import com.galois.proofgen.pattern.SVar;
import com.galois.proofgen.pattern.Symbol;

/**
 * Names visible while importing a Metamath database, and the patterns
 * they stand for.
 *
 * <p>
 * Variables are numbered by declaration order within their kind.  Inside
 * a notation body only the notation's arguments may be used as pattern
 * variables; they stand for the placeholders of the template.
 */
final class Scope {
    private final Set<String> symbols = new LinkedHashSet<String>();
    private final Set<String> domainValues = new LinkedHashSet<String>();
    private final List<String> metaVars = new ArrayList<String>();
    private final List<String> elementVars = new ArrayList<String>();
    private final List<String> setVars = new ArrayList<String>();

    /** Notation arguments, or null outside a notation body. */
    private List<String> args = null;

    void addSymbol(String name) {
        symbols.add(name);
    }

    void addDomainValue(String name) {
        domainValues.add(name);
        symbols.add(name);
    }

    void addMetaVariable(Metavariable var) {
        if (!metaVars.contains(var.name())) metaVars.add(var.name());
    }

    void addElementVar(Metavariable var) {
        if (!elementVars.contains(var.name())) elementVars.add(var.name());
    }

    void addSetVar(Metavariable var) {
        if (!setVars.contains(var.name())) setVars.add(var.name());
    }

    boolean isSymbol(String name) {
        return symbols.contains(name);
    }

    Set<String> symbols() {
        return Collections.unmodifiableSet(symbols);
    }

    Set<String> domainValues() {
        return Collections.unmodifiableSet(domainValues);
    }

    /**
     * Return a scope for the body of a notation with the given arguments.
     */
    Scope reduceToArgs(List<Metavariable> arguments) {
        Scope r = new Scope();
        r.symbols.addAll(symbols);
        r.domainValues.addAll(domainValues);
        r.metaVars.addAll(metaVars);
        r.elementVars.addAll(elementVars);
        r.setVars.addAll(setVars);
        r.args = new ArrayList<String>();
        for (Metavariable a : arguments) {
            if (r.args.contains(a.name())) {
                throw new UnsupportedPatternException("Duplicate notation argument " + a.name());
            }
            r.args.add(a.name());
        }
        return r;
    }

    /**
     * Return the pattern a name stands for.
     *
     * @throws UnsupportedPatternException if the name is not in scope
     */
    Pattern resolve(String name) {
        if (args != null && args.contains(name)) {
            return MetaVar.of(args.indexOf(name));
        }
        if (symbols.contains(name)) {
            return Symbol.of(name);
        }
        if (elementVars.contains(name)) {
            return EVar.of(elementVars.indexOf(name));
        }
        if (setVars.contains(name)) {
            return SVar.of(setVars.indexOf(name));
        }
        if (metaVars.contains(name)) {
            if (args != null) {
                String msg = String.format("Pattern variable %s is not an argument of the notation.", name);
                throw new UnsupportedPatternException(msg);
            }
            return MetaVar.of(metaVars.indexOf(name));
        }
        throw new UnsupportedPatternException("Unknown name " + name);
    }
}
