package com.galois.proofgen.pattern;

import java.util.HashMap;
import java.util.Map;

/**
 * A constant symbol.  Symbols are interned for the life of the JVM, so
 * every distinct name, domain values included, stays cached.
 */
public final class Symbol extends Pattern {
    private final String name;

    // Cache of symbols by name.
    private static Map<String, Symbol> symbols = new HashMap<String, Symbol>();

    private Symbol(String name) {
        this.name = name;
    }

    /**
     * Return the symbol with the given name.
     *
     * @param name the name of the symbol
     * @return the symbol
     */
    public static Symbol of(String name) {
        if (name == null) throw new NullPointerException("name");
        synchronized (symbols) {
            Symbol r = symbols.get(name);
            if (r == null) {
                r = new Symbol(name);
                symbols.put(name, r);
            }
            return r;
        }
    }

    public String name() {
        return name;
    }

    public Pattern instantiate(Map<Integer, Pattern> plugs) {
        return this;
    }

    boolean sameShape(Pattern other) {
        return name.equals(((Symbol) other).name);
    }

    int shapeHash() {
        return 31 * 1 + name.hashCode();
    }

    public String toString() {
        return name;
    }
}
