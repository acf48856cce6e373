package com.galois.proofgen.pattern;

import java.util.HashMap;
import java.util.Map;

/**
 * An immutable matching logic pattern.
 *
 * <p>
 * Equality is structural: two patterns built independently with the same
 * shape are equal and have the same hash code.  A {@link Notation} is equal
 * to its expansion, so notations and the patterns they stand for can be
 * used interchangeably as keys.
 */
public abstract class Pattern {
    private int hash;
    private boolean hashed = false;

    Pattern() {}

    /**
     * Replace the metavariable <code>id</code> with <code>plug</code>.
     *
     * @param id the metavariable to replace
     * @param plug the replacement
     * @return the instantiated pattern
     */
    public Pattern instantiate(int id, Pattern plug) {
        Map<Integer, Pattern> plugs = new HashMap<Integer, Pattern>();
        plugs.put(id, plug);
        return instantiate(plugs);
    }

    /**
     * Replace all metavariables in the domain of <code>plugs</code> at once.
     *
     * @param plugs replacements indexed by metavariable id
     * @return the instantiated pattern, or <code>this</code> if nothing changed
     */
    public abstract Pattern instantiate(Map<Integer, Pattern> plugs);

    /**
     * Return the pattern with notations at the root expanded.  Patterns
     * other than notations return themselves.
     */
    public Pattern unfold() {
        return this;
    }

    /**
     * Compare with a pattern of the same class.  Neither side is a notation.
     */
    abstract boolean sameShape(Pattern other);

    abstract int shapeHash();

    public final boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pattern)) return false;
        Pattern a = this.unfold();
        Pattern b = ((Pattern) o).unfold();
        if (a == b) return true;
        if (a.getClass() != b.getClass()) return false;
        return a.sameShape(b);
    }

    public final int hashCode() {
        if (!hashed) {
            hash = unfold().shapeHash();
            hashed = true;
        }
        return hash;
    }
}
