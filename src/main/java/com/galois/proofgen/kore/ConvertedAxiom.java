package com.galois.proofgen.kore;

import java.util.Arrays;

import com.galois.proofgen.pattern.Pattern;

/**
 * An axiom translated to a pattern, together with its classification.
 */
public final class ConvertedAxiom {
    private final AxiomType kind;
    private final Pattern pattern;

    public ConvertedAxiom(AxiomType kind, Pattern pattern) {
        if (kind == null) throw new NullPointerException("kind");
        if (pattern == null) throw new NullPointerException("pattern");
        this.kind = kind;
        this.pattern = pattern;
    }

    public AxiomType kind() {
        return kind;
    }

    public Pattern pattern() {
        return pattern;
    }

    public boolean equals(Object o) {
        if (!(o instanceof ConvertedAxiom)) return false;
        ConvertedAxiom other = (ConvertedAxiom) o;
        return kind == other.kind && pattern.equals(other.pattern);
    }

    public int hashCode() {
        return Arrays.hashCode(new Object[] { kind, pattern });
    }

    public String toString() {
        return kind + ": " + pattern;
    }
}
