package com.galois.proofgen.semantics;

import com.galois.proofgen.kore.AxiomType;
import com.galois.proofgen.kore.ConvertedAxiom;
import com.galois.proofgen.pattern.Pattern;

/**
 * An axiom of a language, addressed by its ordinal.
 */
public class KRule {
    private final int ordinal;
    private final ConvertedAxiom axiom;

    public KRule(int ordinal, ConvertedAxiom axiom) {
        if (axiom == null) throw new NullPointerException("axiom");
        this.ordinal = ordinal;
        this.axiom = axiom;
    }

    public int ordinal() {
        return ordinal;
    }

    public AxiomType kind() {
        return axiom.kind();
    }

    public ConvertedAxiom axiom() {
        return axiom;
    }

    /** The axiom as a pattern. */
    public Pattern pattern() {
        return axiom.pattern();
    }

    public String toString() {
        return String.format("rule %d (%s)", ordinal, axiom.kind());
    }
}
