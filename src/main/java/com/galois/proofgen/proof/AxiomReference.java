package com.galois.proofgen.proof;

import com.galois.proofgen.pattern.Pattern;

/**
 * Use of an asserted axiom.  Only {@link ProofExp#loadAxiom} creates these,
 * and only for patterns that were added as axioms.
 */
public final class AxiomReference extends Proof {
    private final Pattern axiom;

    AxiomReference(Pattern axiom) {
        if (axiom == null) throw new NullPointerException("axiom");
        this.axiom = axiom;
    }

    public Pattern conclusion() {
        return axiom;
    }
}
