package com.galois.proofgen.proof;

import com.galois.proofgen.pattern.MetaVar;
import com.galois.proofgen.pattern.Pattern;
import com.galois.proofgen.pattern.Patterns;

/**
 * The axiom schema <code>phi0 -> (phi1 -> phi0)</code>.
 */
public final class Prop1 extends Proof {
    private static final Pattern CONCLUSION;

    static {
        Pattern phi0 = MetaVar.of(0);
        Pattern phi1 = MetaVar.of(1);
        CONCLUSION = Patterns.implies(phi0, Patterns.implies(phi1, phi0));
    }

    public Prop1() {
    }

    public Pattern conclusion() {
        return CONCLUSION;
    }
}
