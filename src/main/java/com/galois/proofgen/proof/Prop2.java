package com.galois.proofgen.proof;

import com.galois.proofgen.pattern.MetaVar;
import com.galois.proofgen.pattern.Pattern;
import com.galois.proofgen.pattern.Patterns;

/**
 * The axiom schema
 * <code>(phi0 -> (phi1 -> phi2)) -> ((phi0 -> phi1) -> (phi0 -> phi2))</code>.
 */
public final class Prop2 extends Proof {
    private static final Pattern CONCLUSION;

    static {
        Pattern phi0 = MetaVar.of(0);
        Pattern phi1 = MetaVar.of(1);
        Pattern phi2 = MetaVar.of(2);
        CONCLUSION =
            Patterns.implies(Patterns.implies(phi0, Patterns.implies(phi1, phi2)),
                             Patterns.implies(Patterns.implies(phi0, phi1),
                                              Patterns.implies(phi0, phi2)));
    }

    public Prop2() {
    }

    public Pattern conclusion() {
        return CONCLUSION;
    }
}
