package com.galois.proofgen.kore;

/**
 * Classification of converted axioms.
 */
public enum AxiomType {
    Unclassified,
    RewriteRule,
    FunctionalSymbol,
    FunctionEvent,
    HookEvent,
    EquationalRule
}
