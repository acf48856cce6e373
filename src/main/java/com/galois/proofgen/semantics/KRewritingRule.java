package com.galois.proofgen.semantics;

import com.galois.proofgen.kore.ConvertedAxiom;

/**
 * A rewrite rule.  Its pattern is a <code>kore-rewrites</code> notation.
 */
public final class KRewritingRule extends KRule {
    public KRewritingRule(int ordinal, ConvertedAxiom axiom) {
        super(ordinal, axiom);
    }
}
