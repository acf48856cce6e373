package com.galois.proofgen.semantics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.galois.proofgen.kore.ConvertedAxiom;
import com.galois.proofgen.pattern.Pattern;

/**
 * An equation <code>left = right</code> used to simplify configurations.
 */
public final class KEquationalRule extends KRule {
    private final Pattern left;
    private final Pattern right;
    private final Map<Integer, Pattern> requiresSubstitutions;

    public KEquationalRule(int ordinal,
                           ConvertedAxiom axiom,
                           Pattern left,
                           Pattern right,
                           Map<Integer, Pattern> requiresSubstitutions) {
        super(ordinal, axiom);
        if (left == null) throw new NullPointerException("left");
        if (right == null) throw new NullPointerException("right");
        this.left = left;
        this.right = right;
        this.requiresSubstitutions =
            Collections.unmodifiableMap(new LinkedHashMap<Integer, Pattern>(requiresSubstitutions));
    }

    public Pattern left() {
        return left;
    }

    public Pattern right() {
        return right;
    }

    /** Values the requires clause fixes for variables of the rule. */
    public Map<Integer, Pattern> requiresSubstitutions() {
        return requiresSubstitutions;
    }
}
