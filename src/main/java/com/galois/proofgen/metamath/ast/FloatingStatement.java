package com.galois.proofgen.metamath.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A floating hypothesis, <code>label $f typecode var $.</code>
 */
public final class FloatingStatement extends Statement {
    private final String label;
    private final List<Term> terms;

    public FloatingStatement(String label, List<Term> terms) {
        if (label == null) throw new NullPointerException("label");
        this.label = label;
        this.terms = Collections.unmodifiableList(new ArrayList<Term>(terms));
    }

    public String label() {
        return label;
    }

    public List<Term> terms() {
        return terms;
    }

    public String toString() {
        return label + " $f " + terms + " $.";
    }
}
