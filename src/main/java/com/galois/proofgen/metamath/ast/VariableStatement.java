package com.galois.proofgen.metamath.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <code>$v ... $.</code>
 */
public final class VariableStatement extends Statement {
    private final List<Metavariable> metavariables;

    public VariableStatement(List<Metavariable> metavariables) {
        this.metavariables = Collections.unmodifiableList(new ArrayList<Metavariable>(metavariables));
    }

    public List<Metavariable> metavariables() {
        return metavariables;
    }

    public String toString() {
        return "$v " + metavariables + " $.";
    }
}
