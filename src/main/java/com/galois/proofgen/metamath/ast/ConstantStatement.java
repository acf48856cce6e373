package com.galois.proofgen.metamath.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <code>$c ... $.</code>
 */
public final class ConstantStatement extends Statement {
    private final List<String> constants;

    public ConstantStatement(List<String> constants) {
        this.constants = Collections.unmodifiableList(new ArrayList<String>(constants));
    }

    public List<String> constants() {
        return constants;
    }

    public String toString() {
        return "$c " + constants + " $.";
    }
}
