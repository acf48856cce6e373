package com.galois.proofgen.metamath.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parsed Metamath database.
 */
public final class Database {
    private final List<Statement> statements;

    public Database(List<Statement> statements) {
        this.statements = Collections.unmodifiableList(new ArrayList<Statement>(statements));
    }

    public List<Statement> statements() {
        return statements;
    }
}
