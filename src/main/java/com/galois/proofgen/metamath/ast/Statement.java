package com.galois.proofgen.metamath.ast;

/**
 * A statement of a Metamath database.
 */
public abstract class Statement {
    Statement() {}
}
