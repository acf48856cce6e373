package com.galois.proofgen.metamath.ast;

/**
 * A term of a Metamath statement.
 */
public abstract class Term {
    Term() {}
}
