package com.galois.proofgen;

/**
 * Thrown when simplifications are started, continued or interleaved with
 * rewrites out of order.
 */
public class ScopeViolationException extends ProofGenerationException {
    public ScopeViolationException(String message) {
        super(message);
    }
}
