package com.galois.proofgen;

/**
 * Thrown when the execution trace and the language definition disagree, for
 * example when a rewrite rule does not match the current configuration.
 */
public class InvariantViolationException extends ProofGenerationException {
    public InvariantViolationException(String message) {
        super(message);
    }
}
