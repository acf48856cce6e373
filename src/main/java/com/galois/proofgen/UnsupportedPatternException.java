package com.galois.proofgen;

/**
 * Thrown when a language definition contains a construct that cannot be
 * translated into a pattern.
 */
public class UnsupportedPatternException extends ProofGenerationException {
    public UnsupportedPatternException(String message) {
        super(message);
    }
}
