package com.galois.proofgen;

/**
 * PackagingException is thrown when claims and proofs cannot be written
 * out as a consistent proof artifact.
 */
public class PackagingException extends ProofGenerationException {
    public PackagingException(String message) {
        super(message);
    }
}
