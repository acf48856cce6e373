package com.galois.proofgen;

/**
 * ProofGenerationException is thrown when a proof cannot be generated.
 *
 * <p>
 * All failures during translation and proof construction are fatal: a
 * partially constructed proof is unsound and must not be emitted, so these
 * exceptions are never caught and downgraded inside this library.
 */
public class ProofGenerationException extends RuntimeException {
    public ProofGenerationException(String message) {
        super(message);
    }

    public ProofGenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ProofGenerationException(Throwable cause) {
        super(cause);
    }
}
