package com.galois.proofgen.execution;

/**
 * States of an {@link ExecutionProofExp}.
 */
public enum ExecutionState {
    /** The initial configuration is set and no step has been replayed. */
    EMPTY,
    /** A configuration is set and no simplification is pending. */
    STEPPING,
    /** Simplifications have been started but not finished. */
    IN_SIMPLIFICATION,
    /** The trace is closed. */
    FINALIZED
}
