/**
 * Generation of matching logic proofs for executions of K language
 * definitions.
 *
 * <p>
 * A definition is translated by {@link com.galois.proofgen.kore.KoreConverter},
 * wrapped in a {@link com.galois.proofgen.semantics.LanguageSemantics}, and
 * an execution trace is replayed by
 * {@link com.galois.proofgen.execution.ExecutionProofExp}.  The resulting
 * claims and proofs are written by
 * {@link com.galois.proofgen.proof.ProofExp#serialize}.
 */
package com.galois.proofgen;
