/**
 * Replay of execution traces into proofs.
 */
package com.galois.proofgen.execution;
