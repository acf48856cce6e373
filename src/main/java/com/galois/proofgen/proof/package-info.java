/**
 * Proofs, theories and their binary serialization.
 */
package com.galois.proofgen.proof;
