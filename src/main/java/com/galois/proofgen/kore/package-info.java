/**
 * Translation of Kore definitions into matching logic.
 *
 * <p>
 * {@link com.galois.proofgen.kore.KoreConverter} translates patterns and
 * classifies axioms; {@link com.galois.proofgen.kore.KoreNotations} holds
 * the notations the translation produces.
 */
package com.galois.proofgen.kore;
