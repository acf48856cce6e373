/**
 * Matching logic patterns and notations.
 *
 * <p>
 * Patterns are immutable and compared by value.  Notations are named
 * templates, see {@link com.galois.proofgen.pattern.NotationDefinition}.
 */
package com.galois.proofgen.pattern;
