/**
 * Abstract syntax of Kore definitions.
 */
package com.galois.proofgen.kore.syntax;
