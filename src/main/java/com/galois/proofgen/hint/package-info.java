/**
 * Execution traces reported by the backend.
 */
package com.galois.proofgen.hint;
