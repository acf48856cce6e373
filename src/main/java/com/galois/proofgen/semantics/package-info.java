/**
 * Rules of a language, as used to replay its executions.
 */
package com.galois.proofgen.semantics;
