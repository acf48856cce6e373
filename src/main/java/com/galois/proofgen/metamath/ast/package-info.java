/**
 * Abstract syntax of Metamath databases.
 */
package com.galois.proofgen.metamath.ast;
