/**
 * Import of notations from Metamath databases.
 */
package com.galois.proofgen.metamath;
