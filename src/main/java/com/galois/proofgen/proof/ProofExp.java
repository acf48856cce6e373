package com.galois.proofgen.proof;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.galois.proofgen.InvariantViolationException;
import com.galois.proofgen.PackagingException;
import com.galois.proofgen.pattern.NotationDefinition;
import com.galois.proofgen.pattern.Pattern;

/**
 * A theory under construction: the axioms it assumes, the claims it
 * publishes and the proofs of those claims.
 *
 * <p>
 * Claims and proofs are paired by position; the <code>i</code>th proof
 * must prove the <code>i</code>th claim.
 */
public class ProofExp {
    private final List<NotationDefinition> notations;

    /** Axioms in the order they were first asserted. */
    private final LinkedHashSet<Pattern> axioms = new LinkedHashSet<Pattern>();

    private final List<Pattern> claims = new ArrayList<Pattern>();

    private final List<Proof> proofs = new ArrayList<Proof>();

    /** Stream to write any status messages to.  Null indicates no logging */
    private PrintStream statusStream = null;

    public ProofExp() {
        this(Collections.<NotationDefinition>emptyList());
    }

    /**
     * @param notations notations whose instances the serializer stores once
     */
    public ProofExp(Collection<NotationDefinition> notations) {
        this.notations = Collections.unmodifiableList(new ArrayList<NotationDefinition>(notations));
    }

    /**
     * Set the stream to write status messages to.
     * @param s The stream.
     */
    public void setStatusStream(PrintStream s) {
        statusStream = s;
    }

    protected void logStatus(String msg) {
        if (statusStream != null) {
            statusStream.printf("proofgen: %s\n", msg);
            statusStream.flush();
        }
    }

    public List<NotationDefinition> notations() {
        return notations;
    }

    public List<Pattern> axioms() {
        return Collections.unmodifiableList(new ArrayList<Pattern>(axioms));
    }

    public List<Pattern> claims() {
        return Collections.unmodifiableList(claims);
    }

    public List<Proof> proofs() {
        return Collections.unmodifiableList(proofs);
    }

    /**
     * Patterns that should be written once and shared.
     */
    public Set<Pattern> notation() {
        return new HashSet<Pattern>();
    }

    /**
     * Conclusions that should be proved once and reused.
     */
    public Set<Pattern> lemmas() {
        return new HashSet<Pattern>();
    }

    // Proof construction
    // ==================

    public final Proof prop1() {
        return new Prop1();
    }

    public final Proof prop2() {
        return new Prop2();
    }

    public final Proof modusPonens(Proof left, Proof right) {
        return new ModusPonens(left, right);
    }

    /**
     * Instantiate all metavariables in <code>substitution</code> at once.
     */
    public final Proof dynamicInst(Proof proof, Map<Integer, Pattern> substitution) {
        return proof.instantiate(substitution);
    }

    /**
     * Return a proof of an asserted axiom.
     *
     * @param axiom the axiom
     * @return the proof
     * @throws InvariantViolationException if <code>axiom</code> was never asserted
     */
    public final Proof loadAxiom(Pattern axiom) {
        if (!axioms.contains(axiom)) {
            throw new InvariantViolationException("Pattern is not an axiom: " + axiom);
        }
        return new AxiomReference(axiom);
    }

    // Theory construction
    // ===================

    public final void addAxiom(Pattern axiom) {
        if (axiom == null) throw new NullPointerException("axiom");
        axioms.add(axiom);
    }

    public final void addAssumptions(Collection<Pattern> assumptions) {
        for (Pattern p : assumptions) {
            addAxiom(p);
        }
    }

    public final void addClaim(Pattern claim) {
        if (claim == null) throw new NullPointerException("claim");
        claims.add(claim);
    }

    public final void addProofExpression(Proof proof) {
        if (proof == null) throw new NullPointerException("proof");
        proofs.add(proof);
    }

    // Serialization
    // =============

    /**
     * Write the axioms, claims and proofs of this theory.
     *
     * @throws PackagingException if some claim has no proof
     */
    public void serialize(OutputStream gammaOut, OutputStream claimsOut, OutputStream proofsOut)
        throws IOException
    {
        logStatus(String.format("Serializing %d axioms, %d claims and %d proofs.",
                                axioms.size(), claims.size(), proofs.size()));
        ProofSerializer s = new ProofSerializer(notations(), notation(), lemmas());
        s.serialize(axioms(), claims(), proofs(), gammaOut, claimsOut, proofsOut);
    }

    /**
     * Write the claims and proofs of a theory without axioms.
     *
     * @throws PackagingException if the theory has axioms or some claim has no proof
     */
    public void serialize(OutputStream claimsOut, OutputStream proofsOut) throws IOException {
        if (!axioms.isEmpty()) {
            throw new PackagingException("Theory has axioms; an assumptions stream is required.");
        }
        serialize(new OutputStream() {
                public void write(int b) throws IOException {
                    throw new IOException("Unexpected write to assumptions stream.");
                }
            }, claimsOut, proofsOut);
    }
}
