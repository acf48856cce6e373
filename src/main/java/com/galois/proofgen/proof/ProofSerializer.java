package com.galois.proofgen.proof;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

import com.google.protobuf.CodedOutputStream;

import com.galois.proofgen.PackagingException;
import com.galois.proofgen.pattern.Application;
import com.galois.proofgen.pattern.EVar;
import com.galois.proofgen.pattern.Exists;
import com.galois.proofgen.pattern.Implication;
import com.galois.proofgen.pattern.MetaVar;
import com.galois.proofgen.pattern.Mu;
import com.galois.proofgen.pattern.Notation;
import com.galois.proofgen.pattern.NotationDefinition;
import com.galois.proofgen.pattern.Pattern;
import com.galois.proofgen.pattern.SVar;
import com.galois.proofgen.pattern.Symbol;

/**
 * Writes assumptions, claims and proofs in the checker's binary format.
 *
 * <p>
 * The output only depends on the arguments of {@link #serialize}: each call
 * starts from empty memories.  Patterns in the notation table and proved
 * lemmas are saved to memory the first time they are written and loaded
 * from memory afterwards.
 *
 * <p>
 * Opcodes are single bytes, variable ids and memory indices are varints
 * and symbol names are length-prefixed UTF-8 strings.
 */
public final class ProofSerializer {
    private final Set<NotationDefinition> notations;
    private final Set<Pattern> notation;
    private final Set<Pattern> lemmas;

    /** A pattern in the checker's memory, together with whether it is proved. */
    private static final class Entry {
        final Pattern pattern;
        final boolean proved;

        Entry(Pattern pattern, boolean proved) {
            this.pattern = pattern;
            this.proved = proved;
        }
    }

    /**
     * @param notations notation definitions whose instances are stored once
     * @param notation further patterns that are stored once
     * @param lemmas conclusions that are stored once proved
     */
    public ProofSerializer(Collection<NotationDefinition> notations,
                           Set<Pattern> notation,
                           Set<Pattern> lemmas) {
        this.notations = new HashSet<NotationDefinition>(notations);
        this.notation = new HashSet<Pattern>(notation);
        this.lemmas = new HashSet<Pattern>(lemmas);
    }

    /**
     * Write a theory.
     *
     * @param axioms patterns assumed without proof
     * @param claims patterns to publish as theorems
     * @param proofs proofs of the claims, in the same order as the claims
     * @param gammaOut stream receiving the axioms
     * @param claimsOut stream receiving the claims
     * @param proofsOut stream receiving the proofs
     * @throws PackagingException if a claim is left without proof, or a
     *   proof uses an axiom that is not in <code>axioms</code>; nothing is
     *   written to the streams in that case
     */
    public void serialize(List<Pattern> axioms,
                          List<Pattern> claims,
                          List<Proof> proofs,
                          OutputStream gammaOut,
                          OutputStream claimsOut,
                          OutputStream proofsOut) throws IOException {
        // Everything is encoded before the first byte reaches the caller's streams.
        ByteArrayOutputStream gammaBuf = new ByteArrayOutputStream();
        ByteArrayOutputStream claimsBuf = new ByteArrayOutputStream();
        ByteArrayOutputStream proofsBuf = new ByteArrayOutputStream();

        // The proofs are checked in the memory left behind by the axioms.
        List<Entry> memory = new ArrayList<Entry>();
        CodedOutputStream gamma = CodedOutputStream.newInstance(gammaBuf);
        for (Pattern axiom : axioms) {
            writePattern(axiom, memory, gamma);
            memory.add(new Entry(axiom, true));
            writeInstruction(gamma, Instruction.SAVE);
            writeInstruction(gamma, Instruction.POP);
        }
        gamma.flush();

        // Claims are pushed so that the first claim ends up on top.
        List<Entry> claimsMemory = new ArrayList<Entry>();
        CodedOutputStream claimsCoded = CodedOutputStream.newInstance(claimsBuf);
        for (int i = claims.size() - 1; i >= 0; --i) {
            writePattern(claims.get(i), claimsMemory, claimsCoded);
            writeInstruction(claimsCoded, Instruction.PUBLISH);
        }
        claimsCoded.flush();

        LinkedList<Pattern> remaining = new LinkedList<Pattern>(claims);
        CodedOutputStream proofsCoded = CodedOutputStream.newInstance(proofsBuf);
        for (Proof proof : proofs) {
            writeProof(proof, memory, proofsCoded);

            Pattern conclusion = proof.conclusion();
            if (!remaining.isEmpty() && remaining.getFirst().equals(conclusion)) {
                remaining.removeFirst();
                writeInstruction(proofsCoded, Instruction.PUBLISH);
            } else {
                writeInstruction(proofsCoded, Instruction.POP);
            }
        }
        proofsCoded.flush();

        if (!remaining.isEmpty()) {
            String msg = String.format("%d of %d claims were not proved; first unproved claim: %s",
                                       remaining.size(), claims.size(), remaining.getFirst());
            throw new PackagingException(msg);
        }

        gammaBuf.writeTo(gammaOut);
        gammaOut.flush();
        claimsBuf.writeTo(claimsOut);
        claimsOut.flush();
        proofsBuf.writeTo(proofsOut);
        proofsOut.flush();
    }

    private static void writeInstruction(CodedOutputStream out, Instruction i) throws IOException {
        out.writeRawByte((byte) i.code());
    }

    private static int find(List<Entry> memory, Pattern p, boolean proved) {
        for (int i = 0; i != memory.size(); ++i) {
            Entry e = memory.get(i);
            if (e.proved == proved && e.pattern.equals(p)) {
                return i;
            }
        }
        return -1;
    }

    private boolean isNotation(Pattern p) {
        if (p instanceof Notation && notations.contains(((Notation) p).definition())) {
            return true;
        }
        return notation.contains(p);
    }

    private void writePattern(Pattern p, List<Entry> memory, CodedOutputStream out) throws IOException {
        int idx = find(memory, p, false);
        if (idx >= 0) {
            writeInstruction(out, Instruction.LOAD);
            out.writeUInt32NoTag(idx);
            return;
        }

        Pattern s = p.unfold();
        if (s instanceof EVar) {
            writeInstruction(out, Instruction.EVAR);
            out.writeUInt32NoTag(((EVar) s).id());
        } else if (s instanceof SVar) {
            writeInstruction(out, Instruction.SVAR);
            out.writeUInt32NoTag(((SVar) s).id());
        } else if (s instanceof Symbol) {
            writeInstruction(out, Instruction.SYMBOL);
            out.writeStringNoTag(((Symbol) s).name());
        } else if (s instanceof MetaVar) {
            writeInstruction(out, Instruction.CLEAN_META_VAR);
            out.writeUInt32NoTag(((MetaVar) s).id());
        } else if (s instanceof Implication) {
            writePattern(((Implication) s).left(), memory, out);
            writePattern(((Implication) s).right(), memory, out);
            writeInstruction(out, Instruction.IMPLICATION);
        } else if (s instanceof Application) {
            writePattern(((Application) s).left(), memory, out);
            writePattern(((Application) s).right(), memory, out);
            writeInstruction(out, Instruction.APPLICATION);
        } else if (s instanceof Exists) {
            writePattern(((Exists) s).body(), memory, out);
            writeInstruction(out, Instruction.EXISTS);
            out.writeUInt32NoTag(((Exists) s).var());
        } else if (s instanceof Mu) {
            writePattern(((Mu) s).body(), memory, out);
            writeInstruction(out, Instruction.MU);
            out.writeUInt32NoTag(((Mu) s).var());
        } else {
            throw new IllegalStateException("Unknown pattern class " + s.getClass().getName());
        }

        if (isNotation(p)) {
            memory.add(new Entry(p, false));
            writeInstruction(out, Instruction.SAVE);
        }
    }

    private void writeProof(Proof proof, List<Entry> memory, CodedOutputStream out) throws IOException {
        Pattern conclusion = proof.conclusion();
        int idx = find(memory, conclusion, true);
        if (idx >= 0) {
            writeInstruction(out, Instruction.LOAD);
            out.writeUInt32NoTag(idx);
            return;
        }

        if (proof instanceof Prop1) {
            writeInstruction(out, Instruction.PROP1);
        } else if (proof instanceof Prop2) {
            writeInstruction(out, Instruction.PROP2);
        } else if (proof instanceof ModusPonens) {
            writeProof(((ModusPonens) proof).left(), memory, out);
            writeProof(((ModusPonens) proof).right(), memory, out);
            writeInstruction(out, Instruction.MODUS_PONENS);
        } else if (proof instanceof Instantiate) {
            Instantiate inst = (Instantiate) proof;
            List<Integer> ids = new ArrayList<Integer>(inst.plugs().keySet());
            // Plugs are popped in order of increasing id.
            for (int i = ids.size() - 1; i >= 0; --i) {
                writePattern(inst.plugs().get(ids.get(i)), memory, out);
            }
            writeProof(inst.subproof(), memory, out);
            writeInstruction(out, Instruction.INSTANTIATE);
            out.writeUInt32NoTag(ids.size());
            for (Integer id : ids) {
                out.writeUInt32NoTag(id);
            }
        } else if (proof instanceof AxiomReference) {
            // Axioms are always in memory once the assumptions are written.
            throw new PackagingException("Proof uses an axiom that was not asserted: " + conclusion);
        } else {
            throw new IllegalStateException("Unknown proof class " + proof.getClass().getName());
        }

        if (lemmas.contains(conclusion)) {
            memory.add(new Entry(conclusion, true));
            writeInstruction(out, Instruction.SAVE);
        }
    }
}
