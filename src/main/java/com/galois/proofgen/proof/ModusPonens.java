package com.galois.proofgen.proof;

import com.galois.proofgen.InvariantViolationException;
import com.galois.proofgen.pattern.Implication;
import com.galois.proofgen.pattern.Pattern;

/**
 * From proofs of <code>A</code> and <code>A -> B</code>, a proof of <code>B</code>.
 */
public final class ModusPonens extends Proof {
    private final Proof left;
    private final Proof right;
    private final Pattern conclusion;

    /**
     * @param left proof of <code>A</code>
     * @param right proof of <code>A -> B</code>
     * @throws InvariantViolationException if the premises do not fit together
     */
    public ModusPonens(Proof left, Proof right) {
        if (left == null) throw new NullPointerException("left");
        if (right == null) throw new NullPointerException("right");

        Pattern imp = right.conclusion().unfold();
        if (!(imp instanceof Implication)) {
            String msg = String.format("Modus ponens expects an implication, but got %s",
                                       right.conclusion());
            throw new InvariantViolationException(msg);
        }
        Implication i = (Implication) imp;
        if (!i.left().equals(left.conclusion())) {
            String msg = String.format("Modus ponens premise %s does not match antecedent %s",
                                       left.conclusion(), i.left());
            throw new InvariantViolationException(msg);
        }
        this.left = left;
        this.right = right;
        this.conclusion = i.right();
    }

    public Proof left() {
        return left;
    }

    public Proof right() {
        return right;
    }

    public Pattern conclusion() {
        return conclusion;
    }
}
