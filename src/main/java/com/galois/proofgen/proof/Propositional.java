package com.galois.proofgen.proof;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import com.galois.proofgen.InvariantViolationException;
import com.galois.proofgen.pattern.Implication;
import com.galois.proofgen.pattern.MetaVar;
import com.galois.proofgen.pattern.Notations;
import com.galois.proofgen.pattern.Pattern;
import com.galois.proofgen.pattern.Patterns;

/**
 * Propositional lemmas.  As a theory, it publishes <code>phi0 -> phi0</code>
 * and <code>top</code>.
 */
public class Propositional extends ProofExp {
    public static final Pattern PHI0 = MetaVar.of(0);
    public static final Pattern PHI0_IMPLIES_PHI0 = Patterns.implies(PHI0, PHI0);

    public Propositional() {
        super(Arrays.asList(Notations.BOT, Notations.NEG, Notations.TOP));
        addClaim(PHI0_IMPLIES_PHI0);
        addClaim(top());
        addProofExpression(impReflexivity());
        addProofExpression(topIntro());
    }

    public Set<Pattern> notation() {
        Set<Pattern> r = new HashSet<Pattern>();
        r.add(PHI0);
        r.add(bot());
        r.add(top());
        r.add(PHI0_IMPLIES_PHI0);
        return r;
    }

    public Set<Pattern> lemmas() {
        return new HashSet<Pattern>(claims());
    }

    // Notation
    // ========

    public final Pattern bot() {
        return Notations.bot();
    }

    public final Pattern neg(Pattern p) {
        return Notations.neg(p);
    }

    public final Pattern top() {
        return Notations.top();
    }

    // Proofs
    // ======

    /**
     * Proof of <code>phi0 -> phi0</code>.
     */
    public final Proof impReflexivity() {
        Proof a = prop1().instantiate(1, PHI0);
        Proof b = prop1().instantiate(1, PHI0_IMPLIES_PHI0);
        Proof c = prop2().instantiate(plugs(PHI0, PHI0_IMPLIES_PHI0, PHI0));
        return modusPonens(a, modusPonens(b, c));
    }

    /**
     * From proofs of <code>a -> b</code> and <code>b -> c</code>, a proof of
     * <code>a -> c</code>.
     */
    public final Proof impTransitivity(Proof left, Proof right) {
        Implication l = asImplication(left.conclusion());
        Implication r = asImplication(right.conclusion());
        if (!l.right().equals(r.left())) {
            String msg = String.format("Cannot chain %s and %s", l, r);
            throw new InvariantViolationException(msg);
        }
        Pattern a = l.left();
        Pattern b = l.right();
        Pattern c = r.right();

        // a -> (b -> c)
        Proof weakened = modusPonens(right, prop1().instantiate(plugs(right.conclusion(), a)));
        // (a -> b) -> (a -> c)
        Proof distributed = modusPonens(weakened, prop2().instantiate(plugs(a, b, c)));
        return modusPonens(left, distributed);
    }

    /**
     * Proof of <code>top</code>.
     */
    public final Proof topIntro() {
        return impReflexivity().instantiate(0, bot());
    }

    private static Map<Integer, Pattern> plugs(Pattern... ps) {
        Map<Integer, Pattern> r = new HashMap<Integer, Pattern>();
        for (int i = 0; i != ps.length; ++i) {
            r.put(i, ps[i]);
        }
        return r;
    }

    private static Implication asImplication(Pattern p) {
        Pattern u = p.unfold();
        if (!(u instanceof Implication)) {
            throw new InvariantViolationException("Expected implication, but got " + p);
        }
        return (Implication) u;
    }
}
