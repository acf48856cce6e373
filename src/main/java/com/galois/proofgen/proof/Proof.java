package com.galois.proofgen.proof;

import java.util.HashMap;
import java.util.Map;

import com.galois.proofgen.pattern.Pattern;

/**
 * A derivation in the Hilbert-style proof system of matching logic.
 *
 * <p>
 * A proof can only be built from axioms and inference rules whose premises
 * are checked when the proof is built, so every proof certifies its
 * {@link #conclusion()}.
 */
public abstract class Proof {
    Proof() {}

    /**
     * Return the pattern this proof proves.
     * @return the conclusion
     */
    public abstract Pattern conclusion();

    /**
     * Instantiate a metavariable in this proof.
     *
     * @param id the metavariable
     * @param plug the pattern to replace it with
     * @return a proof of the instantiated conclusion
     */
    public Proof instantiate(int id, Pattern plug) {
        Map<Integer, Pattern> plugs = new HashMap<Integer, Pattern>();
        plugs.put(id, plug);
        return instantiate(plugs);
    }

    /**
     * Instantiate several metavariables simultaneously.
     */
    public Proof instantiate(Map<Integer, Pattern> plugs) {
        if (plugs.isEmpty()) return this;
        return new Instantiate(this, plugs);
    }

    public String toString() {
        return getClass().getSimpleName() + " |- " + conclusion();
    }
}
