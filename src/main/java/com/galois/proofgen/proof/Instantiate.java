package com.galois.proofgen.proof;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import com.galois.proofgen.pattern.Pattern;

/**
 * A proof with metavariables in its conclusion replaced by patterns.
 */
public final class Instantiate extends Proof {
    private final Proof subproof;
    private final Map<Integer, Pattern> plugs;
    private final Pattern conclusion;

    public Instantiate(Proof subproof, Map<Integer, Pattern> plugs) {
        if (subproof == null) throw new NullPointerException("subproof");
        this.subproof = subproof;
        // Sorted so that serialization does not depend on map order.
        this.plugs = Collections.unmodifiableMap(new TreeMap<Integer, Pattern>(plugs));
        this.conclusion = subproof.conclusion().instantiate(this.plugs);
    }

    public Proof subproof() {
        return subproof;
    }

    /** Replacements, ordered by metavariable id. */
    public Map<Integer, Pattern> plugs() {
        return plugs;
    }

    public Pattern conclusion() {
        return conclusion;
    }
}
