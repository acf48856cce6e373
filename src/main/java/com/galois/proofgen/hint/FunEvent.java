package com.galois.proofgen.hint;

import com.galois.proofgen.pattern.Location;

/**
 * Evaluation of a function symbol at a position of the configuration.
 */
public final class FunEvent extends FunctionalEvent {
    private final Location relativePosition;

    public FunEvent(String name, Location relativePosition) {
        super(name);
        if (relativePosition == null) throw new NullPointerException("relativePosition");
        this.relativePosition = relativePosition;
    }

    public Location relativePosition() {
        return relativePosition;
    }

    public String toString() {
        return "function " + name() + " at " + relativePosition;
    }
}
