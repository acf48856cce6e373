package com.galois.proofgen.hint;

/**
 * An auxiliary event attached to a step of an execution trace, such as the
 * evaluation of a function or a hook.
 */
public abstract class FunctionalEvent {
    private final String name;

    FunctionalEvent(String name) {
        if (name == null) throw new NullPointerException("name");
        this.name = name;
    }

    /** Name of the function or hook. */
    public String name() {
        return name;
    }
}
