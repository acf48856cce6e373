package com.galois.proofgen.hint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.proofgen.kore.syntax.KorePattern;

/**
 * Evaluation of a builtin hook with its arguments and result.
 */
public final class HookEvent extends FunctionalEvent {
    private final List<KorePattern> args;
    private final KorePattern result;

    public HookEvent(String name, List<KorePattern> args, KorePattern result) {
        super(name);
        if (result == null) throw new NullPointerException("result");
        this.args = Collections.unmodifiableList(new ArrayList<KorePattern>(args));
        this.result = result;
    }

    public List<KorePattern> args() {
        return args;
    }

    public KorePattern result() {
        return result;
    }

    public String toString() {
        return "hook " + name() + args + " = " + result;
    }
}
