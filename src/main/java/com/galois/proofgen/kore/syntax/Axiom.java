package com.galois.proofgen.kore.syntax;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An axiom of a Kore module.
 */
public final class Axiom {
    private final KorePattern pattern;
    private final List<App> attrs;

    public Axiom(KorePattern pattern, List<App> attrs) {
        if (pattern == null) throw new NullPointerException("pattern");
        this.pattern = pattern;
        this.attrs = Collections.unmodifiableList(new ArrayList<App>(attrs));
    }

    public KorePattern pattern() {
        return pattern;
    }

    public List<App> attrs() {
        return attrs;
    }

    public boolean equals(Object o) {
        if (!(o instanceof Axiom)) return false;
        Axiom other = (Axiom) o;
        return pattern.equals(other.pattern) && attrs.equals(other.attrs);
    }

    public int hashCode() {
        return Arrays.hashCode(new Object[] { pattern, attrs });
    }

    public String toString() {
        return "axiom " + pattern;
    }
}
