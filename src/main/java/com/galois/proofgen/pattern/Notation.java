package com.galois.proofgen.pattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * An instance of a {@link NotationDefinition}.
 *
 * <p>
 * A notation is equal to its expansion.  It is kept as a separate node so
 * that patterns print compactly and so that the serializer can store a
 * notation once and refer back to it.
 */
public final class Notation extends Pattern {
    private final NotationDefinition definition;
    private final List<Pattern> arguments;

    /** Fully unfolded expansion, computed on demand. */
    private Pattern unfolded;

    /** Package level constructor, see {@link NotationDefinition#apply}. */
    Notation(NotationDefinition definition, List<Pattern> arguments) {
        this.definition = definition;
        this.arguments = Collections.unmodifiableList(new ArrayList<Pattern>(arguments));
    }

    public NotationDefinition definition() {
        return definition;
    }

    public String name() {
        return definition.name();
    }

    public List<Pattern> arguments() {
        return arguments;
    }

    /**
     * Return an argument of this notation.
     * @param i index of the argument
     * @return the argument
     */
    public Pattern argument(int i) {
        if (!(0 <= i && i < arguments.size())) {
            throw new IllegalArgumentException("Invalid notation argument index.");
        }
        return arguments.get(i);
    }

    /**
     * Expand this notation by one step.  The result may itself be a notation.
     */
    public Pattern expand() {
        return definition.expand(arguments);
    }

    public Pattern unfold() {
        if (unfolded == null) {
            unfolded = expand().unfold();
        }
        return unfolded;
    }

    public Pattern instantiate(Map<Integer, Pattern> plugs) {
        List<Pattern> args = new ArrayList<Pattern>(arguments.size());
        boolean changed = false;
        for (Pattern a : arguments) {
            Pattern b = a.instantiate(plugs);
            changed |= b != a;
            args.add(b);
        }
        if (!changed) return this;
        return definition.apply(args);
    }

    // Unreachable from equals, which unfolds notations first.
    boolean sameShape(Pattern other) {
        return unfold().equals(other);
    }

    int shapeHash() {
        return unfold().hashCode();
    }

    public String toString() {
        if (arguments.isEmpty()) {
            return definition.name();
        }
        StringBuilder b = new StringBuilder();
        b.append(definition.name());
        b.append("(");
        for (int i = 0; i != arguments.size(); ++i) {
            if (i > 0) b.append(", ");
            b.append(arguments.get(i));
        }
        b.append(")");
        return b.toString();
    }
}
