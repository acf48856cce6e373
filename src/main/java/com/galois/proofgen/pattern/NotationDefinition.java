package com.galois.proofgen.pattern;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A named, parametrized pattern.
 *
 * <p>
 * The template refers to the <code>i</code>th argument with the
 * metavariable <code>MetaVar.of(i)</code>.  Applying the definition to
 * arguments builds a {@link Notation}; expanding the notation substitutes
 * the arguments for the placeholders positionally.
 */
public final class NotationDefinition {
    private final String name;
    private final int arity;
    private final Pattern template;
    private final boolean placeholder;

    /**
     * Create a notation.
     *
     * @param name the name of the notation
     * @param arity the number of arguments
     * @param template the body, with placeholders <code>MetaVar.of(0)</code>
     *   up to <code>MetaVar.of(arity - 1)</code>
     */
    public NotationDefinition(String name, int arity, Pattern template) {
        this(name, arity, template, false);
    }

    private NotationDefinition(String name, int arity, Pattern template, boolean placeholder) {
        if (name == null) throw new NullPointerException("name");
        if (template == null) throw new NullPointerException("template");
        if (arity < 0) throw new IllegalArgumentException("arity must be non-negative.");
        for (Integer id : Patterns.metaVars(template)) {
            if (id >= arity) {
                String msg = String.format("Template of %s refers to argument %d but the arity is %d.",
                                           name, id, arity);
                throw new IllegalArgumentException(msg);
            }
        }
        this.name = name;
        this.arity = arity;
        this.template = template;
        this.placeholder = placeholder;
    }

    /**
     * Create a stand-in for a notation that has not been defined.  It keeps
     * the raw symbol and expands to the symbol applied to the arguments.
     */
    static NotationDefinition placeholder(String name, Symbol symbol, int arity) {
        List<Pattern> parts = new ArrayList<Pattern>(arity + 1);
        parts.add(symbol);
        for (int i = 0; i != arity; ++i) {
            parts.add(MetaVar.of(i));
        }
        return new NotationDefinition(name, arity, Patterns.chain(parts), true);
    }

    public String name() {
        return name;
    }

    public int arity() {
        return arity;
    }

    public Pattern template() {
        return template;
    }

    /**
     * Returns whether this is a stand-in for an unregistered notation.
     */
    public boolean isPlaceholder() {
        return placeholder;
    }

    /**
     * Build an instance of this notation.
     *
     * @param args the arguments
     * @return the notation
     */
    public Notation apply(Pattern... args) {
        return apply(Arrays.asList(args));
    }

    public Notation apply(List<Pattern> args) {
        if (args.size() != arity) {
            String msg = String.format("Notation %s expects %d arguments, but got %d.",
                                       name, arity, args.size());
            throw new IllegalArgumentException(msg);
        }
        for (Pattern a : args) {
            if (a == null) throw new NullPointerException("args");
        }
        return new Notation(this, args);
    }

    /**
     * Substitute the arguments for the placeholders of the template.
     *
     * @throws IllegalArgumentException if the number of arguments is not the arity
     */
    public Pattern expand(List<Pattern> args) {
        if (args.size() != arity) {
            String msg = String.format("Notation %s expects %d arguments, but got %d.",
                                       name, arity, args.size());
            throw new IllegalArgumentException(msg);
        }
        Map<Integer, Pattern> plugs = new HashMap<Integer, Pattern>();
        for (int i = 0; i != args.size(); ++i) {
            plugs.put(i, args.get(i));
        }
        return template.instantiate(plugs);
    }

    /**
     * Recover the arguments of a pattern that is an instance of this notation.
     *
     * @param p the pattern
     * @return the arguments, or <code>null</code> if <code>p</code> is not an
     *   instance of this notation
     */
    public List<Pattern> match(Pattern p) {
        if (p instanceof Notation && ((Notation) p).definition().equals(this)) {
            return ((Notation) p).arguments();
        }

        Map<Integer, Pattern> bindings = new HashMap<Integer, Pattern>();
        if (!Patterns.match(template, p, bindings)) {
            return null;
        }
        List<Pattern> args = new ArrayList<Pattern>(arity);
        for (int i = 0; i != arity; ++i) {
            Pattern a = bindings.get(i);
            // An argument the template ignores cannot be recovered.
            if (a == null) return null;
            args.add(a);
        }
        return args;
    }

    public boolean equals(Object o) {
        if (!(o instanceof NotationDefinition)) return false;
        NotationDefinition other = (NotationDefinition) o;
        return this.name.equals(other.name)
            && this.arity == other.arity
            && this.placeholder == other.placeholder
            && this.template.equals(other.template);
    }

    public int hashCode() {
        return Arrays.hashCode(new Object[] { name, arity, template });
    }

    public String toString() {
        return name + "/" + arity;
    }
}
