package com.galois.proofgen.kore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.proofgen.pattern.Application;
import com.galois.proofgen.pattern.Exists;
import com.galois.proofgen.pattern.Implication;
import com.galois.proofgen.pattern.MetaVar;
import com.galois.proofgen.pattern.Mu;
import com.galois.proofgen.pattern.Notation;
import com.galois.proofgen.pattern.NotationDefinition;
import com.galois.proofgen.pattern.NotationRegistry;
import com.galois.proofgen.pattern.Notations;
import com.galois.proofgen.pattern.Pattern;
import com.galois.proofgen.pattern.Patterns;
import com.galois.proofgen.pattern.Symbol;

/**
 * Notations for the sorted connectives of Kore.
 *
 * <p>
 * Sorts are symbols, and <code>inh(s)</code> is the set of elements of
 * sort <code>s</code>.  Every sorted connective is the unsorted one
 * restricted to its sort.
 */
public final class KoreNotations {
    private KoreNotations() {}

    private static final Pattern PHI0 = MetaVar.of(0);
    private static final Pattern PHI1 = MetaVar.of(1);
    private static final Pattern PHI2 = MetaVar.of(2);
    private static final Pattern PHI3 = MetaVar.of(3);

    public static final Symbol INH = Symbol.of("inh");
    public static final Symbol NEXT = Symbol.of("next");
    public static final Symbol DV = Symbol.of("dv");

    public static Pattern inh(Pattern sort) {
        return Patterns.app(INH, sort);
    }

    /** <code>kore-top(s)</code> */
    public static final NotationDefinition KORE_TOP =
        new NotationDefinition("kore-top", 1, inh(PHI0));

    /** <code>kore-and(s, l, r)</code> */
    public static final NotationDefinition KORE_AND =
        new NotationDefinition("kore-and", 3, Notations.and(Notations.and(PHI1, PHI2), inh(PHI0)));

    /** <code>kore-or(s, l, r)</code> */
    public static final NotationDefinition KORE_OR =
        new NotationDefinition("kore-or", 3, Notations.and(Notations.or(PHI1, PHI2), inh(PHI0)));

    /** <code>kore-rewrites(s, l, r)</code>: <code>l</code> reaches <code>r</code> in one step. */
    public static final NotationDefinition KORE_REWRITES =
        new NotationDefinition("kore-rewrites", 3,
                               Notations.and(Patterns.implies(PHI1, Patterns.app(NEXT, PHI2)), inh(PHI0)));

    /** <code>kore-equals(s1, s2, l, r)</code> */
    public static final NotationDefinition KORE_EQUALS =
        new NotationDefinition("kore-equals", 4,
                               Notations.and(Notations.and(Patterns.implies(PHI2, PHI3),
                                                           Patterns.implies(PHI3, PHI2)),
                                             Notations.and(inh(PHI0), inh(PHI1))));

    /** <code>kore-implies(s, l, r)</code> */
    public static final NotationDefinition KORE_IMPLIES =
        new NotationDefinition("kore-implies", 3, Notations.and(Patterns.implies(PHI1, PHI2), inh(PHI0)));

    /** <code>kore-dv(s, value)</code> */
    public static final NotationDefinition KORE_DV =
        new NotationDefinition("kore-dv", 2, Patterns.app(Patterns.app(DV, PHI0), PHI1));

    /**
     * <code>kore-app(sorts, application)</code>, a symbol application
     * restricted to its sort parameters.
     */
    public static final NotationDefinition KORE_APP =
        new NotationDefinition("kore-app", 2, Notations.and(PHI1, inh(PHI0)));

    /** Marks a cell whose children are not cells. */
    public static final NotationDefinition CELL =
        new NotationDefinition("cell", 1, PHI0);

    /** Marks a cell with at least one cell among its children. */
    public static final NotationDefinition NESTED_CELLS =
        new NotationDefinition("nested-cells", 1, PHI0);

    /**
     * Register the notations above, and the propositional ones they use.
     */
    public static void registerAll(NotationRegistry registry) {
        Notations.registerAll(registry);
        registry.register(KORE_TOP);
        registry.register(KORE_AND);
        registry.register(KORE_OR);
        registry.register(KORE_REWRITES);
        registry.register(KORE_EQUALS);
        registry.register(KORE_IMPLIES);
        registry.register(KORE_DV);
        registry.register(KORE_APP);
        registry.register(CELL);
        registry.register(NESTED_CELLS);
    }

    private static boolean isInstance(Pattern p, NotationDefinition def) {
        return p instanceof Notation && ((Notation) p).definition().equals(def);
    }

    private static boolean isCell(Pattern p) {
        return isInstance(p, CELL) || isInstance(p, NESTED_CELLS);
    }

    /**
     * A symbol applied to a list of arguments, together with the wrapper
     * needed to rebuild it.
     */
    public static final class NaryApplication {
        private final Pattern original;
        private final Pattern head;
        private final List<Pattern> args;

        NaryApplication(Pattern original, Pattern head, List<Pattern> args) {
            this.original = original;
            this.head = head;
            this.args = Collections.unmodifiableList(new ArrayList<Pattern>(args));
        }

        public Pattern head() {
            return head;
        }

        public List<Pattern> args() {
            return args;
        }

        /**
         * Rebuild the original pattern with new arguments.
         */
        public Pattern rebuild(List<Pattern> newArgs) {
            if (newArgs.size() != args.size()) {
                throw new IllegalArgumentException("Wrong number of arguments.");
            }
            if (newArgs.isEmpty()) return original;
            List<Pattern> parts = new ArrayList<Pattern>(newArgs.size() + 1);
            parts.add(head);
            parts.addAll(newArgs);
            Pattern chain = Patterns.chain(parts);
            if (isInstance(original, KORE_APP)) {
                return KORE_APP.apply(((Notation) original).argument(0), chain);
            } else if (isCell(original)) {
                return ((Notation) original).definition().apply(chain);
            }
            return chain;
        }
    }

    /**
     * Split a pattern into a head and its arguments.  Kore applications
     * and cells are seen through; any other pattern is its own head.
     */
    public static NaryApplication deconstructNaryApplication(Pattern p) {
        Pattern body;
        if (isInstance(p, KORE_APP)) {
            body = ((Notation) p).argument(1);
        } else if (isCell(p)) {
            body = ((Notation) p).argument(0);
        } else if (p instanceof Application) {
            body = p;
        } else {
            return new NaryApplication(p, p, Collections.<Pattern>emptyList());
        }
        List<Pattern> parts = Patterns.unchain(body);
        return new NaryApplication(p, parts.get(0), parts.subList(1, parts.size()));
    }

    /**
     * Return the immediate subpatterns of <code>p</code> that locations
     * index into.
     */
    public static List<Pattern> children(Pattern p) {
        if (isInstance(p, KORE_APP) || isCell(p)) {
            return deconstructNaryApplication(p).args();
        }
        if (p instanceof Notation) {
            return ((Notation) p).arguments();
        }
        List<Pattern> r = new ArrayList<Pattern>(2);
        if (p instanceof Application) {
            r.add(((Application) p).left());
            r.add(((Application) p).right());
        } else if (p instanceof Implication) {
            r.add(((Implication) p).left());
            r.add(((Implication) p).right());
        } else if (p instanceof Exists) {
            r.add(((Exists) p).body());
        } else if (p instanceof Mu) {
            r.add(((Mu) p).body());
        }
        return r;
    }

    /**
     * Replace the <code>i</code>th child of <code>p</code>.
     *
     * @throws IndexOutOfBoundsException if <code>p</code> has no such child
     */
    public static Pattern withChild(Pattern p, int i, Pattern plug) {
        List<Pattern> kids = new ArrayList<Pattern>(children(p));
        if (i < 0 || i >= kids.size()) {
            String msg = String.format("Pattern %s has no child %d.", p, i);
            throw new IndexOutOfBoundsException(msg);
        }
        kids.set(i, plug);
        if (isInstance(p, KORE_APP) || isCell(p)) {
            return deconstructNaryApplication(p).rebuild(kids);
        }
        if (p instanceof Notation) {
            return ((Notation) p).definition().apply(kids);
        }
        if (p instanceof Application) {
            return new Application(kids.get(0), kids.get(1));
        } else if (p instanceof Implication) {
            return new Implication(kids.get(0), kids.get(1));
        } else if (p instanceof Exists) {
            return new Exists(((Exists) p).var(), plug);
        } else {
            return new Mu(((Mu) p).var(), plug);
        }
    }
}
