package com.galois.proofgen.pattern;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Helper methods for building and taking apart patterns.
 */
public final class Patterns {
    private Patterns() {}

    /**
     * Encode a non-empty sequence as left-nested applications, so that
     * <code>chain(a, b, c)</code> is <code>app(app(a, b), c)</code>.
     *
     * @param patterns the patterns to chain
     * @return the chained pattern
     */
    public static Pattern chain(Pattern... patterns) {
        return chain(Arrays.asList(patterns));
    }

    public static Pattern chain(List<? extends Pattern> patterns) {
        if (patterns.isEmpty()) {
            throw new IllegalArgumentException("Cannot chain an empty list of patterns.");
        }
        Pattern r = patterns.get(0);
        for (int i = 1; i != patterns.size(); ++i) {
            r = new Application(r, patterns.get(i));
        }
        return r;
    }

    /**
     * Split a pattern along the left spine of its applications.  This is
     * the inverse of {@link #chain} when the head is not an application.
     * Notations are not looked through.
     *
     * @param p the pattern
     * @return the head followed by the arguments
     */
    public static List<Pattern> unchain(Pattern p) {
        List<Pattern> r = new ArrayList<Pattern>();
        while (p instanceof Application) {
            Application a = (Application) p;
            r.add(a.right());
            p = a.left();
        }
        r.add(p);
        Collections.reverse(r);
        return r;
    }

    public static Pattern app(Pattern left, Pattern right) {
        return new Application(left, right);
    }

    public static Pattern implies(Pattern left, Pattern right) {
        return new Implication(left, right);
    }

    public static Pattern exists(int var, Pattern body) {
        return new Exists(var, body);
    }

    public static Pattern mu(int var, Pattern body) {
        return new Mu(var, body);
    }

    /**
     * Return the ids of the metavariables occurring in a pattern.
     */
    public static Set<Integer> metaVars(Pattern p) {
        Set<Integer> r = new TreeSet<Integer>();
        collectMetaVars(p, r);
        return r;
    }

    private static void collectMetaVars(Pattern p, Set<Integer> r) {
        if (p instanceof MetaVar) {
            r.add(((MetaVar) p).id());
        } else if (p instanceof Application) {
            collectMetaVars(((Application) p).left(), r);
            collectMetaVars(((Application) p).right(), r);
        } else if (p instanceof Implication) {
            collectMetaVars(((Implication) p).left(), r);
            collectMetaVars(((Implication) p).right(), r);
        } else if (p instanceof Exists) {
            collectMetaVars(((Exists) p).body(), r);
        } else if (p instanceof Mu) {
            collectMetaVars(((Mu) p).body(), r);
        } else if (p instanceof Notation) {
            // Templates only refer to their own arguments.
            for (Pattern a : ((Notation) p).arguments()) {
                collectMetaVars(a, r);
            }
        }
    }

    /**
     * Match <code>target</code> against <code>template</code>, where the
     * metavariables of the template match any pattern.
     *
     * @param template the pattern with metavariables to bind
     * @param target the pattern to match
     * @param bindings bindings found so far; extended on success
     * @return whether the match succeeded
     */
    public static boolean match(Pattern template, Pattern target, Map<Integer, Pattern> bindings) {
        if (template instanceof MetaVar) {
            int id = ((MetaVar) template).id();
            Pattern bound = bindings.get(id);
            if (bound == null) {
                bindings.put(id, target);
                return true;
            }
            return bound.equals(target);
        }

        Pattern t = template.unfold();
        if (t != template) {
            return match(t, target, bindings);
        }

        Pattern q = target.unfold();
        if (t.getClass() != q.getClass()) {
            return false;
        }
        if (t instanceof Application) {
            Application a = (Application) t;
            Application b = (Application) q;
            return match(a.left(), b.left(), bindings)
                && match(a.right(), b.right(), bindings);
        } else if (t instanceof Implication) {
            Implication a = (Implication) t;
            Implication b = (Implication) q;
            return match(a.left(), b.left(), bindings)
                && match(a.right(), b.right(), bindings);
        } else if (t instanceof Exists) {
            Exists a = (Exists) t;
            Exists b = (Exists) q;
            return a.var() == b.var() && match(a.body(), b.body(), bindings);
        } else if (t instanceof Mu) {
            Mu a = (Mu) t;
            Mu b = (Mu) q;
            return a.var() == b.var() && match(a.body(), b.body(), bindings);
        } else {
            return t.equals(q);
        }
    }
}
