package com.galois.proofgen.execution;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.galois.proofgen.InvariantViolationException;
import com.galois.proofgen.ScopeViolationException;
import com.galois.proofgen.kore.KoreNotations;
import com.galois.proofgen.pattern.Location;
import com.galois.proofgen.pattern.Pattern;
import com.galois.proofgen.semantics.KEquationalRule;
import com.galois.proofgen.semantics.KRule;
import com.galois.proofgen.semantics.LanguageSemantics;

/**
 * Applies equational rules to a configuration.
 *
 * <p>
 * The right side of an equation may itself need simplifying, so
 * simplifications in progress are kept on a stack.  Calls are made
 * between {@link #enter()} and {@link #exit()}.  On exit every finished
 * simplification is spliced into the one below it, or into the
 * configuration when it is the last.
 */
public final class SimplificationVisitor {
    private final LanguageSemantics semantics;
    private Pattern configuration;
    private final List<SimplificationInfo> stack = new ArrayList<SimplificationInfo>();
    private boolean inScope = false;

    public SimplificationVisitor(LanguageSemantics semantics, Pattern initialConfiguration) {
        if (semantics == null) throw new NullPointerException("semantics");
        if (initialConfiguration == null) throw new NullPointerException("initialConfiguration");
        this.semantics = semantics;
        this.configuration = initialConfiguration;
    }

    /**
     * The configuration with all finished simplifications applied.
     */
    public Pattern simplifiedConfiguration() {
        return configuration;
    }

    /** Number of simplifications on the stack. */
    public int pendingSimplifications() {
        return stack.size();
    }

    public boolean inScope() {
        return inScope;
    }

    /**
     * Replace the configuration after a rewrite.
     *
     * @throws ScopeViolationException if simplifications are in progress
     */
    public void updateConfiguration(Pattern newConfiguration) {
        if (inScope) {
            throw new ScopeViolationException("Cannot update the configuration inside a simplification scope.");
        }
        if (!stack.isEmpty()) {
            String msg = String.format("Cannot update the configuration with %d pending simplifications.",
                                       stack.size());
            throw new ScopeViolationException(msg);
        }
        configuration = newConfiguration;
    }

    public void enter() {
        if (inScope) {
            throw new ScopeViolationException("Simplification scope is already open.");
        }
        inScope = true;
    }

    /**
     * Start simplifying the subpattern at <code>location</code> with an
     * equational rule.
     *
     * @param ordinal ordinal of the rule
     * @param substitution values of the rule's variables
     * @param location position of the subpattern, relative to the top of
     *   the stack
     * @return the new top of the stack
     */
    public SimplificationInfo call(int ordinal, Map<Integer, Pattern> substitution, Location location) {
        if (!inScope) {
            throw new ScopeViolationException("Simplification called outside of a scope.");
        }

        Pattern base = stack.isEmpty() ? configuration : stack.get(stack.size() - 1).result();
        Pattern subpattern = getSubpattern(location, base);

        KRule rule = semantics.getAxiom(ordinal);
        if (!(rule instanceof KEquationalRule)) {
            String msg = String.format("Rule %d is not an equation, but %s.", ordinal, rule.kind());
            throw new InvariantViolationException(msg);
        }
        KEquationalRule eq = (KEquationalRule) rule;

        // Requires clause first, then the trace's values.
        Pattern result = applySubstitutions(eq.right(), eq.requiresSubstitutions());
        result = applySubstitutions(result, substitution);

        SimplificationInfo info =
            new SimplificationInfo(location, subpattern, result, semantics.countSimplifications(result));
        stack.add(info);
        return info;
    }

    /**
     * Close the scope, and splice finished simplifications back.
     */
    public void exit() {
        if (!inScope) {
            throw new ScopeViolationException("No simplification scope is open.");
        }
        inScope = false;
        while (!stack.isEmpty() && stack.get(stack.size() - 1).simplificationsLeft() == 0) {
            SimplificationInfo done = stack.remove(stack.size() - 1);
            if (stack.isEmpty()) {
                configuration = updateSubterm(done.location(), configuration, done.result());
            } else {
                SimplificationInfo top = stack.get(stack.size() - 1);
                top.setResult(updateSubterm(done.location(), top.result(), done.result()));
                top.decrementSimplificationsLeft();
            }
        }
    }

    private static Pattern applySubstitutions(Pattern p, Map<Integer, Pattern> substitutions) {
        for (Map.Entry<Integer, Pattern> e : substitutions.entrySet()) {
            p = p.instantiate(e.getKey(), e.getValue());
        }
        return p;
    }

    /**
     * Return the subpattern of <code>p</code> at <code>location</code>.
     *
     * @throws InvariantViolationException if the location does not exist
     */
    public static Pattern getSubpattern(Location location, Pattern p) {
        Pattern r = p;
        for (int i = 0; i != location.depth(); ++i) {
            List<Pattern> kids = KoreNotations.children(r);
            int idx = location.index(i);
            if (idx >= kids.size()) {
                String msg = String.format("Location %s does not exist in %s.", location, p);
                throw new InvariantViolationException(msg);
            }
            r = kids.get(idx);
        }
        return r;
    }

    /**
     * Replace the subpattern of <code>p</code> at <code>location</code>.
     *
     * @throws InvariantViolationException if the location does not exist
     */
    public static Pattern updateSubterm(Location location, Pattern p, Pattern plug) {
        return updateSubterm(location, 0, p, plug);
    }

    private static Pattern updateSubterm(Location location, int depth, Pattern p, Pattern plug) {
        if (depth == location.depth()) return plug;
        List<Pattern> kids = KoreNotations.children(p);
        int idx = location.index(depth);
        if (idx >= kids.size()) {
            String msg = String.format("Location %s does not exist in %s.", location, p);
            throw new InvariantViolationException(msg);
        }
        return KoreNotations.withChild(p, idx, updateSubterm(location, depth + 1, kids.get(idx), plug));
    }
}
