package com.galois.proofgen.execution;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.galois.proofgen.InvariantViolationException;
import com.galois.proofgen.ScopeViolationException;
import com.galois.proofgen.hint.FunctionalEvent;
import com.galois.proofgen.hint.RewriteStep;
import com.galois.proofgen.kore.Axioms;
import com.galois.proofgen.kore.KoreNotations;
import com.galois.proofgen.pattern.Location;
import com.galois.proofgen.pattern.Pattern;
import com.galois.proofgen.proof.Proof;
import com.galois.proofgen.proof.ProofExp;
import com.galois.proofgen.semantics.KRewritingRule;
import com.galois.proofgen.semantics.KRule;
import com.galois.proofgen.semantics.LanguageSemantics;

/**
 * Replays an execution trace, proving each rewrite step from the rules
 * of the language.
 *
 * <p>
 * Every rewrite step adds the instantiated rule as a claim, proved by
 * instantiating the rule itself, which is assumed as an axiom along with
 * the definedness of the substituted values.
 */
public class ExecutionProofExp extends ProofExp {
    private final LanguageSemantics semantics;
    private final Pattern initialConfiguration;
    private Pattern currentConfiguration;
    private final SimplificationVisitor visitor;
    private boolean finalized = false;
    private int steps = 0;

    public ExecutionProofExp(LanguageSemantics semantics, Pattern initialConfiguration) {
        super(semantics.notations());
        if (initialConfiguration == null) throw new NullPointerException("initialConfiguration");
        this.semantics = semantics;
        this.initialConfiguration = initialConfiguration;
        this.currentConfiguration = initialConfiguration;
        this.visitor = new SimplificationVisitor(semantics, initialConfiguration);
        setStatusStream(semantics.options().getStatusStream());
    }

    public Pattern initialConfiguration() {
        return initialConfiguration;
    }

    public Pattern currentConfiguration() {
        return currentConfiguration;
    }

    public ExecutionState state() {
        if (finalized) return ExecutionState.FINALIZED;
        if (visitor.pendingSimplifications() > 0) return ExecutionState.IN_SIMPLIFICATION;
        if (steps == 0) return ExecutionState.EMPTY;
        return ExecutionState.STEPPING;
    }

    private void checkNotFinalized() {
        if (finalized) {
            throw new IllegalStateException("Execution proof is finalized.");
        }
    }

    public Proof rewriteEvent(KRewritingRule rule, Map<Integer, Pattern> substitution) {
        return rewriteEvent(rule, substitution, Collections.<FunctionalEvent>emptyList());
    }

    /**
     * Extend the proof with one rewrite step.
     *
     * @param rule the rule that was applied
     * @param substitution values of the rule's variables
     * @param events auxiliary events of the step
     * @return the proof of the instantiated rule
     * @throws InvariantViolationException if the rule does not apply to the
     *   current configuration
     * @throws ScopeViolationException if simplifications are pending
     */
    public Proof rewriteEvent(KRewritingRule rule,
                              Map<Integer, Pattern> substitution,
                              List<FunctionalEvent> events) {
        checkNotFinalized();
        if (visitor.inScope() || visitor.pendingSimplifications() > 0) {
            String msg = String.format("Rewrite with rule %d while %d simplifications are pending.",
                                       rule.ordinal(), visitor.pendingSimplifications());
            throw new ScopeViolationException(msg);
        }

        Pattern instantiated = rule.pattern().instantiate(substitution);
        List<Pattern> sides = KoreNotations.KORE_REWRITES.match(instantiated);
        if (sides == null) {
            throw new InvariantViolationException("Rule is not a rewrite: " + rule.pattern());
        }
        Pattern lhs = sides.get(1);
        Pattern rhs = sides.get(2);
        if (!lhs.equals(currentConfiguration)) {
            String msg = String.format("The current configuration %s does not match the left side %s of rule %d.",
                                       currentConfiguration, lhs, rule.ordinal());
            throw new InvariantViolationException(msg);
        }

        Axioms assumptions = semantics.collectFunctionalAxioms(substitution, events);
        addAssumptions(assumptions.patterns());
        addAxiom(rule.pattern());
        addClaim(instantiated);

        Proof proof = dynamicInst(loadAxiom(rule.pattern()), substitution);
        addProofExpression(proof);

        currentConfiguration = rhs;
        visitor.updateConfiguration(currentConfiguration);
        ++steps;
        logStatus(String.format("Rewrite with rule %d.", rule.ordinal()));
        return proof;
    }

    /**
     * Apply an equational rule at a location.  The configuration changes
     * once all nested simplifications are done.
     */
    public void simplificationEvent(int ordinal, Map<Integer, Pattern> substitution, Location location) {
        checkNotFinalized();
        visitor.enter();
        try {
            visitor.call(ordinal, substitution, location);
        } finally {
            visitor.exit();
        }
        currentConfiguration = visitor.simplifiedConfiguration();
        ++steps;
    }

    /**
     * Close the trace.  No further events are accepted.
     */
    public void finalizeTrace() {
        if (visitor.pendingSimplifications() > 0) {
            String msg = String.format("Trace ends with %d pending simplifications.",
                                       visitor.pendingSimplifications());
            throw new ScopeViolationException(msg);
        }
        // TODO: claim and prove that the initial configuration reaches the current one.
        finalized = true;
        logStatus(String.format("Finalized execution with %d steps.", steps));
    }

    /**
     * Build a proof from the steps of a trace.
     *
     * @param steps the converted trace
     * @param semantics the rules of the language
     * @return the proof, without claims if the trace is empty
     */
    public static ProofExp fromProofHints(Iterable<RewriteStep> steps, LanguageSemantics semantics) {
        ExecutionProofExp exp = null;
        for (RewriteStep step : steps) {
            if (exp == null) {
                if (step.configurationBefore() == null) {
                    throw new InvariantViolationException("First step of the trace has no configuration.");
                }
                exp = new ExecutionProofExp(semantics, step.configurationBefore());
            }

            KRule rule = semantics.getAxiom(step.ordinal());
            if (rule instanceof KRewritingRule) {
                exp.rewriteEvent((KRewritingRule) rule, step.substitution(), step.events());
            } else if (step.isSimplification()) {
                exp.simplificationEvent(step.ordinal(), step.substitution(), step.location());
            } else {
                String msg = String.format("Step with rule %d is neither a rewrite nor a simplification.",
                                           step.ordinal());
                throw new InvariantViolationException(msg);
            }
        }

        if (exp == null) {
            semantics.options().logStatus("WARNING: The proof expression is empty, no hints were provided.");
            ProofExp empty = new ProofExp(semantics.notations());
            empty.setStatusStream(semantics.options().getStatusStream());
            return empty;
        }
        exp.finalizeTrace();
        return exp;
    }
}
