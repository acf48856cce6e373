package com.galois.proofgen.semantics;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.galois.proofgen.GenerationOptions;
import com.galois.proofgen.InvariantViolationException;
import com.galois.proofgen.hint.FunctionalEvent;
import com.galois.proofgen.hint.KoreHint;
import com.galois.proofgen.hint.RewriteStep;
import com.galois.proofgen.kore.AxiomType;
import com.galois.proofgen.kore.Axioms;
import com.galois.proofgen.kore.ConvertedAxiom;
import com.galois.proofgen.kore.KoreConverter;
import com.galois.proofgen.kore.KoreNotations;
import com.galois.proofgen.pattern.NotationDefinition;
import com.galois.proofgen.pattern.Pattern;
import com.galois.proofgen.pattern.Symbol;

/**
 * The rules of a language, looked up by ordinal.
 */
public final class LanguageSemantics {
    private final KoreConverter converter;
    private final Map<Integer, KRule> rules = new HashMap<Integer, KRule>();

    public LanguageSemantics(KoreConverter converter) {
        if (converter == null) throw new NullPointerException("converter");
        this.converter = converter;
    }

    public KoreConverter converter() {
        return converter;
    }

    public GenerationOptions options() {
        return converter.options();
    }

    /**
     * Notations that rule patterns are built from.
     */
    public List<NotationDefinition> notations() {
        return converter.notations().definitions();
    }

    /**
     * Return the rule with the given ordinal.
     *
     * @throws InvariantViolationException if there is no such axiom
     */
    public KRule getAxiom(int ordinal) {
        KRule r = rules.get(ordinal);
        if (r != null) return r;

        ConvertedAxiom axiom = converter.retrieveAxiomForOrdinal(ordinal);
        if (axiom.kind() == AxiomType.RewriteRule) {
            r = new KRewritingRule(ordinal, axiom);
        } else if (axiom.kind() == AxiomType.EquationalRule) {
            List<Pattern> args = KoreNotations.KORE_EQUALS.match(axiom.pattern());
            if (args == null) {
                throw new InvariantViolationException("Malformed equation " + axiom.pattern());
            }
            r = new KEquationalRule(ordinal, axiom, args.get(2), args.get(3),
                                    converter.requiresSubstitutions(ordinal));
        } else {
            r = new KRule(ordinal, axiom);
        }
        rules.put(ordinal, r);
        return r;
    }

    /**
     * Count the subpatterns of <code>p</code> that an equational rule could
     * simplify.
     */
    public int countSimplifications(Pattern p) {
        int count = 0;
        Pattern head = KoreNotations.deconstructNaryApplication(p).head();
        if (head instanceof Symbol && converter.isSimplificationHead((Symbol) head)) {
            ++count;
        }
        for (Pattern c : KoreNotations.children(p)) {
            count += countSimplifications(c);
        }
        return count;
    }

    public Axioms collectFunctionalAxioms(Map<Integer, Pattern> substitution,
                                          List<FunctionalEvent> events) {
        return converter.collectFunctionalAxioms(substitution, events);
    }

    /**
     * Convert a step of a trace.  The rule is converted first so that the
     * variables of the substitution are known.
     */
    public RewriteStep convertHint(KoreHint hint) {
        getAxiom(hint.ordinal());
        Pattern configuration = null;
        if (hint.configuration() != null) {
            configuration = converter.convertPattern(hint.configuration());
        }
        Map<Integer, Pattern> substitution = converter.convertSubstitutions(hint.substitutions());
        return new RewriteStep(configuration, hint.ordinal(), substitution,
                               new ArrayList<FunctionalEvent>(hint.events()), hint.location());
    }
}
