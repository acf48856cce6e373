package com.galois.proofgen.execution;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.galois.proofgen.InvariantViolationException;
import com.galois.proofgen.PackagingException;
import com.galois.proofgen.ScopeViolationException;
import com.galois.proofgen.hint.FunEvent;
import com.galois.proofgen.hint.FunctionalEvent;
import com.galois.proofgen.hint.RewriteStep;
import com.galois.proofgen.kore.KoreConverter;
import com.galois.proofgen.kore.KoreFixtures;
import com.galois.proofgen.kore.KoreNotations;
import com.galois.proofgen.kore.syntax.KorePattern;
import com.galois.proofgen.pattern.EVar;
import com.galois.proofgen.pattern.Location;
import com.galois.proofgen.pattern.Pattern;
import com.galois.proofgen.pattern.Patterns;
import com.galois.proofgen.proof.Instruction;
import com.galois.proofgen.proof.Proof;
import com.galois.proofgen.proof.ProofExp;
import com.galois.proofgen.semantics.KRewritingRule;
import com.galois.proofgen.semantics.LanguageSemantics;

public class TestExecutionProofExp {
    KoreConverter conv;
    LanguageSemantics ls;
    KRewritingRule aToB;
    KRewritingRule bToC;
    Map<Integer, Pattern> xIsZero;

    @Before
    public void setUp() {
        conv = KoreFixtures.converter();
        ls = new LanguageSemantics(conv);
        aToB = (KRewritingRule) ls.getAxiom(KoreFixtures.REWRITE_A_TO_B);
        bToC = (KRewritingRule) ls.getAxiom(KoreFixtures.REWRITE_B_TO_C);
        xIsZero = new HashMap<Integer, Pattern>();
        xIsZero.put(conv.lookupMetaVar("X").id(), conv.convertPattern(KoreFixtures.zero()));
    }

    private Pattern config(KorePattern k) {
        return conv.convertPattern(KoreFixtures.config(k, KoreFixtures.zero()));
    }

    private static List<FunctionalEvent> noEvents() {
        return Collections.<FunctionalEvent>emptyList();
    }

    @Test
    public void twoRewriteSteps() throws Exception {
        List<RewriteStep> trace = new ArrayList<RewriteStep>();
        trace.add(new RewriteStep(config(KoreFixtures.a()), KoreFixtures.REWRITE_A_TO_B, xIsZero, noEvents(), null));
        trace.add(new RewriteStep(null, KoreFixtures.REWRITE_B_TO_C, xIsZero, noEvents(), null));

        ProofExp result = ExecutionProofExp.fromProofHints(trace, ls);
        Assert.assertTrue( result instanceof ExecutionProofExp );
        ExecutionProofExp exp = (ExecutionProofExp) result;

        Assert.assertEquals( ExecutionState.FINALIZED, exp.state() );
        Assert.assertEquals( config(KoreFixtures.a()), exp.initialConfiguration() );
        Assert.assertEquals( config(KoreFixtures.c()), exp.currentConfiguration() );

        Assert.assertEquals( 2, exp.claims().size() );
        Assert.assertEquals( aToB.pattern().instantiate(xIsZero), exp.claims().get(0) );
        Assert.assertEquals( bToC.pattern().instantiate(xIsZero), exp.claims().get(1) );
        for (int i = 0; i != 2; ++i) {
            Assert.assertEquals( exp.claims().get(i), exp.proofs().get(i).conclusion() );
        }

        // Definedness of zero is assumed once, then the two rules.
        Assert.assertEquals( 3, exp.axioms().size() );
        Assert.assertEquals( aToB.pattern(), exp.axioms().get(1) );
        Assert.assertEquals( bToC.pattern(), exp.axioms().get(2) );

        ByteArrayOutputStream gamma = new ByteArrayOutputStream();
        ByteArrayOutputStream claims = new ByteArrayOutputStream();
        ByteArrayOutputStream proofs = new ByteArrayOutputStream();
        exp.serialize(gamma, claims, proofs);
        Assert.assertTrue( gamma.size() > 0 );
        byte[] out = proofs.toByteArray();
        Assert.assertEquals( Instruction.PUBLISH.code(), out[out.length - 1] );
    }

    @Test
    public void mismatchedRuleLeavesStateUnchanged() {
        ExecutionProofExp exp = new ExecutionProofExp(ls, config(KoreFixtures.a()));
        try {
            exp.rewriteEvent(bToC, xIsZero);
            Assert.fail("Rule applied to a configuration it does not match.");
        } catch (InvariantViolationException e) {
            // expected
        }
        Assert.assertEquals( config(KoreFixtures.a()), exp.currentConfiguration() );
        Assert.assertTrue( exp.claims().isEmpty() );
        Assert.assertTrue( exp.proofs().isEmpty() );
        Assert.assertTrue( exp.axioms().isEmpty() );
        Assert.assertEquals( ExecutionState.EMPTY, exp.state() );

        exp.rewriteEvent(aToB, xIsZero);
        Assert.assertEquals( config(KoreFixtures.b()), exp.currentConfiguration() );
        Assert.assertEquals( ExecutionState.STEPPING, exp.state() );
    }

    @Test
    public void rewriteProofInstantiatesTheRule() {
        ExecutionProofExp exp = new ExecutionProofExp(ls, config(KoreFixtures.a()));
        Proof p = exp.rewriteEvent(aToB, xIsZero);
        List<Pattern> sides = KoreNotations.KORE_REWRITES.match(p.conclusion());
        Assert.assertEquals( config(KoreFixtures.a()), sides.get(1) );
        Assert.assertEquals( config(KoreFixtures.b()), sides.get(2) );
    }

    @Test
    public void eventsAddAxioms() {
        ExecutionProofExp exp = new ExecutionProofExp(ls, config(KoreFixtures.a()));
        List<FunctionalEvent> events = Arrays.<FunctionalEvent>asList(new FunEvent("Lblsucc", Location.ROOT));
        exp.rewriteEvent(aToB, xIsZero, events);
        Assert.assertTrue( exp.axioms().contains(Patterns.implies(EVar.of(0), EVar.of(0))) );
    }

    @Test
    public void emptyTrace() throws Exception {
        ProofExp exp = ExecutionProofExp.fromProofHints(new ArrayList<RewriteStep>(), ls);
        Assert.assertFalse( exp instanceof ExecutionProofExp );
        Assert.assertTrue( exp.claims().isEmpty() );
        Assert.assertTrue( exp.proofs().isEmpty() );

        ByteArrayOutputStream claims = new ByteArrayOutputStream();
        ByteArrayOutputStream proofs = new ByteArrayOutputStream();
        exp.serialize(claims, proofs);
        Assert.assertEquals( 0, claims.size() );
        Assert.assertEquals( 0, proofs.size() );
    }

    @Test
    public void simplificationsUpdateTheConfiguration() {
        ls.getAxiom(KoreFixtures.PLUS_EQUATION);
        Pattern a = conv.convertPattern(KoreFixtures.a());
        Map<Integer, Pattern> subst = new HashMap<Integer, Pattern>();
        subst.put(conv.lookupMetaVar("X").id(), a);
        subst.put(conv.lookupMetaVar("Y").id(), a);

        List<RewriteStep> trace = new ArrayList<RewriteStep>();
        trace.add(new RewriteStep(config(KoreFixtures.dbl(KoreFixtures.a())), KoreFixtures.DOUBLE_EQUATION,
                                  new HashMap<Integer, Pattern>(), noEvents(), KoreFixtures.K_CONTENTS));
        trace.add(new RewriteStep(null, KoreFixtures.PLUS_EQUATION, subst, noEvents(), Location.ROOT));

        ExecutionProofExp exp = (ExecutionProofExp) ExecutionProofExp.fromProofHints(trace, ls);
        Assert.assertEquals( config(KoreFixtures.succ(KoreFixtures.a())), exp.currentConfiguration() );
        Assert.assertTrue( exp.claims().isEmpty() );
    }

    @Test
    public void rewriteWhileSimplifyingIsRejected() {
        ExecutionProofExp exp = new ExecutionProofExp(ls, config(KoreFixtures.dbl(KoreFixtures.a())));
        exp.simplificationEvent(KoreFixtures.DOUBLE_EQUATION, new HashMap<Integer, Pattern>(),
                                KoreFixtures.K_CONTENTS);
        Assert.assertEquals( ExecutionState.IN_SIMPLIFICATION, exp.state() );
        try {
            exp.rewriteEvent(aToB, xIsZero);
            Assert.fail("Rewrite accepted with a pending simplification.");
        } catch (ScopeViolationException e) {
            // expected
        }
        Assert.assertTrue( exp.claims().isEmpty() );
    }

    @Test(expected = PackagingException.class)
    public void assumptionsNeedTheirOwnStream() throws Exception {
        ExecutionProofExp exp = new ExecutionProofExp(ls, config(KoreFixtures.a()));
        exp.rewriteEvent(aToB, xIsZero);
        exp.serialize(new ByteArrayOutputStream(), new ByteArrayOutputStream());
    }

    @Test(expected = IllegalStateException.class)
    public void noEventsAfterFinalizing() {
        ExecutionProofExp exp = new ExecutionProofExp(ls, config(KoreFixtures.a()));
        exp.finalizeTrace();
        exp.rewriteEvent(aToB, xIsZero);
    }

    @Test(expected = InvariantViolationException.class)
    public void unclassifiedStepsAreRejected() {
        List<RewriteStep> trace = new ArrayList<RewriteStep>();
        trace.add(new RewriteStep(config(KoreFixtures.a()), KoreFixtures.UNCLASSIFIED,
                                  new HashMap<Integer, Pattern>(), noEvents(), null));
        ExecutionProofExp.fromProofHints(trace, ls);
    }
}
