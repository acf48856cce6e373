package com.galois.proofgen.kore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.galois.proofgen.InvariantViolationException;
import com.galois.proofgen.UnsupportedPatternException;
import com.galois.proofgen.hint.FunEvent;
import com.galois.proofgen.hint.FunctionalEvent;
import com.galois.proofgen.hint.HookEvent;
import com.galois.proofgen.kore.syntax.App;
import com.galois.proofgen.kore.syntax.Axiom;
import com.galois.proofgen.kore.syntax.Bottom;
import com.galois.proofgen.kore.syntax.DomainValue;
import com.galois.proofgen.kore.syntax.KorePattern;
import com.galois.proofgen.kore.syntax.Rewrites;
import com.galois.proofgen.kore.syntax.SetVar;
import com.galois.proofgen.pattern.EVar;
import com.galois.proofgen.pattern.Location;
import com.galois.proofgen.pattern.MetaVar;
import com.galois.proofgen.pattern.Notation;
import com.galois.proofgen.pattern.Notations;
import com.galois.proofgen.pattern.Pattern;
import com.galois.proofgen.pattern.Patterns;
import com.galois.proofgen.pattern.Symbol;

import static com.galois.proofgen.kore.KoreFixtures.*;

public class TestKoreConverter {
    KoreConverter conv;

    @Before
    public void setUp() {
        conv = KoreFixtures.converter();
    }

    private static Pattern constant(String name) {
        return KoreNotations.KORE_APP.apply(Notations.top(), Symbol.of("kore_" + name));
    }

    @Test
    public void symbolsAndSortsArePrefixed() {
        Assert.assertEquals( constant("Lbla"), conv.convertPattern(a()) );

        Pattern dv = conv.convertPattern(new DomainValue(INT, "1"));
        Assert.assertEquals( KoreNotations.KORE_DV.apply(Symbol.of("kore_sort_SortInt"), Symbol.of("kore_1")), dv );
    }

    @Test
    public void applicationsChainTheirArguments() {
        Pattern p = conv.convertPattern(plus(a(), b()));
        Pattern expected = KoreNotations.KORE_APP.apply(
            Notations.top(),
            Patterns.chain(Symbol.of("kore_Lblplus"), constant("Lbla"), constant("Lblb")));
        Assert.assertEquals( expected, p );
    }

    @Test
    public void variablesAreNumberedByFirstOccurrence() {
        Assert.assertEquals( MetaVar.of(0), conv.convertPattern(Y) );
        Assert.assertEquals( MetaVar.of(1), conv.convertPattern(X) );
        Assert.assertEquals( MetaVar.of(0), conv.convertPattern(Y) );
        Assert.assertEquals( MetaVar.of(1), conv.lookupMetaVar("X") );
    }

    @Test
    public void cellsAreMarked() {
        Pattern p = conv.convertPattern(config(a(), zero()));
        Assert.assertTrue( p instanceof Notation );
        Assert.assertEquals( KoreNotations.NESTED_CELLS, ((Notation) p).definition() );

        List<Pattern> cells = KoreNotations.children(p);
        Assert.assertEquals( 2, cells.size() );
        Assert.assertEquals( KoreNotations.CELL, ((Notation) cells.get(0)).definition() );

        Pattern kCell = KoreNotations.CELL.apply(Patterns.chain(Symbol.of("kore_k"), constant("Lbla")));
        Assert.assertEquals( kCell, cells.get(0) );
        Assert.assertEquals( Symbol.of("kore_generatedTop"),
                             KoreNotations.deconstructNaryApplication(p).head() );
    }

    @Test
    public void emptyCellIsItsHead() {
        Pattern p = conv.convertPattern(app(TOP_CELL));
        Assert.assertEquals( Symbol.of("kore_generatedTop"), p );
    }

    @Test
    public void rewriteRulesDropSideConditions() {
        ConvertedAxiom r = conv.retrieveAxiomForOrdinal(REWRITE_A_TO_B);
        Assert.assertEquals( AxiomType.RewriteRule, r.kind() );

        List<Pattern> args = KoreNotations.KORE_REWRITES.match(r.pattern());
        Assert.assertNotNull( args );
        Assert.assertEquals( Symbol.of("kore_sort_SortGeneratedTopCell"), args.get(0) );
        Assert.assertEquals( conv.convertPattern(config(a(), X)), args.get(1) );
        Assert.assertEquals( conv.convertPattern(config(b(), X)), args.get(2) );
    }

    @Test
    public void axiomsAreCached() {
        ConvertedAxiom first = conv.retrieveAxiomForOrdinal(REWRITE_B_TO_C);
        ConvertedAxiom second = conv.retrieveAxiomForOrdinal(REWRITE_B_TO_C);
        Assert.assertSame( first, second );
        Assert.assertEquals( 1, conv.axiomCacheSize() );
        Assert.assertEquals( 6, conv.axiomCount() );
    }

    @Test
    public void rewritesWithoutSideConditionsAreUnclassified() {
        Axiom plain = new Axiom(new Rewrites(INT, a(), b()), Collections.<App>emptyList());
        ConvertedAxiom converted = conv.convertAxiom(plain);
        Assert.assertEquals( AxiomType.Unclassified, converted.kind() );
        List<Pattern> sides = KoreNotations.KORE_REWRITES.match(converted.pattern());
        Assert.assertEquals( constant("Lbla"), sides.get(1) );
        Assert.assertEquals( constant("Lblb"), sides.get(2) );
    }

    @Test
    public void equationsAreClassified() {
        ConvertedAxiom eq = conv.retrieveAxiomForOrdinal(PLUS_EQUATION);
        Assert.assertEquals( AxiomType.EquationalRule, eq.kind() );
        List<Pattern> args = KoreNotations.KORE_EQUALS.match(eq.pattern());
        Assert.assertEquals( conv.convertPattern(plus(X, Y)), args.get(2) );
        Assert.assertEquals( conv.convertPattern(succ(X)), args.get(3) );

        Assert.assertEquals( AxiomType.Unclassified, conv.retrieveAxiomForOrdinal(UNCLASSIFIED).kind() );
    }

    @Test(expected = UnsupportedPatternException.class)
    public void negationIsUnsupported() {
        conv.retrieveAxiomForOrdinal(UNSUPPORTED);
    }

    @Test
    public void otherUnsupportedConstructs() {
        List<KorePattern> unsupported =
            Arrays.<KorePattern>asList(new SetVar("@S", INT), new Bottom(INT));
        for (KorePattern p : unsupported) {
            try {
                conv.convertPattern(p);
                Assert.fail("Converted " + p);
            } catch (UnsupportedPatternException e) {
                // expected
            }
        }
    }

    @Test(expected = InvariantViolationException.class)
    public void ordinalOutOfRange() {
        conv.retrieveAxiomForOrdinal(99);
    }

    @Test
    public void simplificationHeads() {
        Assert.assertTrue( conv.isSimplificationHead(Symbol.of("kore_Lblplus")) );
        Assert.assertTrue( conv.isSimplificationHead(Symbol.of("kore_Lbldouble")) );
        Assert.assertFalse( conv.isSimplificationHead(Symbol.of("kore_Lbla")) );
        Assert.assertFalse( conv.isSimplificationHead(Symbol.of("kore_Lblsucc")) );
    }

    @Test
    public void requiresClauseBindsVariables() {
        conv.retrieveAxiomForOrdinal(DOUBLE_EQUATION);
        Map<Integer, Pattern> subst = conv.requiresSubstitutions(DOUBLE_EQUATION);
        Assert.assertEquals( 1, subst.size() );
        Assert.assertEquals( conv.convertPattern(a()), subst.get(conv.lookupMetaVar("Z").id()) );

        Assert.assertTrue( conv.requiresSubstitutions(PLUS_EQUATION).isEmpty() );
        Assert.assertTrue( conv.requiresSubstitutions(REWRITE_A_TO_B).isEmpty() );
    }

    @Test
    public void substitutionsUseKnownVariables() {
        conv.retrieveAxiomForOrdinal(REWRITE_A_TO_B);
        Map<String, KorePattern> subst = new LinkedHashMap<String, KorePattern>();
        subst.put("X", zero());
        Map<Integer, Pattern> converted = conv.convertSubstitutions(subst);
        Assert.assertEquals( conv.convertPattern(zero()), converted.get(conv.lookupMetaVar("X").id()) );

        subst.put("Unknown", zero());
        try {
            conv.convertSubstitutions(subst);
            Assert.fail("Converted an unknown variable.");
        } catch (InvariantViolationException e) {
            // expected
        }
    }

    @Test
    public void functionalAxiomsForSubstitutions() {
        Pattern z = conv.convertPattern(zero());
        Map<Integer, Pattern> subst = new LinkedHashMap<Integer, Pattern>();
        subst.put(0, z);
        subst.put(1, z);
        Axioms axioms = conv.collectFunctionalAxioms(subst, Collections.<FunctionalEvent>emptyList());

        List<ConvertedAxiom> functional = axioms.get(AxiomType.FunctionalSymbol);
        Assert.assertEquals( 1, functional.size() );
        Pattern x = EVar.of(0);
        Pattern expected = Patterns.exists(0, Notations.and(Patterns.implies(x, z), Patterns.implies(z, x)));
        Assert.assertEquals( expected, functional.get(0).pattern() );
        Assert.assertTrue( axioms.get(AxiomType.FunctionEvent).isEmpty() );
    }

    @Test
    public void cellHeadsCanBeFunctional() {
        Pattern cell = conv.convertPattern(config(a(), zero()));
        Assert.assertTrue( conv.isFunctional(Symbol.of("kore_k")) );
        Map<Integer, Pattern> subst = new LinkedHashMap<Integer, Pattern>();
        subst.put(0, KoreNotations.children(cell).get(0));
        Assert.assertEquals( 1, conv.collectFunctionalAxioms(subst, Collections.<FunctionalEvent>emptyList())
                                    .get(AxiomType.FunctionalSymbol).size() );
    }

    @Test(expected = InvariantViolationException.class)
    public void nonFunctionalSubstitutionsAreRejected() {
        Map<Integer, Pattern> subst = new LinkedHashMap<Integer, Pattern>();
        subst.put(0, conv.convertPattern(app("LblnotFunctional")));
        conv.collectFunctionalAxioms(subst, Collections.<FunctionalEvent>emptyList());
    }

    @Test
    public void eventsYieldOneAxiomEach() {
        List<FunctionalEvent> events = new ArrayList<FunctionalEvent>();
        events.add(new FunEvent("Lblsucc", Location.of(0)));
        events.add(new HookEvent("INT.add", Arrays.<KorePattern>asList(a(), b()), c()));
        Axioms axioms = conv.collectFunctionalAxioms(new LinkedHashMap<Integer, Pattern>(), events);

        Pattern tautology = Patterns.implies(EVar.of(0), EVar.of(0));
        Assert.assertEquals( 1, axioms.get(AxiomType.FunctionEvent).size() );
        Assert.assertEquals( tautology, axioms.get(AxiomType.FunctionEvent).get(0).pattern() );
        Assert.assertEquals( 1, axioms.get(AxiomType.HookEvent).size() );
        Assert.assertEquals( 2, axioms.patterns().size() );
    }

    @Test
    public void organizeDropsDuplicatesAndKeepsOrder() {
        ConvertedAxiom a1 = new ConvertedAxiom(AxiomType.RewriteRule, Symbol.of("a"));
        ConvertedAxiom b1 = new ConvertedAxiom(AxiomType.RewriteRule, Symbol.of("b"));
        ConvertedAxiom a2 = new ConvertedAxiom(AxiomType.RewriteRule, Symbol.of("a"));
        ConvertedAxiom c1 = new ConvertedAxiom(AxiomType.HookEvent, Symbol.of("a"));
        Axioms axioms = KoreFixtures.converter().organizeAxioms(Arrays.asList(a1, b1, a2, c1));
        Assert.assertEquals( Arrays.asList(a1, b1), axioms.get(AxiomType.RewriteRule) );
        Assert.assertEquals( Arrays.asList(c1), axioms.get(AxiomType.HookEvent) );
        Assert.assertEquals( 2, axioms.types().size() );
        Assert.assertFalse( axioms.types().contains(AxiomType.EquationalRule) );
    }
}
