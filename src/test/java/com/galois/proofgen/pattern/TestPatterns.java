package com.galois.proofgen.pattern;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

public class TestPatterns {
    private static final Pattern PHI0 = MetaVar.of(0);
    private static final Pattern PHI1 = MetaVar.of(1);

    @Test
    public void leavesAreInterned() {
        Assert.assertSame( Symbol.of("s"), Symbol.of("s") );
        Assert.assertSame( EVar.of(3), EVar.of(3) );
        Assert.assertSame( SVar.of(3), SVar.of(3) );
        Assert.assertSame( MetaVar.of(3), MetaVar.of(3) );
        Assert.assertFalse( EVar.of(3).equals(SVar.of(3)) );
    }

    @Test
    public void structuralEquality() {
        Pattern a = Patterns.implies(Symbol.of("a"), Patterns.exists(0, EVar.of(0)));
        Pattern b = Patterns.implies(Symbol.of("a"), Patterns.exists(0, EVar.of(0)));
        Assert.assertEquals( a, b );
        Assert.assertEquals( a.hashCode(), b.hashCode() );
        Assert.assertFalse( a.equals(Patterns.implies(Symbol.of("a"), Patterns.exists(1, EVar.of(1)))) );
    }

    @Test
    public void chainIsLeftNested() {
        Pattern f = Symbol.of("f");
        Pattern x = Symbol.of("x");
        Pattern y = Symbol.of("y");
        Assert.assertEquals( f, Patterns.chain(f) );
        Assert.assertEquals( Patterns.app(Patterns.app(f, x), y), Patterns.chain(f, x, y) );
        Assert.assertEquals( Arrays.asList(f, x, y), Patterns.unchain(Patterns.chain(f, x, y)) );
    }

    @Test(expected = IllegalArgumentException.class)
    public void chainOfNothingFails() {
        Patterns.chain(new ArrayList<Pattern>());
    }

    @Test
    public void notationEqualsExpansion() {
        Pattern s = Symbol.of("s");
        Pattern n = Notations.neg(s);
        Pattern expanded = Patterns.implies(s, Patterns.mu(0, SVar.of(0)));
        Assert.assertEquals( expanded, n );
        Assert.assertEquals( n, expanded );
        Assert.assertEquals( expanded.hashCode(), n.hashCode() );
        Assert.assertEquals( "neg(s)", n.toString() );
    }

    @Test
    public void nestedNotationsExpandPositionally() {
        Pattern a = Symbol.of("a");
        Pattern b = Symbol.of("b");
        // and(a, b) = neg(a -> neg(b))
        Pattern expected = Notations.neg(Patterns.implies(a, Notations.neg(b)));
        Assert.assertEquals( expected, Notations.and(a, b) );
        Assert.assertFalse( Notations.and(b, a).equals(Notations.and(a, b)) );
        Assert.assertEquals( Notations.neg(Notations.bot()), Notations.top() );
    }

    @Test
    public void instantiateIsSimultaneous() {
        Pattern p = Patterns.implies(PHI0, PHI1);
        Map<Integer, Pattern> plugs = new HashMap<Integer, Pattern>();
        plugs.put(0, PHI1);
        plugs.put(1, PHI0);
        Assert.assertEquals( Patterns.implies(PHI1, PHI0), p.instantiate(plugs) );
        Assert.assertSame( p, p.instantiate(5, Symbol.of("s")) );
    }

    @Test
    public void instantiateRebuildsNotations() {
        Pattern n = Notations.neg(PHI0);
        Pattern i = n.instantiate(0, Symbol.of("s"));
        Assert.assertTrue( i instanceof Notation );
        Assert.assertEquals( Notations.neg(Symbol.of("s")), i );
    }

    @Test
    public void metaVarsOfPattern() {
        Pattern p = Patterns.app(PHI1, Notations.neg(Patterns.exists(0, MetaVar.of(4))));
        Assert.assertEquals( Arrays.asList(1, 4), new ArrayList<Integer>(Patterns.metaVars(p)) );
    }

    @Test
    public void matchRecoversArguments() {
        Pattern a = Symbol.of("a");
        Pattern b = Symbol.of("b");
        Pattern raw = Patterns.implies(Notations.neg(a), b);
        List<Pattern> args = Notations.OR.match(raw);
        Assert.assertNotNull( args );
        Assert.assertEquals( Arrays.asList(a, b), args );
        Assert.assertNull( Notations.OR.match(Patterns.implies(a, b)) );
    }

    @Test
    public void matchRequiresConsistentBindings() {
        Map<Integer, Pattern> bindings = new HashMap<Integer, Pattern>();
        Pattern template = Patterns.implies(PHI0, PHI0);
        Assert.assertTrue( Patterns.match(template, Patterns.implies(Symbol.of("a"), Symbol.of("a")), bindings) );
        Assert.assertEquals( Symbol.of("a"), bindings.get(0) );
        bindings.clear();
        Assert.assertFalse( Patterns.match(template, Patterns.implies(Symbol.of("a"), Symbol.of("b")), bindings) );
    }

    @Test
    public void notationArityIsChecked() {
        try {
            new NotationDefinition("bad", 1, Patterns.implies(PHI0, PHI1));
            Assert.fail("Template refers to a missing argument.");
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            Notations.NEG.apply(PHI0, PHI1);
            Assert.fail("Too many arguments.");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void locations() {
        Location l = Location.of(0, 2);
        Assert.assertEquals( 2, l.depth() );
        Assert.assertEquals( 2, l.index(1) );
        Assert.assertEquals( Arrays.asList(0, 2), l.indices() );
        Assert.assertEquals( l, Location.of(Arrays.asList(0, 2)) );
        Assert.assertTrue( Location.ROOT.isRoot() );
        Assert.assertFalse( l.isRoot() );
    }
}
