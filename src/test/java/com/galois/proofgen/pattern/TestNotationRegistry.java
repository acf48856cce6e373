package com.galois.proofgen.pattern;

import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

public class TestNotationRegistry {
    @Test
    public void registeredNotationsResolve() {
        NotationRegistry r = new NotationRegistry();
        Notations.registerAll(r);
        Assert.assertEquals( 5, r.size() );
        Assert.assertTrue( r.contains("neg") );
        Assert.assertSame( Notations.NEG, r.lookup("neg") );

        Pattern s = Symbol.of("s");
        Notation n = r.resolve("neg", Symbol.of("unused"), Arrays.<Pattern>asList(s));
        Assert.assertEquals( Notations.neg(s), n );
        Assert.assertFalse( n.definition().isPlaceholder() );
    }

    @Test
    public void unknownNamesResolveToPlaceholders() {
        NotationRegistry r = new NotationRegistry();
        Symbol f = Symbol.of("f");
        List<Pattern> args = Arrays.<Pattern>asList(Symbol.of("x"), Symbol.of("y"));
        Notation n = r.resolve("fancy", f, args);
        Assert.assertTrue( n.definition().isPlaceholder() );
        Assert.assertEquals( "fancy", n.name() );
        Assert.assertEquals( args, n.arguments() );
        Assert.assertEquals( Patterns.chain(f, Symbol.of("x"), Symbol.of("y")), n );
        Assert.assertNull( r.lookup("fancy") );
    }

    @Test
    public void reregisteringIsIdempotent() {
        NotationRegistry r = new NotationRegistry();
        r.register(Notations.TOP);
        r.register(Notations.TOP);
        Assert.assertEquals( 1, r.size() );
    }

    @Test(expected = IllegalArgumentException.class)
    public void conflictingDefinitionsAreRejected() {
        NotationRegistry r = new NotationRegistry();
        r.register(Notations.TOP);
        r.register(new NotationDefinition("top", 0, Symbol.of("t")));
    }
}
