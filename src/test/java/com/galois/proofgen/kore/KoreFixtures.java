package com.galois.proofgen.kore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.galois.proofgen.GenerationOptions;
import com.galois.proofgen.kore.syntax.And;
import com.galois.proofgen.kore.syntax.App;
import com.galois.proofgen.kore.syntax.Axiom;
import com.galois.proofgen.kore.syntax.Definition;
import com.galois.proofgen.kore.syntax.ElementVar;
import com.galois.proofgen.kore.syntax.Equals;
import com.galois.proofgen.kore.syntax.Implies;
import com.galois.proofgen.kore.syntax.KoreModule;
import com.galois.proofgen.kore.syntax.KorePattern;
import com.galois.proofgen.kore.syntax.Not;
import com.galois.proofgen.kore.syntax.Rewrites;
import com.galois.proofgen.kore.syntax.Sort;
import com.galois.proofgen.kore.syntax.SortDecl;
import com.galois.proofgen.kore.syntax.SymbolDecl;
import com.galois.proofgen.kore.syntax.Top;
import com.galois.proofgen.pattern.Location;

/**
 * A small language used by the tests.
 *
 * <pre>
 *   0: &lt;k&gt; a &lt;/k&gt; &lt;state&gt; X &lt;/state&gt;  =&gt;  &lt;k&gt; b &lt;/k&gt; &lt;state&gt; X &lt;/state&gt;
 *   1: &lt;k&gt; b &lt;/k&gt; &lt;state&gt; X &lt;/state&gt;  =&gt;  &lt;k&gt; c &lt;/k&gt; &lt;state&gt; X &lt;/state&gt;
 *   2: plus(X, Y) = succ(X)
 *   3: double(Z) = plus(Z, Z)  requires Z = a
 *   4: \top
 *   5: \not(a)
 * </pre>
 */
public final class KoreFixtures {
    private KoreFixtures() {}

    public static final String TOP_CELL = "Lbl'-LT-'generatedTop'-GT-'";
    public static final String K_CELL = "Lbl'-LT-'k'-GT-'";
    public static final String STATE_CELL = "Lbl'-LT-'state'-GT-'";

    public static final Sort INT = new Sort("SortInt");
    public static final Sort TOP_SORT = new Sort("SortGeneratedTopCell");
    public static final Sort K_SORT = new Sort("SortKCell");
    public static final Sort STATE_SORT = new Sort("SortStateCell");

    public static final int REWRITE_A_TO_B = 0;
    public static final int REWRITE_B_TO_C = 1;
    public static final int PLUS_EQUATION = 2;
    public static final int DOUBLE_EQUATION = 3;
    public static final int UNCLASSIFIED = 4;
    public static final int UNSUPPORTED = 5;

    /** Location of the contents of the k cell. */
    public static final Location K_CONTENTS = Location.of(0, 0);

    public static final ElementVar X = new ElementVar("X", INT);
    public static final ElementVar Y = new ElementVar("Y", INT);
    public static final ElementVar Z = new ElementVar("Z", INT);

    public static App app(String symbol, KorePattern... args) {
        return new App(symbol, Arrays.asList(args));
    }

    public static App a() {
        return app("Lbla");
    }

    public static App b() {
        return app("Lblb");
    }

    public static App c() {
        return app("Lblc");
    }

    public static App zero() {
        return app("Lblzero");
    }

    public static App succ(KorePattern p) {
        return app("Lblsucc", p);
    }

    public static App plus(KorePattern l, KorePattern r) {
        return app("Lblplus", l, r);
    }

    public static App dbl(KorePattern p) {
        return app("Lbldouble", p);
    }

    /** <code>&lt;generatedTop&gt; &lt;k&gt; k &lt;/k&gt; &lt;state&gt; s &lt;/state&gt; &lt;/generatedTop&gt;</code> */
    public static App config(KorePattern k, KorePattern state) {
        return app(TOP_CELL, app(K_CELL, k), app(STATE_CELL, state));
    }

    private static SymbolDecl decl(String symbol, Sort result, boolean functional, Sort... args) {
        List<App> attrs = new ArrayList<App>();
        if (functional) {
            attrs.add(app("functional"));
        }
        return new SymbolDecl(symbol, Arrays.asList(args), result, attrs);
    }

    private static Axiom axiom(KorePattern p) {
        return new Axiom(p, Collections.<App>emptyList());
    }

    private static KorePattern rewrite(KorePattern from, KorePattern to) {
        return new Rewrites(TOP_SORT,
                            new And(TOP_SORT, config(from, X), new Top(TOP_SORT)),
                            new And(TOP_SORT, config(to, X), new Top(TOP_SORT)));
    }

    private static KorePattern equation(KorePattern requires, KorePattern lhs, KorePattern rhs) {
        return new Implies(INT, requires,
                           new Equals(INT, INT, lhs, new And(INT, rhs, new Top(INT))));
    }

    public static Definition definition() {
        List<SortDecl> sorts = new ArrayList<SortDecl>();
        for (Sort s : Arrays.asList(INT, TOP_SORT, K_SORT, STATE_SORT)) {
            sorts.add(new SortDecl(s.name(), Collections.<App>emptyList()));
        }

        List<SymbolDecl> symbols = new ArrayList<SymbolDecl>();
        symbols.add(decl(TOP_CELL, TOP_SORT, true, K_SORT, STATE_SORT));
        symbols.add(decl(K_CELL, K_SORT, true, INT));
        symbols.add(decl(STATE_CELL, STATE_SORT, true, INT));
        symbols.add(decl("Lbla", INT, true));
        symbols.add(decl("Lblb", INT, true));
        symbols.add(decl("Lblc", INT, true));
        symbols.add(decl("Lblzero", INT, true));
        symbols.add(decl("Lblsucc", INT, true, INT));
        symbols.add(decl("Lblplus", INT, true, INT, INT));
        symbols.add(decl("Lbldouble", INT, true, INT));
        symbols.add(decl("LblnotFunctional", INT, false));

        List<Axiom> axioms = new ArrayList<Axiom>();
        axioms.add(axiom(rewrite(a(), b())));
        axioms.add(axiom(rewrite(b(), c())));
        axioms.add(axiom(equation(new Top(INT), plus(X, Y), succ(X))));
        axioms.add(axiom(equation(new Equals(INT, INT, Z, a()), dbl(Z), plus(Z, Z))));
        axioms.add(axiom(new Top(INT)));
        axioms.add(axiom(new Not(INT, a())));

        KoreModule module = new KoreModule("TEST", sorts, symbols, axioms);
        return new Definition(Collections.singletonList(module));
    }

    /**
     * Options for tests.  Status messages are printed when the
     * <code>proofgen.debug</code> property is set.
     */
    public static GenerationOptions options() {
        GenerationOptions options = new GenerationOptions();
        if (Boolean.getBoolean("proofgen.debug")) {
            options.setStatusStream(System.out);
        }
        return options;
    }

    public static KoreConverter converter() {
        return new KoreConverter(definition(), options());
    }
}
