package com.galois.proofgen.pattern;

/**
 * Propositional connectives defined from implication and the least
 * fixed point.
 */
public final class Notations {
    private Notations() {}

    private static final Pattern PHI0 = MetaVar.of(0);
    private static final Pattern PHI1 = MetaVar.of(1);

    /** Falsehood, <code>mu X . X</code>. */
    public static final NotationDefinition BOT =
        new NotationDefinition("bot", 0, new Mu(0, SVar.of(0)));

    /** Negation, <code>phi0 -> bot</code>. */
    public static final NotationDefinition NEG =
        new NotationDefinition("neg", 1, new Implication(PHI0, BOT.apply()));

    /** Truth, <code>neg bot</code>. */
    public static final NotationDefinition TOP =
        new NotationDefinition("top", 0, NEG.apply(BOT.apply()));

    /** Conjunction, <code>neg (phi0 -> neg phi1)</code>. */
    public static final NotationDefinition AND =
        new NotationDefinition("and", 2, NEG.apply(new Implication(PHI0, NEG.apply(PHI1))));

    /** Disjunction, <code>neg phi0 -> phi1</code>. */
    public static final NotationDefinition OR =
        new NotationDefinition("or", 2, new Implication(NEG.apply(PHI0), PHI1));

    public static Pattern bot() {
        return BOT.apply();
    }

    public static Pattern top() {
        return TOP.apply();
    }

    public static Pattern neg(Pattern p) {
        return NEG.apply(p);
    }

    public static Pattern and(Pattern left, Pattern right) {
        return AND.apply(left, right);
    }

    public static Pattern or(Pattern left, Pattern right) {
        return OR.apply(left, right);
    }

    /**
     * Register the connectives defined here.
     */
    public static void registerAll(NotationRegistry registry) {
        registry.register(BOT);
        registry.register(NEG);
        registry.register(TOP);
        registry.register(AND);
        registry.register(OR);
    }
}
