package com.galois.proofgen.proof;

/**
 * Opcodes understood by the proof checker.
 */
public enum Instruction {
    // Patterns
    LIST(1),
    EVAR(2),
    SVAR(3),
    SYMBOL(4),
    IMPLICATION(5),
    APPLICATION(6),
    MU(7),
    EXISTS(8),

    // Meta patterns
    META_VAR(9),
    E_SUBST(10),
    S_SUBST(11),

    // Axiom schemas
    PROP1(12),
    PROP2(13),
    PROP3(14),
    QUANTIFIER(15),
    PROPAGATION_OR(16),
    PROPAGATION_EXISTS(17),
    PRE_FIXPOINT(18),
    EXISTENCE(19),
    SINGLETON(20),

    // Inference rules
    MODUS_PONENS(21),
    GENERALIZATION(22),
    FRAME(23),
    SUBSTITUTION(24),
    KNASTER_TARSKI(25),

    // Meta inference rules
    INSTANTIATE(26),

    // Stack, memory and journal
    POP(27),
    SAVE(28),
    LOAD(29),
    PUBLISH(30),

    // Metavariable without constraints
    CLEAN_META_VAR(9 + 128);

    private final int code;

    private Instruction(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
