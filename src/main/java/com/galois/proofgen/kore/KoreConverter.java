package com.galois.proofgen.kore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

import com.galois.proofgen.GenerationOptions;
import com.galois.proofgen.InvariantViolationException;
import com.galois.proofgen.UnsupportedPatternException;
import com.galois.proofgen.hint.FunEvent;
import com.galois.proofgen.hint.FunctionalEvent;
import com.galois.proofgen.hint.HookEvent;
import com.galois.proofgen.kore.syntax.And;
import com.galois.proofgen.kore.syntax.App;
import com.galois.proofgen.kore.syntax.Axiom;
import com.galois.proofgen.kore.syntax.Bottom;
import com.galois.proofgen.kore.syntax.Definition;
import com.galois.proofgen.kore.syntax.DomainValue;
import com.galois.proofgen.kore.syntax.ElementVar;
import com.galois.proofgen.kore.syntax.Equals;
import com.galois.proofgen.kore.syntax.Implies;
import com.galois.proofgen.kore.syntax.KorePattern;
import com.galois.proofgen.kore.syntax.Not;
import com.galois.proofgen.kore.syntax.Or;
import com.galois.proofgen.kore.syntax.Rewrites;
import com.galois.proofgen.kore.syntax.SetVar;
import com.galois.proofgen.kore.syntax.Sort;
import com.galois.proofgen.kore.syntax.SymbolDecl;
import com.galois.proofgen.kore.syntax.Top;
import com.galois.proofgen.pattern.EVar;
import com.galois.proofgen.pattern.MetaVar;
import com.galois.proofgen.pattern.NotationRegistry;
import com.galois.proofgen.pattern.Notations;
import com.galois.proofgen.pattern.Pattern;
import com.galois.proofgen.pattern.Patterns;
import com.galois.proofgen.pattern.Symbol;

/**
 * Translates a Kore definition into matching logic patterns.
 *
 * <p>
 * Axioms are addressed by ordinal, their position in the definition.
 * Kore element variables are translated to metavariables, numbered in the
 * order the converter first meets them, so that a rule can be instantiated
 * with the values reported by a trace.
 */
public final class KoreConverter {
    private static final java.util.regex.Pattern CELL_NAME =
        java.util.regex.Pattern.compile("Lbl'-LT-'(.+)'-GT-'");

    private final Definition definition;
    private final GenerationOptions options;
    private final NotationRegistry notations = new NotationRegistry();

    /** Axioms indexed by ordinal. */
    private final List<Axiom> axioms;
    private final Map<Axiom, ConvertedAxiom> axiomCache = new HashMap<Axiom, ConvertedAxiom>();

    private final Map<String, Symbol> symbols = new HashMap<String, Symbol>();
    private final Map<String, Symbol> sorts = new HashMap<String, Symbol>();
    private final Map<String, MetaVar> metaVars = new LinkedHashMap<String, MetaVar>();

    /** Kore names of symbols declared functional. */
    private final Set<String> rawFunctionalSymbols = new HashSet<String>();
    private final Set<Symbol> functionalSymbols = new HashSet<Symbol>();

    /** Kore names of cell symbols seen so far. */
    private final Set<String> cellSymbols = new HashSet<String>();
    private final Map<String, Symbol> cellHeads = new HashMap<String, Symbol>();

    /** Heads of the left sides of equational axioms. */
    private final Set<Symbol> simplificationHeads = new HashSet<Symbol>();

    public KoreConverter(Definition definition) {
        this(definition, new GenerationOptions());
    }

    public KoreConverter(Definition definition, GenerationOptions options) {
        if (definition == null) throw new NullPointerException("definition");
        if (options == null) throw new NullPointerException("options");
        this.definition = definition;
        this.options = options;
        this.axioms = definition.axioms();
        KoreNotations.registerAll(notations);
        cellSymbols.add(options.getGeneratedTopSymbol());

        for (SymbolDecl decl : definition.symbols()) {
            if (decl.hasAttribute("functional")) {
                rawFunctionalSymbols.add(decl.symbol());
            }
        }
        for (Axiom axiom : axioms) {
            Equals eq = equation(axiom.pattern());
            if (eq != null && eq.left() instanceof App) {
                simplificationHeads.add(resolveSymbol(((App) eq.left()).symbol()));
            }
        }
        options.logStatus(String.format("Loaded %d axioms and %d functional symbols.",
                                        axioms.size(), rawFunctionalSymbols.size()));
    }

    public Definition definition() {
        return definition;
    }

    public GenerationOptions options() {
        return options;
    }

    /**
     * Return the notations used by converted patterns.
     */
    public NotationRegistry notations() {
        return notations;
    }

    /** Number of axioms in the definition. */
    public int axiomCount() {
        return axioms.size();
    }

    /** Number of axioms converted so far. */
    public int axiomCacheSize() {
        return axiomCache.size();
    }

    // Patterns
    // ========

    /**
     * Translate a Kore pattern.
     *
     * @throws UnsupportedPatternException if the pattern uses a construct
     *   that has no translation
     */
    public Pattern convertPattern(KorePattern pattern) {
        return pattern.accept(converter);
    }

    private final KorePattern.Visitor<Pattern> converter = new KorePattern.Visitor<Pattern>() {
        public Pattern visitRewrites(Rewrites p) {
            return KoreNotations.KORE_REWRITES.apply(resolveSort(p.sort()),
                                                     convertPattern(p.left()),
                                                     convertPattern(p.right()));
        }

        public Pattern visitAnd(And p) {
            return KoreNotations.KORE_AND.apply(resolveSort(p.sort()),
                                                convertPattern(p.left()),
                                                convertPattern(p.right()));
        }

        public Pattern visitOr(Or p) {
            return KoreNotations.KORE_OR.apply(resolveSort(p.sort()),
                                               convertPattern(p.left()),
                                               convertPattern(p.right()));
        }

        public Pattern visitImplies(Implies p) {
            return KoreNotations.KORE_IMPLIES.apply(resolveSort(p.sort()),
                                                    convertPattern(p.left()),
                                                    convertPattern(p.right()));
        }

        public Pattern visitEquals(Equals p) {
            return KoreNotations.KORE_EQUALS.apply(resolveSort(p.operandSort()),
                                                   resolveSort(p.sort()),
                                                   convertPattern(p.left()),
                                                   convertPattern(p.right()));
        }

        public Pattern visitApp(App p) {
            if (cellSymbols.contains(p.symbol())) {
                return convertCell(p);
            }
            return convertApplication(p);
        }

        public Pattern visitElementVar(ElementVar p) {
            return resolveMetaVar(p.name());
        }

        public Pattern visitSetVar(SetVar p) {
            throw unsupported(p);
        }

        public Pattern visitTop(Top p) {
            return KoreNotations.KORE_TOP.apply(resolveSort(p.sort()));
        }

        public Pattern visitBottom(Bottom p) {
            throw unsupported(p);
        }

        public Pattern visitNot(Not p) {
            throw unsupported(p);
        }

        public Pattern visitDomainValue(DomainValue p) {
            return KoreNotations.KORE_DV.apply(resolveSort(p.sort()), resolveSymbol(p.value()));
        }
    };

    private static UnsupportedPatternException unsupported(KorePattern p) {
        return new UnsupportedPatternException("Pattern " + p + " is not supported.");
    }

    private Pattern convertApplication(App p) {
        Symbol symbol = resolveSymbol(p.symbol());
        List<Pattern> args = new ArrayList<Pattern>(p.args().size());
        for (KorePattern a : p.args()) {
            args.add(convertPattern(a));
        }
        if (notations.contains(p.symbol())) {
            return notations.resolve(p.symbol(), symbol, args);
        }

        List<Pattern> parts = new ArrayList<Pattern>(args.size() + 1);
        parts.add(symbol);
        parts.addAll(args);

        List<Pattern> sortPatterns = new ArrayList<Pattern>(p.sorts().size());
        for (Sort s : p.sorts()) {
            sortPatterns.add(resolveSort(s));
        }
        Pattern sortChain = sortPatterns.isEmpty() ? Notations.top() : Patterns.chain(sortPatterns);
        return KoreNotations.KORE_APP.apply(sortChain, Patterns.chain(parts));
    }

    /** Return the cell name of an application, or null if it is not a cell. */
    private static String cellName(KorePattern p) {
        if (!(p instanceof App)) return null;
        Matcher m = CELL_NAME.matcher(((App) p).symbol());
        return m.matches() ? m.group(1) : null;
    }

    private Pattern convertCell(App cell) {
        String name = cellName(cell);
        if (name == null) {
            String msg = String.format("Application %s is not a cell.", cell.symbol());
            throw new UnsupportedPatternException(msg);
        }

        Symbol head = cellHeads.get(cell.symbol());
        if (head == null) {
            head = resolveSymbol(name);
            cellSymbols.add(cell.symbol());
            cellHeads.put(cell.symbol(), head);
            if (rawFunctionalSymbols.contains(cell.symbol())) {
                functionalSymbols.add(head);
            }
        }

        if (cell.args().isEmpty()) {
            options.logStatus(String.format("Cell %s has nothing to store.", name));
            return head;
        }

        List<Pattern> parts = new ArrayList<Pattern>(cell.args().size() + 1);
        parts.add(head);
        boolean nested = false;
        for (KorePattern a : cell.args()) {
            if (cellName(a) != null) {
                nested = true;
                parts.add(convertCell((App) a));
            } else {
                parts.add(convertPattern(a));
            }
        }
        if (nested) {
            return KoreNotations.NESTED_CELLS.apply(Patterns.chain(parts));
        }
        return KoreNotations.CELL.apply(Patterns.chain(parts));
    }

    private Symbol resolveSymbol(String name) {
        Symbol r = symbols.get(name);
        if (r == null) {
            r = Symbol.of(options.getSymbolPrefix() + name);
            symbols.put(name, r);
            if (rawFunctionalSymbols.contains(name)) {
                functionalSymbols.add(r);
            }
        }
        return r;
    }

    private Symbol resolveSort(Sort sort) {
        Symbol r = sorts.get(sort.name());
        if (r == null) {
            r = Symbol.of(options.getSortPrefix() + sort.name());
            sorts.put(sort.name(), r);
        }
        return r;
    }

    private MetaVar resolveMetaVar(String name) {
        MetaVar r = metaVars.get(name);
        if (r == null) {
            r = MetaVar.of(metaVars.size());
            metaVars.put(name, r);
        }
        return r;
    }

    /**
     * Return the metavariable standing for a Kore variable.
     *
     * @throws InvariantViolationException if the variable was never converted
     */
    public MetaVar lookupMetaVar(String name) {
        MetaVar r = metaVars.get(name);
        if (r == null) {
            String msg = String.format("Variable %s is not a known metavariable.", name);
            throw new InvariantViolationException(msg);
        }
        return r;
    }

    /**
     * Return whether a converted symbol is declared functional.
     */
    public boolean isFunctional(Symbol symbol) {
        return functionalSymbols.contains(symbol);
    }

    // Axioms
    // ======

    /**
     * Return the converted axiom with the given ordinal.
     *
     * @throws InvariantViolationException if there is no such axiom
     */
    public ConvertedAxiom retrieveAxiomForOrdinal(int ordinal) {
        return convertAxiom(rawAxiom(ordinal));
    }

    private Axiom rawAxiom(int ordinal) {
        if (ordinal < 0 || ordinal >= axioms.size()) {
            String msg = String.format("Ordinal %d is out of range, there are %d axioms.",
                                       ordinal, axioms.size());
            throw new InvariantViolationException(msg);
        }
        return axioms.get(ordinal);
    }

    /**
     * Classify and translate an axiom.  Results are cached, so converting
     * the same axiom again returns the same object.
     */
    public ConvertedAxiom convertAxiom(Axiom axiom) {
        ConvertedAxiom cached = axiomCache.get(axiom);
        if (cached != null) return cached;

        KorePattern p = axiom.pattern();
        ConvertedAxiom r;
        Equals eq = equation(p);
        if (isRewriteRule(p)) {
            Rewrites rw = (Rewrites) p;
            // Side conditions are dropped.
            Pattern converted =
                KoreNotations.KORE_REWRITES.apply(resolveSort(rw.sort()),
                                                  convertPattern(((And) rw.left()).left()),
                                                  convertPattern(((And) rw.right()).left()));
            r = new ConvertedAxiom(AxiomType.RewriteRule, converted);
        } else if (eq != null) {
            Pattern converted =
                KoreNotations.KORE_EQUALS.apply(resolveSort(eq.operandSort()),
                                                resolveSort(eq.sort()),
                                                convertPattern(eq.left()),
                                                convertPattern(((And) eq.right()).left()));
            r = new ConvertedAxiom(AxiomType.EquationalRule, converted);
        } else {
            r = new ConvertedAxiom(AxiomType.Unclassified, convertPattern(p));
        }
        axiomCache.put(axiom, r);
        return r;
    }

    /** Rewrites whose sides both carry side conditions. */
    private static boolean isRewriteRule(KorePattern p) {
        if (!(p instanceof Rewrites)) return false;
        Rewrites rw = (Rewrites) p;
        return rw.left() instanceof And && rw.right() instanceof And;
    }

    /**
     * Return the equality of an axiom <code>requires -> (lhs = rhs /\ ensures)</code>,
     * or null if the axiom has another shape.
     */
    private static Equals equation(KorePattern p) {
        if (!(p instanceof Implies)) return null;
        KorePattern concl = ((Implies) p).right();
        if (!(concl instanceof Equals)) return null;
        Equals eq = (Equals) concl;
        if (!(eq.right() instanceof And)) return null;
        return eq;
    }

    /**
     * Return whether a symbol heads the left side of an equational axiom.
     */
    public boolean isSimplificationHead(Symbol symbol) {
        return simplificationHeads.contains(symbol);
    }

    /**
     * Return the substitutions an equational axiom's requires clause imposes,
     * from conjuncts of the form <code>X = t</code>.  Other axioms impose
     * none.
     */
    public Map<Integer, Pattern> requiresSubstitutions(int ordinal) {
        Map<Integer, Pattern> r = new LinkedHashMap<Integer, Pattern>();
        KorePattern p = rawAxiom(ordinal).pattern();
        if (equation(p) != null) {
            collectRequires(((Implies) p).left(), r);
        }
        return r;
    }

    private void collectRequires(KorePattern p, Map<Integer, Pattern> r) {
        if (p instanceof And) {
            collectRequires(((And) p).left(), r);
            collectRequires(((And) p).right(), r);
        } else if (p instanceof Equals) {
            Equals eq = (Equals) p;
            if (eq.left() instanceof ElementVar) {
                MetaVar v = resolveMetaVar(((ElementVar) eq.left()).name());
                r.put(v.id(), convertPattern(eq.right()));
            }
        }
    }

    /**
     * Translate the substitution of a trace step.
     *
     * @throws InvariantViolationException if a variable is unknown
     */
    public Map<Integer, Pattern> convertSubstitutions(Map<String, KorePattern> substitutions) {
        Map<Integer, Pattern> r = new LinkedHashMap<Integer, Pattern>();
        for (Map.Entry<String, KorePattern> e : substitutions.entrySet()) {
            r.put(lookupMetaVar(e.getKey()).id(), convertPattern(e.getValue()));
        }
        return r;
    }

    /**
     * Build the axioms a trace step relies on: definedness of every
     * substituted value and one axiom per auxiliary event.
     *
     * @throws InvariantViolationException if a substituted value is not
     *   headed by a functional symbol
     */
    public Axioms collectFunctionalAxioms(Map<Integer, Pattern> substitution,
                                          List<FunctionalEvent> events) {
        List<ConvertedAxiom> added = new ArrayList<ConvertedAxiom>();
        for (Pattern p : substitution.values()) {
            Pattern head = KoreNotations.deconstructNaryApplication(p).head();
            if (!(head instanceof Symbol) || !functionalSymbols.contains(head)) {
                String msg = String.format("Substituted pattern %s is not headed by a functional symbol.", p);
                throw new InvariantViolationException(msg);
            }
            Pattern x = EVar.of(0);
            Pattern axiom = Patterns.exists(0, Notations.and(Patterns.implies(x, p), Patterns.implies(p, x)));
            added.add(new ConvertedAxiom(AxiomType.FunctionalSymbol, axiom));
        }
        for (FunctionalEvent e : events) {
            // TODO: state the value the event computes instead of a tautology.
            Pattern axiom = Patterns.implies(EVar.of(0), EVar.of(0));
            if (e instanceof FunEvent) {
                added.add(new ConvertedAxiom(AxiomType.FunctionEvent, axiom));
            } else if (e instanceof HookEvent) {
                added.add(new ConvertedAxiom(AxiomType.HookEvent, axiom));
            } else {
                throw new IllegalArgumentException("Unknown event " + e);
            }
        }
        return organizeAxioms(added);
    }

    /**
     * Group converted axioms by classification, dropping duplicates.
     */
    public Axioms organizeAxioms(List<ConvertedAxiom> converted) {
        return Axioms.organize(converted);
    }
}
