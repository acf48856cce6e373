package com.galois.proofgen.metamath;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.galois.proofgen.GenerationOptions;
import com.galois.proofgen.UnsupportedPatternException;
import com.galois.proofgen.metamath.ast.Application;
import com.galois.proofgen.metamath.ast.AxiomaticStatement;
import com.galois.proofgen.metamath.ast.ConstantStatement;
import com.galois.proofgen.metamath.ast.Database;
import com.galois.proofgen.metamath.ast.FloatingStatement;
import com.galois.proofgen.metamath.ast.Metavariable;
import com.galois.proofgen.metamath.ast.Statement;
import com.galois.proofgen.metamath.ast.Term;
import com.galois.proofgen.metamath.ast.VariableStatement;
import com.galois.proofgen.pattern.EVar;
import com.galois.proofgen.pattern.NotationDefinition;
import com.galois.proofgen.pattern.NotationRegistry;
import com.galois.proofgen.pattern.Pattern;
import com.galois.proofgen.pattern.Patterns;
import com.galois.proofgen.pattern.SVar;

/**
 * Imports the symbols and notations of a Metamath database.
 *
 * <p>
 * Statements are read once, top to bottom.  <code>#Notation</code> axioms
 * become notation definitions, <code>#Symbol</code> axioms declare
 * symbols and <code>#Pattern</code> axioms on quoted constants declare
 * domain values.
 */
public final class MetamathConverter {
    public static final String BOT = "\\bot";

    private static final java.util.regex.Pattern QUOTED = java.util.regex.Pattern.compile("\"\\S+\"");

    private final Database database;
    private final GenerationOptions options;
    private final Scope scope = new Scope();
    private final Set<String> constants = new HashSet<String>();
    private final Map<String, Metavariable> variables = new HashMap<String, Metavariable>();
    private final NotationRegistry notations = new NotationRegistry();

    public MetamathConverter(Database database) {
        this(database, new GenerationOptions());
    }

    public MetamathConverter(Database database, GenerationOptions options) {
        if (database == null) throw new NullPointerException("database");
        if (options == null) throw new NullPointerException("options");
        this.database = database;
        this.options = options;
        notations.register(new NotationDefinition(BOT, 0, Patterns.mu(0, SVar.of(0))));
        for (Statement s : database.statements()) {
            importStatement(s);
        }
    }

    public Database database() {
        return database;
    }

    public NotationRegistry notations() {
        return notations;
    }

    public Set<String> symbols() {
        return scope.symbols();
    }

    public Set<String> domainValues() {
        return scope.domainValues();
    }

    private void importStatement(Statement s) {
        if (s instanceof ConstantStatement) {
            constants.addAll(((ConstantStatement) s).constants());
        } else if (s instanceof VariableStatement) {
            for (Metavariable v : ((VariableStatement) s).metavariables()) {
                variables.put(v.name(), v);
            }
        } else if (s instanceof FloatingStatement) {
            importFloating((FloatingStatement) s);
        } else if (s instanceof AxiomaticStatement) {
            importAxiom((AxiomaticStatement) s);
        } else {
            options.logStatus("Skipping statement " + s);
        }
    }

    /** Return the symbol of a term if it is an application, else null. */
    private static String head(Term t) {
        return t instanceof Application ? ((Application) t).symbol() : null;
    }

    private void importFloating(FloatingStatement s) {
        List<Term> terms = s.terms();
        Metavariable var = null;
        if (terms.size() == 2 && terms.get(1) instanceof Metavariable) {
            var = variables.get(((Metavariable) terms.get(1)).name());
        }
        String typecode = terms.isEmpty() ? null : head(terms.get(0));
        if (var == null || typecode == null) {
            options.logStatus("Unknown floating statement " + s);
            return;
        }

        if (typecode.equals("#Pattern") || typecode.equals("#Variable") || typecode.equals("#Symbol")) {
            scope.addMetaVariable(var);
        } else if (typecode.equals("#ElementVariable")) {
            scope.addElementVar(var);
        } else if (typecode.equals("#SetVariable")) {
            scope.addSetVar(var);
        } else {
            options.logStatus("Unknown floating statement " + s);
        }
    }

    private void importAxiom(AxiomaticStatement s) {
        List<Term> terms = s.terms();
        String kind = terms.isEmpty() ? null : head(terms.get(0));
        Term subject = terms.size() > 1 ? terms.get(1) : null;

        if ("#Pattern".equals(kind) && subject instanceof Application
            && constants.contains(head(subject)) && QUOTED.matcher(head(subject)).matches()) {
            scope.addDomainValue(head(subject));
        } else if ("#Symbol".equals(kind) && subject instanceof Application
                   && ((Application) subject).subterms().isEmpty()) {
            scope.addSymbol(head(subject));
        } else if ("#Notation".equals(kind) && subject instanceof Application && terms.size() == 3) {
            importNotation(s.label(), (Application) subject, terms.get(2));
        } else {
            options.logStatus("Unknown axiom " + s);
        }
    }

    private void importNotation(String label, Application lhs, Term body) {
        List<Metavariable> args = new ArrayList<Metavariable>(lhs.subterms().size());
        for (Term t : lhs.subterms()) {
            if (!(t instanceof Metavariable)) {
                String msg = String.format("Notation %s in %s has an argument that is not a variable.",
                                           lhs.symbol(), label);
                throw new UnsupportedPatternException(msg);
            }
            args.add((Metavariable) t);
        }
        Pattern template = toPattern(scope.reduceToArgs(args), body);
        notations.register(new NotationDefinition(lhs.symbol(), args.size(), template));
    }

    private Pattern toPattern(Scope s, Term term) {
        if (term instanceof Metavariable) {
            return s.resolve(((Metavariable) term).name());
        }

        Application app = (Application) term;
        String symbol = app.symbol();
        List<Term> sub = app.subterms();
        if (symbol.equals("\\imp")) {
            checkArity(app, 2);
            return Patterns.implies(toPattern(s, sub.get(0)), toPattern(s, sub.get(1)));
        } else if (symbol.equals("\\app")) {
            checkArity(app, 2);
            return Patterns.app(toPattern(s, sub.get(0)), toPattern(s, sub.get(1)));
        } else if (symbol.equals("\\exists")) {
            checkArity(app, 2);
            Pattern var = toPattern(s, sub.get(0));
            if (!(var instanceof EVar)) {
                throw new UnsupportedPatternException("Binder of " + app + " is not an element variable.");
            }
            return Patterns.exists(((EVar) var).id(), toPattern(s, sub.get(1)));
        } else if (notations.contains(symbol)) {
            List<Pattern> args = new ArrayList<Pattern>(sub.size());
            for (Term t : sub) {
                args.add(toPattern(s, t));
            }
            return notations.lookup(symbol).apply(args);
        } else if (s.isSymbol(symbol) && sub.isEmpty()) {
            return s.resolve(symbol);
        }
        throw new UnsupportedPatternException("Unsupported term " + term);
    }

    private static void checkArity(Application app, int n) {
        if (app.subterms().size() != n) {
            String msg = String.format("%s expects %d arguments, but got %d.",
                                       app.symbol(), n, app.subterms().size());
            throw new UnsupportedPatternException(msg);
        }
    }
}
