package org.tempo.smt;


import com.microsoft.z3.*;
import org.tempo.common.TempoException;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;


/**
 * <p>A class responsible for building and solving a single query.
 * Every check of the engine creates its own encoder, which owns a
 * fresh Z3 context and solver, so encoders are never shared between
 * threads and the context is released by {@link #close()}.</p>
 *
 * <p>The encoder instantiates one free variable for every symbolic
 * value declared by the network, and {@link #solve()} always conjoins
 * their constraints with whatever has been added to the query. Route,
 * predicate and transfer functions receive the encoder to build their
 * expressions with the helper methods below.</p>
 */
public class Encoder implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(Encoder.class.getName());

    static final String SYMBOLIC_CONSTRAINTS = "symbolic constraints";

    private final String _name;

    private final VerificationOptions _options;

    private final Context _ctx;

    private final Solver _solver;

    private final UnsatCore _unsatCore;

    private final Map<SmtType, Sort> _sorts;

    private final List<SymbolicValue> _symbolics;

    private final Map<String, Expr> _symbolicVars;

    private final List<Expr> _allVariables;

    private List<String> _lastCore;

    /**
     * Create an encoder for a query.
     * @param name  A description of the query, used when logging
     * @param symbolics  The symbolic values that scope the query
     * @param options  The verification options
     */
    public Encoder(String name, List<? extends SymbolicValue> symbolics, VerificationOptions options) {
        _name = name;
        _options = options;
        _ctx = new Context();
        _solver = _ctx.mkSolver();
        _unsatCore = new UnsatCore(options.getTrackUnsatCore());
        _sorts = new HashMap<>();
        _symbolics = new ArrayList<>(symbolics);
        _symbolicVars = new LinkedHashMap<>();
        _allVariables = new ArrayList<>();
        _lastCore = Collections.emptyList();
        initSymbolicVariables();
    }

    private void initSymbolicVariables() {
        for (SymbolicValue sv : _symbolics) {
            if (_symbolicVars.containsKey(sv.getName())) {
                throw new TempoException("Duplicate symbolic value \"" + sv.getName() + "\"");
            }
            Expr var = _ctx.mkConst(sv.getName(), getSort(sv.getType()));
            _symbolicVars.put(sv.getName(), var);
            _allVariables.add(var);
        }
    }

    /**
     * Return the Z3 sort of a type, building it on first use.
     */
    public Sort getSort(SmtType type) {
        Sort sort = _sorts.get(type);
        if (sort == null) {
            sort = type.mkSort(this);
            _sorts.put(type, sort);
        }
        return sort;
    }

    /**
     * Return the variable of a declared symbolic value.
     */
    public Expr getSymbolicValue(String name) {
        Expr var = _symbolicVars.get(name);
        if (var == null) {
            throw new TempoException("Symbolic value \"" + name + "\" is not declared by the network");
        }
        return var;
    }

    /**
     * The conjunction of the constraints of every declared symbolic value.
     */
    public BoolExpr allConstraints() {
        BoolExpr acc = True();
        for (SymbolicValue sv : _symbolics) {
            acc = And(acc, sv.constraint(this));
        }
        return acc;
    }

    /**
     * Create a fresh route variable. The name is only a prefix, so the
     * variable never coincides with a symbolic value of the same name.
     */
    public Expr freshRoute(String name, SmtType type) {
        Expr var = _ctx.mkFreshConst(name, getSort(type));
        _allVariables.add(var);
        return var;
    }

    /**
     * Create a fresh time variable, distinct from every symbolic value.
     */
    public ArithExpr freshTime(String name) {
        ArithExpr var = (ArithExpr) _ctx.mkFreshConst(name, _ctx.getIntSort());
        _allVariables.add(var);
        return var;
    }

    // Create a symbolic boolean
    public BoolExpr Bool(boolean val) {
        return _ctx.mkBool(val);
    }

    // Symbolic boolean negation
    public BoolExpr Not(BoolExpr e) {
        return _ctx.mkNot(e);
    }

    // Symbolic boolean disjunction
    public BoolExpr Or(BoolExpr... vals) {
        return _ctx.mkOr(vals);
    }

    // Symbolic boolean implication
    public BoolExpr Implies(BoolExpr e1, BoolExpr e2) {
        return _ctx.mkImplies(e1, e2);
    }

    // Symbolic boolean conjunction
    public BoolExpr And(BoolExpr... vals) {
        return _ctx.mkAnd(vals);
    }

    // Symbolic true value
    public BoolExpr True() {
        return _ctx.mkBool(true);
    }

    // Symbolic false value
    public BoolExpr False() {
        return _ctx.mkBool(false);
    }

    // Symbolic arithmetic less than
    public BoolExpr Lt(Expr e1, Expr e2) {
        if (e1 instanceof BoolExpr && e2 instanceof BoolExpr) {
            return And((BoolExpr) e2, Not((BoolExpr) e1));
        }
        if (e1 instanceof ArithExpr && e2 instanceof ArithExpr) {
            return _ctx.mkLt((ArithExpr) e1, (ArithExpr) e2);
        }
        throw new TempoException("Invalid call to Lt in " + _name);
    }

    // Symbolic greater than
    public BoolExpr Gt(Expr e1, Expr e2) {
        if (e1 instanceof BoolExpr && e2 instanceof BoolExpr) {
            return And((BoolExpr) e1, Not((BoolExpr) e2));
        }
        if (e1 instanceof ArithExpr && e2 instanceof ArithExpr) {
            return _ctx.mkGt((ArithExpr) e1, (ArithExpr) e2);
        }
        throw new TempoException("Invalid call to Gt in " + _name);
    }

    // Symbolic greater than or equal to
    public BoolExpr Ge(Expr e1, Expr e2) {
        if (e1 instanceof ArithExpr && e2 instanceof ArithExpr) {
            return _ctx.mkGe((ArithExpr) e1, (ArithExpr) e2);
        }
        throw new TempoException("Invalid call to Ge in " + _name);
    }

    // Symbolic less than or equal to
    public BoolExpr Le(Expr e1, Expr e2) {
        if (e1 instanceof ArithExpr && e2 instanceof ArithExpr) {
            return _ctx.mkLe((ArithExpr) e1, (ArithExpr) e2);
        }
        throw new TempoException("Invalid call to Le in " + _name);
    }

    // Symbolic equality of expressions
    public BoolExpr Eq(Expr e1, Expr e2) {
        return _ctx.mkEq(e1, e2);
    }

    // Symbolic arithmetic addition
    public ArithExpr Sum(ArithExpr e1, ArithExpr e2) {
        return _ctx.mkAdd(e1, e2);
    }

    // Symbolic arithmetic subtraction
    public ArithExpr Sub(ArithExpr e1, ArithExpr e2) {
        return _ctx.mkSub(e1, e2);
    }

    // Create a symbolic integer
    public ArithExpr Int(long l) {
        return _ctx.mkInt(l);
    }

    // Symbolic if-then-else for booleans
    public BoolExpr If(BoolExpr cond, BoolExpr case1, BoolExpr case2) {
        return (BoolExpr) _ctx.mkITE(cond, case1, case2);
    }

    // Symbolic if-then-else for arithmetic
    public ArithExpr If(BoolExpr cond, ArithExpr case1, ArithExpr case2) {
        return (ArithExpr) _ctx.mkITE(cond, case1, case2);
    }

    // Symbolic if-then-else for any other sort
    public Expr If(BoolExpr cond, Expr case1, Expr case2) {
        return _ctx.mkITE(cond, case1, case2);
    }

    /**
     * Add a labelled conjunct to the query.
     */
    public void add(String label, BoolExpr e) {
        _unsatCore.track(_solver, _ctx, label, e);
    }

    public void push() {
        _solver.push();
    }

    public void pop() {
        _solver.pop();
    }

    /**
     * <p>Conjoin the symbolic constraints with the query and solve it.</p>
     *
     * @return The model of a satisfying assignment, or empty if the query
     * is unsatisfiable.
     * @throws TempoException if the solver cannot decide the query.
     */
    public Optional<Model> solve() {
        add(SYMBOLIC_CONSTRAINTS, allConstraints());
        return check();
    }

    /**
     * Solve the query as it stands, without adding the symbolic constraints again.
     */
    Optional<Model> check() {
        if (_options.getPrintFormulas()) {
            LOGGER.info(_name + ":\n" + _solver.toString());
        }

        long start = System.currentTimeMillis();
        Status status = _solver.check();
        long time = System.currentTimeMillis() - start;
        LOGGER.log(Level.FINE, () -> _name + ": " + status + " in " + time + "ms");

        if (status == Status.UNSATISFIABLE) {
            _lastCore = _unsatCore.getCore(_solver);
            if (_unsatCore.isTracking()) {
                LOGGER.fine(_name + ": unsat core " + _lastCore);
            }
            return Optional.empty();
        } else if (status == Status.UNKNOWN) {
            throw new TempoException("ERROR: satisfiability unknown for " + _name + ": "
                    + _solver.getReasonUnknown());
        } else {
            return Optional.of(_solver.getModel());
        }
    }

    /**
     * Render the value of an expression in a model.
     */
    public String evaluate(Model m, Expr e) {
        return m.evaluate(e, true).toString();
    }

    /**
     * The value of every declared symbolic value in a model.
     */
    public SortedMap<String, String> symbolicAssignment(Model m) {
        SortedMap<String, String> assignment = new TreeMap<>();
        _symbolicVars.forEach((name, var) -> assignment.put(name, evaluate(m, var)));
        return assignment;
    }

    /**
     * Labels of the conjuncts used to refute the last unsatisfiable query.
     * Only populated when unsat core tracking is enabled.
     */
    public List<String> getLastUnsatCore() {
        return _lastCore;
    }

    @Override
    public void close() {
        _ctx.close();
    }

    /*
     * Getters and setters
     */

    public Context getCtx() {
        return _ctx;
    }

    public String getName() {
        return _name;
    }

    public VerificationOptions getOptions() {
        return _options;
    }

    List<Expr> getAllVariables() {
        return _allVariables;
    }

    Solver getSolver() {
        return _solver;
    }
}
