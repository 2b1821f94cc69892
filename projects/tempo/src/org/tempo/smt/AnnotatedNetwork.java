package org.tempo.smt;


import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Model;
import org.tempo.smt.utils.ParallelUtils;

import java.util.*;
import java.util.concurrent.Callable;
import java.util.function.BiFunction;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * <p>A network together with an annotation for every node: an invariant
 * of the node's route at every logical time. The annotations are checked
 * modularly, one node at a time.</p>
 *
 * <ul>
 *     <li>Base: the initial route of a node satisfies its annotation at time 0.</li>
 *     <li>Inductive: if the predecessors' routes satisfy their annotations at
 *     time t-1, the merged route satisfies the node's annotation at time t.</li>
 *     <li>Safety: the annotation of a node implies its modular property.</li>
 * </ul>
 *
 * <p>When all three checks pass, every node satisfies its modular property
 * at every time. {@link #checkMonolithic()} instead checks the monolithic
 * properties against every stable state of the whole network.</p>
 *
 * <p>Every check returns an empty optional when it is proved and a
 * counterexample otherwise.</p>
 */
public class AnnotatedNetwork extends Network {

    private static final Logger LOGGER = Logger.getLogger(AnnotatedNetwork.class.getName());

    private static final String TIME = "time";

    private final Map<String, TemporalPredicate> _annotations;

    private final Map<String, TemporalPredicate> _modularProperties;

    private final Map<String, RoutePredicate> _monolithicProperties;

    public AnnotatedNetwork(Network net, Map<String, TemporalPredicate> annotations,
            Map<String, TemporalPredicate> modularProperties,
            Map<String, RoutePredicate> monolithicProperties) {
        super(net);
        _annotations = copy(annotations, "annotation");
        _modularProperties = copy(modularProperties, "modular property");
        _monolithicProperties = copy(monolithicProperties, "monolithic property");
    }

    /**
     * Build the properties from a stable property, which must hold from
     * the converge time on, and a safety property, which must always hold.
     */
    public AnnotatedNetwork(Network net, Map<String, TemporalPredicate> annotations,
            Map<String, RoutePredicate> stableProperties, Map<String, RoutePredicate> safetyProperties,
            long convergeTime) {
        super(net);
        _annotations = copy(annotations, "annotation");
        checkNodeKeys(stableProperties, "stable property");
        checkNodeKeys(safetyProperties, "safety property");
        _modularProperties = Collections.unmodifiableMap(_topology.mapNodes(node ->
                Lang.Intersect(
                        Lang.Finally(convergeTime, stableProperties.get(node)),
                        Lang.Globally(safetyProperties.get(node)))));
        _monolithicProperties = Collections.unmodifiableMap(_topology.mapNodes(node ->
                Lang.And(stableProperties.get(node), safetyProperties.get(node))));
    }

    public AnnotatedNetwork(Topology topology, SmtType routeType,
            Map<Edge, RouteFunction> transferFunctions, MergeFunction mergeFunction,
            Map<String, RouteValue> initialValues, List<? extends SymbolicValue> symbolics,
            Map<String, TemporalPredicate> annotations,
            Map<String, TemporalPredicate> modularProperties,
            Map<String, RoutePredicate> monolithicProperties) {
        this(new Network(topology, routeType, transferFunctions, mergeFunction, initialValues,
                symbolics), annotations, modularProperties, monolithicProperties);
    }

    public AnnotatedNetwork(Topology topology, SmtType routeType,
            Map<Edge, RouteFunction> transferFunctions, MergeFunction mergeFunction,
            Map<String, RouteValue> initialValues, List<? extends SymbolicValue> symbolics,
            Map<String, TemporalPredicate> annotations,
            Map<String, RoutePredicate> stableProperties, Map<String, RoutePredicate> safetyProperties,
            long convergeTime) {
        this(new Network(topology, routeType, transferFunctions, mergeFunction, initialValues,
                symbolics), annotations, stableProperties, safetyProperties, convergeTime);
    }

    private AnnotatedNetwork(AnnotatedNetwork other, VerificationOptions options) {
        super(other.toNetwork().withOptions(options));
        _annotations = other._annotations;
        _modularProperties = other._modularProperties;
        _monolithicProperties = other._monolithicProperties;
    }

    private <T> Map<String, T> copy(Map<String, T> map, String what) {
        checkNodeKeys(map, what);
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    private Network toNetwork() {
        return new Network(this);
    }

    @Override
    public AnnotatedNetwork withOptions(VerificationOptions options) {
        return new AnnotatedNetwork(this, options);
    }

    /*
     * Base check
     */

    public Optional<State> checkBaseCase(String node) {
        checkNode(node);
        try (Encoder enc = newEncoder("Base check at " + node)) {
            Expr route = enc.freshRoute(node + "-route", _routeType);
            enc.add("initial value", enc.Eq(route, _initialValues.get(node).apply(enc)));
            enc.add("negated annotation",
                    enc.Not(_annotations.get(node).apply(enc, route, enc.Int(0))));
            Optional<Model> model = enc.solve();
            Optional<State> result = model.map(m ->
                    new BaseState(node, enc.evaluate(m, route), enc.symbolicAssignment(m)));
            logOutcome(SmtCheck.BASE, node, result);
            return result;
        }
    }

    public Optional<State> checkBaseCase() {
        return forEachNode(this::checkBaseCase);
    }

    /*
     * Inductive check
     */

    public Optional<State> checkInductive(String node) {
        checkNode(node);
        List<String> preds = _topology.getNeighbors(node);
        try (Encoder enc = newEncoder("Inductive check at " + node)) {
            Map<String, Expr> routes = new LinkedHashMap<>();
            for (String pred : preds) {
                routes.put(pred, enc.freshRoute(pred + "-route", _routeType));
            }
            ArithExpr time = enc.freshTime(TIME);
            enc.add("time is positive", enc.Gt(time, enc.Int(0)));
            ArithExpr previous = enc.Sub(time, enc.Int(1));
            for (String pred : preds) {
                enc.add("annotation of " + pred,
                        _annotations.get(pred).apply(enc, routes.get(pred), previous));
            }
            Expr newRoute = update(enc, node, routes);
            enc.add("negated annotation",
                    enc.Not(_annotations.get(node).apply(enc, newRoute, time)));
            Optional<Model> model = enc.solve();
            Optional<State> result = model.map(m -> {
                Map<String, String> neighborRoutes = new LinkedHashMap<>();
                routes.forEach((pred, r) -> neighborRoutes.put(pred, enc.evaluate(m, r)));
                return new InductiveState(node, enc.evaluate(m, newRoute), neighborRoutes,
                        enc.evaluate(m, time), enc.symbolicAssignment(m));
            });
            logOutcome(SmtCheck.INDUCTIVE, node, result);
            return result;
        }
    }

    public Optional<State> checkInductive() {
        return forEachNode(this::checkInductive);
    }

    /*
     * Safety check
     */

    public Optional<State> checkAssertions(String node) {
        checkNode(node);
        try (Encoder enc = newEncoder("Safety check at " + node)) {
            Expr route = enc.freshRoute(node + "-route", _routeType);
            ArithExpr time = enc.freshTime(TIME);
            enc.add("annotation", _annotations.get(node).apply(enc, route, time));
            enc.add("negated property",
                    enc.Not(_modularProperties.get(node).apply(enc, route, time)));
            Optional<Model> model = enc.solve();
            Optional<State> result = model.map(m -> new SafetyState(node, enc.evaluate(m, route),
                    enc.evaluate(m, time), enc.symbolicAssignment(m)));
            logOutcome(SmtCheck.SAFETY, node, result);
            return result;
        }
    }

    public Optional<State> checkAssertions() {
        return forEachNode(this::checkAssertions);
    }

    /*
     * Whole annotation checks
     */

    /**
     * Run the base, inductive and safety checks of one node, in that order,
     * stopping at the first failure.
     */
    public Optional<State> checkAnnotations(String node) {
        Optional<State> result = checkBaseCase(node);
        if (result.isPresent()) {
            return result;
        }
        result = checkInductive(node);
        if (result.isPresent()) {
            return result;
        }
        return checkAssertions(node);
    }

    /**
     * Run the base checks of every node, then the inductive checks, then
     * the safety checks, stopping at the first phase that fails.
     */
    public Optional<State> checkAnnotations() {
        Optional<State> result = checkBaseCase();
        LOGGER.info("Base checks " + verdict(result));
        if (result.isPresent()) {
            return result;
        }
        result = checkInductive();
        LOGGER.info("Inductive checks " + verdict(result));
        if (result.isPresent()) {
            return result;
        }
        result = checkAssertions();
        LOGGER.info("Safety checks " + verdict(result));
        return result;
    }

    /**
     * Check the annotations of every node in parallel, passing each node's
     * check to the collector, which decides when and whether to run it.
     * @return The collector's result for every node, in node order
     */
    public Map<String, Optional<State>> checkAnnotationsWith(
            BiFunction<String, Supplier<Optional<State>>, Optional<State>> collector) {
        List<String> nodes = _topology.getNodes();
        List<Callable<Optional<State>>> tasks = new ArrayList<>();
        for (String node : nodes) {
            tasks.add(() -> collector.apply(node, () -> checkAnnotations(node)));
        }
        List<Optional<State>> results = ParallelUtils.invokeAll(tasks, _options.getParallelism());
        Map<String, Optional<State>> byNode = new LinkedHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            byNode.put(nodes.get(i), results.get(i));
        }
        return byNode;
    }

    /*
     * Monolithic check
     */

    /**
     * Check that every stable state of the network satisfies the
     * monolithic properties. Ignores the annotations.
     */
    public Optional<State> checkMonolithic() {
        try (Encoder enc = newEncoder("Monolithic check")) {
            Map<String, Expr> routes = _topology.mapNodes(node ->
                    enc.freshRoute(node + "-route", _routeType));
            for (String node : _topology.getNodes()) {
                enc.add("stable route at " + node,
                        enc.Eq(routes.get(node), update(enc, node, routes)));
            }
            BoolExpr properties = enc.True();
            for (String node : _topology.getNodes()) {
                properties = enc.And(properties,
                        _monolithicProperties.get(node).apply(enc, routes.get(node)));
            }
            enc.add("negated properties", enc.Not(properties));
            Optional<Model> model = enc.solve();
            if (model.isPresent()) {
                Model m = model.get();
                Map<String, String> values = new LinkedHashMap<>();
                routes.forEach((node, r) -> values.put(node, enc.evaluate(m, r)));
                LOGGER.info("The monolithic check failed");
                return Optional.of(new MonolithicState(values, enc.symbolicAssignment(m)));
            }
            LOGGER.info("The monolithic check passed");
            return Optional.empty();
        }
    }

    private Optional<State> forEachNode(NodeCheck check) {
        List<Callable<Optional<State>>> tasks = new ArrayList<>();
        for (String node : _topology.getNodes()) {
            tasks.add(() -> check.run(node));
        }
        return ParallelUtils.firstPresent(tasks, _options.getParallelism());
    }

    private static void logOutcome(SmtCheck check, String node, Optional<State> result) {
        LOGGER.fine(() -> check + " check at " + node + " " + verdict(result));
    }

    private static String verdict(Optional<State> result) {
        return result.isPresent() ? "failed" : "passed";
    }

    @FunctionalInterface
    private interface NodeCheck {
        Optional<State> run(String node);
    }

    /*
     * Getters and setters
     */

    public Map<String, TemporalPredicate> getAnnotations() {
        return _annotations;
    }

    public Map<String, TemporalPredicate> getModularProperties() {
        return _modularProperties;
    }

    public Map<String, RoutePredicate> getMonolithicProperties() {
        return _monolithicProperties;
    }
}
