package org.tempo.smt;


import com.microsoft.z3.Expr;
import org.tempo.common.TempoException;

import java.util.*;

/**
 * <p>A network of nodes that repeatedly merge the routes of their
 * predecessors. Each node starts from its initial value, and at every
 * round receives the route of each predecessor through the transfer
 * function of the connecting edge.</p>
 *
 * <p>Routes are Z3 expressions of the sort given by the route type. The
 * merge function should be associative, commutative and idempotent
 * (see {@link MergeChecker}).</p>
 *
 * <p>A network cannot be changed once it is built and never holds
 * solver state, so it can be shared by concurrent checks.</p>
 */
public class Network {

    protected final Topology _topology;

    protected final SmtType _routeType;

    protected final Map<Edge, RouteFunction> _transferFunctions;

    protected final MergeFunction _mergeFunction;

    protected final Map<String, RouteValue> _initialValues;

    protected final List<SymbolicValue> _symbolics;

    protected final InitialValuePolicy _policy;

    protected final VerificationOptions _options;

    public Network(Topology topology, SmtType routeType, Map<Edge, RouteFunction> transferFunctions,
            MergeFunction mergeFunction, Map<String, RouteValue> initialValues,
            List<? extends SymbolicValue> symbolics) {
        this(topology, routeType, transferFunctions, mergeFunction, initialValues, symbolics,
                InitialValuePolicy.PERSISTENT, VerificationOptions.DEFAULT);
    }

    public Network(Topology topology, SmtType routeType, Map<Edge, RouteFunction> transferFunctions,
            MergeFunction mergeFunction, Map<String, RouteValue> initialValues,
            List<? extends SymbolicValue> symbolics, InitialValuePolicy policy, VerificationOptions options) {
        _topology = topology;
        _routeType = routeType;
        _transferFunctions = Collections.unmodifiableMap(new LinkedHashMap<>(transferFunctions));
        _mergeFunction = mergeFunction;
        _initialValues = Collections.unmodifiableMap(new LinkedHashMap<>(initialValues));
        _symbolics = Collections.unmodifiableList(new ArrayList<>(symbolics));
        _policy = policy;
        _options = options;
        validate();
    }

    /**
     * Copy the definition of another network.
     */
    protected Network(Network other) {
        this(other, other._options);
    }

    private Network(Network other, VerificationOptions options) {
        _topology = other._topology;
        _routeType = other._routeType;
        _transferFunctions = other._transferFunctions;
        _mergeFunction = other._mergeFunction;
        _initialValues = other._initialValues;
        _symbolics = other._symbolics;
        _policy = other._policy;
        _options = options;
    }

    private void validate() {
        for (Edge edge : _topology.getEdges()) {
            if (!_transferFunctions.containsKey(edge)) {
                throw new TempoException("Missing transfer function for edge " + edge);
            }
        }
        for (Edge edge : _transferFunctions.keySet()) {
            if (!_topology.hasNode(edge.getTo())
                    || !_topology.getNeighbors(edge.getTo()).contains(edge.getFrom())) {
                throw new TempoException("Transfer function given for unknown edge " + edge);
            }
        }
        checkNodeKeys(_initialValues, "initial value");
        Set<String> names = new HashSet<>();
        for (SymbolicValue sv : _symbolics) {
            if (!names.add(sv.getName())) {
                throw new TempoException("Duplicate symbolic value \"" + sv.getName() + "\"");
            }
        }
    }

    /**
     * Check that a per-node map has an entry for exactly the nodes of the topology.
     */
    protected void checkNodeKeys(Map<String, ?> map, String what) {
        if (map == null) {
            throw new TempoException("Missing " + what + "s");
        }
        for (String node : _topology.getNodes()) {
            if (map.get(node) == null) {
                throw new TempoException("Missing " + what + " for node \"" + node + "\"");
            }
        }
        for (String node : map.keySet()) {
            if (!_topology.hasNode(node)) {
                throw new TempoException("The " + what + " is given for unknown node \"" + node + "\"");
            }
        }
    }

    /**
     * Compute the route of a node at the next round from the current
     * routes of its predecessors.
     * @param enc  The encoder of the query
     * @param node  The node to update
     * @param routes  The current routes, containing at least every predecessor
     * @return The merged route
     */
    public Expr update(Encoder enc, String node, Map<String, Expr> routes) {
        List<String> preds = _topology.getNeighbors(node);
        Expr init = _initialValues.get(node).apply(enc);
        if (preds.isEmpty()) {
            return init;
        }
        Expr acc = null;
        if (_policy == InitialValuePolicy.PERSISTENT) {
            acc = init;
        }
        for (String pred : preds) {
            RouteFunction transfer = _transferFunctions.get(new Edge(pred, node));
            Expr transferred = transfer.apply(enc, routes.get(pred));
            acc = (acc == null) ? transferred : _mergeFunction.apply(enc, acc, transferred);
        }
        return acc;
    }

    /**
     * Create an encoder scoped by the symbolic values of this network.
     */
    public Encoder newEncoder(String name) {
        return new Encoder(name, _symbolics, _options);
    }

    /**
     * A copy of this network with different options.
     */
    public Network withOptions(VerificationOptions options) {
        return new Network(this, options);
    }

    protected void checkNode(String node) {
        if (!_topology.hasNode(node)) {
            throw new TempoException("Unknown node \"" + node + "\"");
        }
    }

    /*
     * Getters and setters
     */

    public Topology getTopology() {
        return _topology;
    }

    public SmtType getRouteType() {
        return _routeType;
    }

    public Map<Edge, RouteFunction> getTransferFunctions() {
        return _transferFunctions;
    }

    public MergeFunction getMergeFunction() {
        return _mergeFunction;
    }

    public Map<String, RouteValue> getInitialValues() {
        return _initialValues;
    }

    public List<SymbolicValue> getSymbolics() {
        return _symbolics;
    }

    public InitialValuePolicy getPolicy() {
        return _policy;
    }

    public VerificationOptions getOptions() {
        return _options;
    }
}
