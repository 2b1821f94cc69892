package org.tempo.smt.networks;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import org.tempo.common.TempoException;
import org.tempo.smt.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <p>Shortest paths to a destination. A route is the optional length of
 * the best known path, every edge adds one hop, and a node keeps the
 * shortest of the routes it receives.</p>
 */
public class ShortestPath {

    public static final OptionType ROUTE_TYPE = new OptionType(IntType.INSTANCE);

    /** The name of the symbolic destination index. */
    public static final String DESTINATION = "dest";

    private ShortestPath() {}

    /**
     * Shortest paths to a fixed destination, which starts with a path of
     * length 0 while every other node starts with no route.
     */
    public static Network network(Topology topology, String destination) {
        if (!topology.hasNode(destination)) {
            throw new TempoException("Unknown destination \"" + destination + "\"");
        }
        Map<String, RouteValue> initialValues = new LinkedHashMap<>();
        for (String node : topology.getNodes()) {
            if (node.equals(destination)) {
                initialValues.put(node, enc -> ROUTE_TYPE.some(enc, enc.Int(0)));
            } else {
                initialValues.put(node, ROUTE_TYPE::none);
            }
        }
        return network(topology, initialValues, Collections.emptyList());
    }

    /**
     * Shortest paths from arbitrary initial values, which may use the
     * given symbolic values.
     */
    public static Network network(Topology topology, Map<String, RouteValue> initialValues,
            List<? extends SymbolicValue> symbolics) {
        Map<Edge, RouteFunction> transfer = topology.mapEdges(edge ->
                Lang.Omap(ROUTE_TYPE, Lang.Incr(1)));
        return new Network(topology, ROUTE_TYPE, transfer, ROUTE_TYPE::min, initialValues, symbolics);
    }

    /**
     * Shortest paths to a destination chosen by the solver. The integer
     * symbolic {@value #DESTINATION} is the position of the destination
     * among the nodes of the topology.
     */
    public static Network symbolicDestination(Topology topology) {
        List<String> nodes = topology.getNodes();
        SymbolicValue dest = new SymbolicValue(DESTINATION, IntType.INSTANCE, (enc, d) ->
                enc.And(enc.Ge(d, enc.Int(0)), enc.Lt(d, enc.Int(nodes.size()))));
        Map<String, RouteValue> initialValues = new LinkedHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            long index = i;
            initialValues.put(nodes.get(i), enc -> enc.If(isDestination(enc, index),
                    ROUTE_TYPE.some(enc, enc.Int(0)), ROUTE_TYPE.none(enc)));
        }
        List<SymbolicValue> symbolics = new ArrayList<>();
        symbolics.add(dest);
        return network(topology, initialValues, symbolics);
    }

    /**
     * True when the node at the given position is the symbolic destination.
     */
    public static BoolExpr isDestination(Encoder enc, long index) {
        return enc.Eq(enc.getSymbolicValue(DESTINATION), enc.Int(index));
    }

    /**
     * The route is present with a path length of at most {@code bound}.
     */
    public static RoutePredicate hasLengthAtMost(long bound) {
        return (enc, r) -> enc.And(ROUTE_TYPE.isSome(enc, r),
                enc.Le((ArithExpr) ROUTE_TYPE.getValue(enc, r), enc.Int(bound)));
    }
}
