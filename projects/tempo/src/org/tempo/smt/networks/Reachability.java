package org.tempo.smt.networks;

import org.tempo.common.TempoException;
import org.tempo.smt.*;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reachability of a destination: a route only records that some path
 * exists, and a node keeps any route it receives.
 */
public class Reachability {

    public static final OptionType ROUTE_TYPE = new OptionType(UnitType.INSTANCE);

    private Reachability() {}

    public static RouteValue reachable() {
        return enc -> ROUTE_TYPE.some(enc, UnitType.INSTANCE.value(enc));
    }

    public static Network network(Topology topology, String destination) {
        if (!topology.hasNode(destination)) {
            throw new TempoException("Unknown destination \"" + destination + "\"");
        }
        Map<String, RouteValue> initialValues = new LinkedHashMap<>();
        for (String node : topology.getNodes()) {
            if (node.equals(destination)) {
                initialValues.put(node, reachable());
            } else {
                initialValues.put(node, ROUTE_TYPE::none);
            }
        }
        return network(topology, initialValues, Collections.emptyList());
    }

    public static Network network(Topology topology, Map<String, RouteValue> initialValues,
            List<? extends SymbolicValue> symbolics) {
        Map<Edge, RouteFunction> transfer = topology.mapEdges(edge -> Lang.Identity());
        return new Network(topology, ROUTE_TYPE, transfer, ROUTE_TYPE::orElse, initialValues, symbolics);
    }
}
